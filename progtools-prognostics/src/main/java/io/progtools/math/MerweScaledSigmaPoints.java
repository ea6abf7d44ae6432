package io.progtools.math;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.progtools.model.ConfigurationException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

/// Van der Merwe's scaled sigma points for `n` dimensions.
///
/// ## Parameters
///
/// | Name | Role | Typical |
/// |------|------|---------|
/// | alpha | spread of the points around the mean | 1e-3 to 1 |
/// | beta | prior knowledge of the distribution, 2 is optimal for Gaussians | 0 or 2 |
/// | kappa | secondary scaling | 0 or 3 - n |
///
/// With `λ = α²(n + κ) - n` the `2n + 1` points are the mean and
/// `mean ± column_i(L)` where `L·Lᵀ = (n + λ)·P`. The weights are
///
/// ```
/// Wm[0] = λ / (n + λ)
/// Wc[0] = Wm[0] + 1 - α² + β
/// Wm[i] = Wc[i] = 1 / (2(n + λ))
/// ```
public final class MerweScaledSigmaPoints {

    private static final double SYMMETRY_THRESHOLD = 1e-10;

    private final int n;
    private final double alpha;
    private final double beta;
    private final double kappa;
    private final double lambda;
    private final double[] wm;
    private final double[] wc;

    /// @throws ConfigurationException if `n + λ` is not positive
    public MerweScaledSigmaPoints(int n, double alpha, double beta, double kappa) {
        this.n = n;
        this.alpha = alpha;
        this.beta = beta;
        this.kappa = kappa;
        this.lambda = alpha * alpha * (n + kappa) - n;
        if (!(n + lambda > 0.0)) {
            throw new ConfigurationException("kappa", "Sigma point scaling n + lambda must be positive, was "
                + (n + lambda) + " for n=" + n + ", alpha=" + alpha + ", kappa=" + kappa);
        }
        int count = 2 * n + 1;
        this.wm = new double[count];
        this.wc = new double[count];
        double c = 0.5 / (n + lambda);
        for (int i = 1; i < count; i++) {
            wm[i] = c;
            wc[i] = c;
        }
        wm[0] = lambda / (n + lambda);
        wc[0] = wm[0] + (1.0 - alpha * alpha + beta);
    }

    public int dimension() {
        return n;
    }

    public int numSigmas() {
        return 2 * n + 1;
    }

    public double lambda() {
        return lambda;
    }

    public double alpha() {
        return alpha;
    }

    public double beta() {
        return beta;
    }

    public double kappa() {
        return kappa;
    }

    /// @return mean weights (copy)
    public double[] meanWeights() {
        return wm.clone();
    }

    /// @return covariance weights (copy)
    public double[] covarianceWeights() {
        return wc.clone();
    }

    /// Computes the sigma points of a Gaussian.
    ///
    /// @param mean the mean, length `n`
    /// @param cov the covariance, `n × n`, symmetric positive definite
    /// @return the points, `[2n + 1][n]`
    /// @throws org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException if the
    ///         scaled covariance has no Cholesky factor
    public double[][] sigmaPoints(double[] mean, double[][] cov) {
        if (mean.length != n) {
            throw new IllegalArgumentException("Expected mean of length " + n + ", got " + mean.length);
        }
        double[][] sigmas = new double[2 * n + 1][];
        sigmas[0] = mean.clone();
        if (n == 0) {
            return sigmas;
        }
        double scale = n + lambda;
        double[][] scaled = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                scaled[i][j] = scale * 0.5 * (cov[i][j] + cov[j][i]);
            }
        }
        RealMatrix l = new CholeskyDecomposition(new Array2DRowRealMatrix(scaled, false),
            SYMMETRY_THRESHOLD, 0.0).getL();
        for (int k = 0; k < n; k++) {
            double[] plus = mean.clone();
            double[] minus = mean.clone();
            for (int i = 0; i < n; i++) {
                double v = l.getEntry(i, k);
                plus[i] += v;
                minus[i] -= v;
            }
            sigmas[k + 1] = plus;
            sigmas[n + k + 1] = minus;
        }
        return sigmas;
    }
}
