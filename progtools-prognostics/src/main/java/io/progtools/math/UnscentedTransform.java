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

/// Recombines weighted sigma points into a mean and covariance.
///
/// `mean = Σ Wm[i]·σ[i]` and `cov = Σ Wc[i]·(σ[i] - mean)(σ[i] - mean)ᵀ + noise`.
/// A NaN in any point propagates into the result; callers use that to mark
/// quantities that are not resolved for every point.
public final class UnscentedTransform {

    private UnscentedTransform() {
    }

    /// Mean and covariance of a transformed distribution.
    ///
    /// @param mean weighted mean of the points
    /// @param cov weighted covariance of the points
    public record Result(double[] mean, double[][] cov) {
    }

    /// @param sigmas the points, `[count][dim]`
    /// @param wm mean weights
    /// @param wc covariance weights
    /// @param noiseCov additive noise covariance, or null
    /// @return the recombined moments
    public static Result transform(double[][] sigmas, double[] wm, double[] wc, double[][] noiseCov) {
        int dim = sigmas.length == 0 ? 0 : sigmas[0].length;
        double[] mean = new double[dim];
        for (int i = 0; i < sigmas.length; i++) {
            for (int k = 0; k < dim; k++) {
                mean[k] += wm[i] * sigmas[i][k];
            }
        }
        double[][] cov = new double[dim][dim];
        double[] y = new double[dim];
        for (int i = 0; i < sigmas.length; i++) {
            for (int k = 0; k < dim; k++) {
                y[k] = sigmas[i][k] - mean[k];
            }
            for (int r = 0; r < dim; r++) {
                for (int c = 0; c < dim; c++) {
                    cov[r][c] += wc[i] * y[r] * y[c];
                }
            }
        }
        if (noiseCov != null) {
            for (int r = 0; r < dim; r++) {
                for (int c = 0; c < dim; c++) {
                    cov[r][c] += noiseCov[r][c];
                }
            }
        }
        return new Result(mean, cov);
    }

    /// Cross covariance `Σ Wc[i]·(a[i] - meanA)(b[i] - meanB)ᵀ`.
    ///
    /// @return matrix of `dim(a) × dim(b)`
    public static double[][] crossCovariance(double[][] a, double[] meanA, double[][] b, double[] meanB, double[] wc) {
        int da = meanA.length;
        int db = meanB.length;
        double[][] out = new double[da][db];
        for (int i = 0; i < a.length; i++) {
            for (int r = 0; r < da; r++) {
                double dr = a[i][r] - meanA[r];
                for (int c = 0; c < db; c++) {
                    out[r][c] += wc[i] * dr * (b[i][c] - meanB[c]);
                }
            }
        }
        return out;
    }
}
