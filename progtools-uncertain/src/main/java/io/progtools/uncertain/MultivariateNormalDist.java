package io.progtools.uncertain;

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

import com.google.gson.annotations.SerializedName;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// A multivariate Gaussian distribution: keys, mean vector and covariance matrix.
///
/// ## Sampling
///
/// Samples are drawn as `mean + L·z` where `z` is standard normal and
/// `L = V·sqrt(Λ)` comes from the eigen-decomposition of the covariance.
/// Negative eigenvalues from round-off are clamped to zero, so singular
/// positive semi-definite covariances sample correctly. The factor is computed
/// once, on first use.
///
/// Components with a NaN mean or variance (for example an event that was never
/// reached) are left out of the decomposition. They sample as their mean, so a
/// NaN component stays NaN in every sample while the remaining components keep
/// their joint distribution.
///
/// The median of a Gaussian equals its mean.
@DistributionType(MultivariateNormalDist.TYPE)
public final class MultivariateNormalDist extends UncertainData {

    public static final String TYPE = "multivariate_normal";

    @SerializedName("keys")
    private final List<String> keys;

    @SerializedName("mean")
    private final double[] mean;

    @SerializedName("covariance")
    private final double[][] covariance;

    private transient KeySchema schema;
    private transient double[][] sqrtCov;

    /// @param schema the keys
    /// @param mean mean vector, one value per key
    /// @param covariance square covariance matrix, dimension equal to the key count
    /// @throws IllegalArgumentException if the dimensions do not match the key count
    public MultivariateNormalDist(KeySchema schema, double[] mean, double[][] covariance) {
        int d = schema.size();
        if (mean.length != d) {
            throw new IllegalArgumentException("Mean has " + mean.length + " values but there are "
                + d + " keys " + schema.keys());
        }
        if (covariance.length != d) {
            throw new IllegalArgumentException("Covariance has " + covariance.length + " rows but there are "
                + d + " keys " + schema.keys());
        }
        double[][] copy = new double[d][];
        for (int i = 0; i < d; i++) {
            if (covariance[i].length != d) {
                throw new IllegalArgumentException("Covariance row " + i + " has " + covariance[i].length
                    + " columns, expected " + d);
            }
            copy[i] = covariance[i].clone();
        }
        this.schema = schema;
        this.keys = new ArrayList<>(schema.keys());
        this.mean = mean.clone();
        this.covariance = copy;
    }

    public MultivariateNormalDist(LabeledVector mean, double[][] covariance) {
        this(mean.schema(), mean.toArray(), covariance);
    }

    @Override
    public KeySchema schema() {
        if (schema == null) {
            schema = KeySchema.of(keys);
        }
        return schema;
    }

    @Override
    public UnweightedSamples sample(int n, UniformRandomProvider rng) {
        requirePositiveCount(n);
        double[][] l = sqrtCov();
        NormalizedGaussianSampler gaussian = RandomGenerators.createGaussianSampler(rng);
        int d = mean.length;
        UnweightedSamples samples = new UnweightedSamples(schema());
        double[] z = new double[d];
        for (int s = 0; s < n; s++) {
            for (int k = 0; k < d; k++) {
                z[k] = gaussian.sample();
            }
            double[] x = mean.clone();
            for (int i = 0; i < d; i++) {
                for (int k = 0; k < d; k++) {
                    x[i] += l[i][k] * z[k];
                }
            }
            samples.add(new LabeledVector(schema(), x));
        }
        return samples;
    }

    private double[][] sqrtCov() {
        if (sqrtCov == null) {
            int d = mean.length;
            int[] resolved = resolvedIndices();
            double[][] l = new double[d][d];
            int r = resolved.length;
            if (r > 0) {
                double[][] block = new double[r][r];
                for (int i = 0; i < r; i++) {
                    for (int j = 0; j < r; j++) {
                        double c = covariance[resolved[i]][resolved[j]];
                        block[i][j] = Double.isFinite(c) ? c : 0.0;
                    }
                }
                EigenDecomposition eig = new EigenDecomposition(new Array2DRowRealMatrix(block, false));
                RealMatrix v = eig.getV();
                double[] values = eig.getRealEigenvalues();
                for (int k = 0; k < r; k++) {
                    double scale = Math.sqrt(Math.max(values[k], 0.0));
                    for (int i = 0; i < r; i++) {
                        l[resolved[i]][resolved[k]] = v.getEntry(i, k) * scale;
                    }
                }
            }
            sqrtCov = l;
        }
        return sqrtCov;
    }

    private int[] resolvedIndices() {
        int[] indices = new int[mean.length];
        int count = 0;
        for (int k = 0; k < mean.length; k++) {
            if (Double.isFinite(mean[k]) && Double.isFinite(covariance[k][k])) {
                indices[count++] = k;
            }
        }
        return Arrays.copyOf(indices, count);
    }

    @Override
    public LabeledVector mean() {
        return new LabeledVector(schema(), mean.clone());
    }

    @Override
    public LabeledVector median() {
        return mean();
    }

    @Override
    public double[][] cov() {
        double[][] copy = new double[covariance.length][];
        for (int i = 0; i < covariance.length; i++) {
            copy[i] = covariance[i].clone();
        }
        return copy;
    }

    @Override
    public MultivariateNormalDist add(double offset) {
        return new MultivariateNormalDist(mean().plus(offset), covariance);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MultivariateNormalDist)) return false;
        MultivariateNormalDist that = (MultivariateNormalDist) o;
        return keys.equals(that.keys) && Arrays.equals(mean, that.mean)
            && Arrays.deepEquals(covariance, that.covariance);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keys, Arrays.hashCode(mean), Arrays.deepHashCode(covariance));
    }

    @Override
    public String toString() {
        return "MultivariateNormalDist[mean=" + mean() + ", cov=" + Arrays.deepToString(covariance) + "]";
    }
}
