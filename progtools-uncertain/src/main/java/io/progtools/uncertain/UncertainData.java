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

import org.apache.commons.rng.UniformRandomProvider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// A distribution over a labeled numeric vector.
///
/// ## Purpose
///
/// UncertainData is the belief representation shared by state estimators and
/// predictors. A state estimate, the state at a saved prediction time, and a
/// time-of-event prediction are all UncertainData over their own key set.
///
/// ## Family
///
/// ```
///                    ┌───────────────┐
///                    │ UncertainData │
///                    └───────┬───────┘
///          ┌─────────────────┼──────────────────────┐
///          ▼                 ▼                      ▼
///   ┌────────────┐   ┌──────────────────┐   ┌────────────────────────┐
///   │ ScalarData │   │ UnweightedSamples│   │ MultivariateNormalDist │
///   │ (1 point)  │   │ (empirical)      │   │ (mean, covariance)     │
///   └────────────┘   └──────────────────┘   └────────────────────────┘
/// ```
///
/// ## Contract
///
/// - Every returned vector uses exactly [#schema()] as its key set.
/// - [#cov()] is square with dimension equal to the key count.
/// - [#sample(int)] with `n <= 0` is rejected.
/// - [#percentageInBounds(double, double)] is computed by sampling unless a
///   variant can answer it directly.
///
/// @see ScalarData
/// @see UnweightedSamples
/// @see MultivariateNormalDist
public abstract class UncertainData {

    /// Number of samples drawn when a bounds fraction has to be estimated by sampling.
    public static final int DEFAULT_BOUNDS_SAMPLES = 1000;

    /// @return the schema naming every component of this distribution
    public abstract KeySchema schema();

    /// @return the keys, in order
    public List<String> keys() {
        return schema().keys();
    }

    public boolean contains(String key) {
        return schema().contains(key);
    }

    /// Draws samples using a freshly seeded generator.
    ///
    /// @param n number of samples, must be positive
    /// @return the samples
    public UnweightedSamples sample(int n) {
        return sample(n, RandomGenerators.create());
    }

    /// Draws samples using the given generator.
    ///
    /// @param n number of samples, must be positive
    /// @param rng the generator to draw from
    /// @return the samples
    /// @throws IllegalArgumentException if n is not positive
    public abstract UnweightedSamples sample(int n, UniformRandomProvider rng);

    /// @return the mean of the distribution
    public abstract LabeledVector mean();

    /// @return the median of the distribution
    public abstract LabeledVector median();

    /// @return the covariance matrix, rows and columns in key order
    public abstract double[][] cov();

    /// Covariance with rows and columns re-ordered (and possibly narrowed) into `order`.
    ///
    /// @param order the target key order
    /// @return the covariance in that order
    /// @throws KeyNotFoundException if `order` names a key this distribution lacks
    public double[][] cov(KeySchema order) {
        double[][] cov = cov();
        int[] index = new int[order.size()];
        for (int i = 0; i < index.length; i++) {
            index[i] = schema().indexOf(order.key(i));
        }
        double[][] out = new double[index.length][index.length];
        for (int i = 0; i < index.length; i++) {
            for (int j = 0; j < index.length; j++) {
                out[i][j] = cov[index[i]][index[j]];
            }
        }
        return out;
    }

    /// Returns a copy with every component shifted by `offset`.
    ///
    /// @param offset the value added to every component
    /// @return the shifted distribution
    public abstract UncertainData add(double offset);

    /// Returns a copy with `offset` subtracted from every component.
    ///
    /// Turning a time-of-event distribution into time-to-event is
    /// `toe.subtract(predictionTime)`.
    public UncertainData subtract(double offset) {
        return add(-offset);
    }

    /// Fraction of the distribution strictly inside `(lower, upper)`, for every key.
    public Map<String, Double> percentageInBounds(double lower, double upper) {
        Map<String, double[]> bounds = new LinkedHashMap<>();
        for (String key : keys()) {
            bounds.put(key, new double[]{lower, upper});
        }
        return percentageInBounds(bounds, keys(), DEFAULT_BOUNDS_SAMPLES);
    }

    /// Fraction of the distribution strictly inside per-key bounds.
    ///
    /// @param bounds key to `{lower, upper}`, one entry per key of this distribution
    /// @return key to fraction in `[0, 1]`
    /// @throws KeyNotFoundException if a key has no bounds
    public Map<String, Double> percentageInBounds(Map<String, double[]> bounds) {
        return percentageInBounds(bounds, keys(), DEFAULT_BOUNDS_SAMPLES);
    }

    /// Fraction of the distribution strictly inside per-key bounds, for a subset of keys.
    ///
    /// The default implementation samples `nSamples` points.
    ///
    /// @param bounds key to `{lower, upper}`
    /// @param keys the keys to evaluate
    /// @param nSamples number of samples for the estimate
    /// @return key to fraction in `[0, 1]`
    public Map<String, Double> percentageInBounds(Map<String, double[]> bounds, List<String> keys, int nSamples) {
        return sample(nSamples).percentageInBounds(bounds, keys, nSamples);
    }

    /// Relative accuracy of the mean against a ground truth.
    ///
    /// `RA = 1 - |gt - mean| / gt`, for every key.
    ///
    /// @param groundTruth key to ground truth value, must cover every key
    /// @return key to relative accuracy
    /// @throws KeyNotFoundException if a key has no ground truth
    /// @throws ArithmeticException if a ground truth value is zero
    public Map<String, Double> relativeAccuracy(Map<String, Double> groundTruth) {
        LabeledVector mean = mean();
        Map<String, Double> result = new LinkedHashMap<>();
        for (String key : keys()) {
            double gt = requireGroundTruth(groundTruth, key);
            if (gt == 0.0) {
                throw new ArithmeticException("Ground truth for '" + key
                    + "' is zero; relative accuracy is undefined");
            }
            result.put(key, 1.0 - Math.abs(gt - mean.get(key)) / gt);
        }
        return result;
    }

    /// Summary statistics for every key, without ground truth.
    public Map<String, SampleMetrics> metrics() {
        return UncertainDataMetrics.calcMetrics(this, null, keys(), UncertainDataMetrics.DEFAULT_SAMPLES);
    }

    /// Summary statistics for every key, including ground-truth error metrics.
    ///
    /// @param groundTruth key to ground truth value
    /// @throws KeyNotFoundException if a key has no ground truth
    public Map<String, SampleMetrics> metrics(Map<String, Double> groundTruth) {
        return UncertainDataMetrics.calcMetrics(this, groundTruth, keys(), UncertainDataMetrics.DEFAULT_SAMPLES);
    }

    static double requireGroundTruth(Map<String, Double> groundTruth, String key) {
        Double gt = groundTruth.get(key);
        if (gt == null) {
            throw new KeyNotFoundException(key, List.copyOf(groundTruth.keySet()));
        }
        return gt;
    }

    static void requirePositiveCount(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("Number of samples must be positive, got: " + n);
        }
    }

    static double[] requireBounds(Map<String, double[]> bounds, String key) {
        double[] b = bounds.get(key);
        if (b == null) {
            throw new KeyNotFoundException(key, List.copyOf(bounds.keySet()));
        }
        if (b.length != 2) {
            throw new IllegalArgumentException("Bounds for '" + key + "' must be {lower, upper}, got "
                + b.length + " values");
        }
        return b;
    }
}
