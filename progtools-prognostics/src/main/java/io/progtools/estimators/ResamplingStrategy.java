package io.progtools.estimators;

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

/// Draws particle indices with replacement in proportion to normalized weights.
public enum ResamplingStrategy {

    /// Deterministic copies of `floor(N·w)` followed by multinomial draws on the
    /// residual weights. Lower variance than plain multinomial.
    RESIDUAL {
        @Override
        public int[] resample(double[] weights, UniformRandomProvider rng) {
            int n = weights.length;
            int[] indexes = new int[n];
            double[] residual = new double[n];
            int k = 0;
            double residualSum = 0.0;
            for (int i = 0; i < n; i++) {
                int copies = (int) Math.floor(n * weights[i]);
                for (int c = 0; c < copies && k < n; c++) {
                    indexes[k++] = i;
                }
                residual[i] = n * weights[i] - copies;
                residualSum += residual[i];
            }
            if (k < n) {
                double[] cumulative = new double[n];
                double sum = 0.0;
                for (int i = 0; i < n; i++) {
                    sum += residual[i] / residualSum;
                    cumulative[i] = sum;
                }
                cumulative[n - 1] = 1.0;
                while (k < n) {
                    indexes[k++] = searchSorted(cumulative, rng.nextDouble());
                }
            }
            return indexes;
        }
    },

    /// One uniform offset, then evenly spaced positions through the cumulative weights.
    SYSTEMATIC {
        @Override
        public int[] resample(double[] weights, UniformRandomProvider rng) {
            int n = weights.length;
            double offset = rng.nextDouble();
            double[] cumulative = cumulative(weights);
            int[] indexes = new int[n];
            int i = 0;
            int j = 0;
            while (i < n) {
                double position = (offset + i) / n;
                if (position < cumulative[j]) {
                    indexes[i++] = j;
                } else {
                    j++;
                }
            }
            return indexes;
        }
    },

    /// Independent draws from the cumulative weights.
    MULTINOMIAL {
        @Override
        public int[] resample(double[] weights, UniformRandomProvider rng) {
            double[] cumulative = cumulative(weights);
            int[] indexes = new int[weights.length];
            for (int i = 0; i < indexes.length; i++) {
                indexes[i] = searchSorted(cumulative, rng.nextDouble());
            }
            return indexes;
        }
    };

    /// @param weights normalized weights, summing to 1
    /// @param rng generator for the random draws
    /// @return one source index per new particle
    public abstract int[] resample(double[] weights, UniformRandomProvider rng);

    static double[] cumulative(double[] weights) {
        double[] cumulative = new double[weights.length];
        double sum = 0.0;
        for (int i = 0; i < weights.length; i++) {
            sum += weights[i];
            cumulative[i] = sum;
        }
        cumulative[weights.length - 1] = 1.0;
        return cumulative;
    }

    /// First index whose cumulative value is at least `value`.
    static int searchSorted(double[] cumulative, double value) {
        int lo = 0;
        int hi = cumulative.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (cumulative[mid] < value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
