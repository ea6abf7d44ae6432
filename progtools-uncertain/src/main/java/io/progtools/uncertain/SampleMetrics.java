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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Summary statistics of one key of a distribution.
///
/// Percentile entries are keyed `"0.01"`, `"0.1"`, `"1"`, `"10"`, `"25"`, `"50"`, `"75"`
/// and are `null` where there are too few samples to resolve them (for example
/// the 1st percentile needs at least 100 samples).
///
/// The ground-truth fields are `null` when no ground truth was supplied.
///
/// @param min smallest present sample
/// @param max largest present sample
/// @param mean the distribution mean
/// @param median the distribution median
/// @param std population standard deviation of the present samples
/// @param percentiles percentile label to value
/// @param medianAbsoluteDeviation mean absolute distance from the median
/// @param meanAbsoluteDeviation mean absolute distance from the mean
/// @param sampleCount number of present samples
/// @param meanAbsoluteError mean absolute distance from the ground truth
/// @param meanAbsolutePercentageError mean absolute error divided by the ground truth
/// @param relativeAccuracy `1 - |gt - mean| / gt`
/// @param groundTruthPercentile percentile rank of the ground truth among the samples, 0 to 100
public record SampleMetrics(
    double min,
    double max,
    double mean,
    double median,
    double std,
    Map<String, Double> percentiles,
    double medianAbsoluteDeviation,
    double meanAbsoluteDeviation,
    int sampleCount,
    Double meanAbsoluteError,
    Double meanAbsolutePercentageError,
    Double relativeAccuracy,
    Double groundTruthPercentile
) {

    public boolean hasGroundTruth() {
        return meanAbsoluteError != null;
    }

    /// Returns a copy whose mean and median (and 50th percentile) are replaced,
    /// used when the distribution defines those statistics itself.
    SampleMetrics withCenter(double newMean, double newMedian) {
        Map<String, Double> p = new LinkedHashMap<>(percentiles);
        p.put("50", newMedian);
        return new SampleMetrics(min, max, newMean, newMedian, std, Collections.unmodifiableMap(p),
            medianAbsoluteDeviation, meanAbsoluteDeviation, sampleCount,
            meanAbsoluteError, meanAbsolutePercentageError, relativeAccuracy, groundTruthPercentile);
    }
}
