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

import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Summary metrics over any [UncertainData]: state estimates, event states,
/// time-of-event distributions.
///
/// Distributions other than [UnweightedSamples] are sampled first. Within one
/// key, absent and unresolved (NaN) samples are excluded and a warning is
/// logged. The distribution's own mean and median replace the sample ones.
public final class UncertainDataMetrics {

    private static final Logger logger = LogManager.getLogger(UncertainDataMetrics.class);

    /// Samples drawn from parametric distributions, enough to resolve every percentile.
    public static final int DEFAULT_SAMPLES = 10_000;

    private UncertainDataMetrics() {
    }

    /// @param data the distribution
    /// @param groundTruth key to ground truth, or null
    /// @param keys the keys to summarize
    /// @param nSamples samples drawn when `data` is not already samples
    /// @return key to metrics, in the order of `keys`
    /// @throws EmptyDistributionException if the data holds no samples
    /// @throws KeyNotFoundException if a key is unknown or lacks ground truth
    public static Map<String, SampleMetrics> calcMetrics(UncertainData data, Map<String, Double> groundTruth,
                                                         List<String> keys, int nSamples) {
        UnweightedSamples samples = data instanceof UnweightedSamples
            ? (UnweightedSamples) data
            : data.sample(nSamples);
        if (samples.isEmpty()) {
            throw new EmptyDistributionException("Data must not be empty");
        }
        LabeledVector mean = data.mean();
        LabeledVector median = data.median();
        Map<String, SampleMetrics> result = new LinkedHashMap<>();
        for (String key : keys) {
            Double gt = groundTruth == null ? null : UncertainData.requireGroundTruth(groundTruth, key);
            double[] column = samples.key(key);
            if (column.length < samples.size()) {
                logger.warn("Some samples of '{}' were absent; metrics consider present samples only", key);
            }
            SampleMetrics metrics = calcMetrics(column, gt);
            result.put(key, metrics.withCenter(mean.get(key), median.get(key)));
        }
        return result;
    }

    /// Metrics over a plain array of values. NaN entries are treated as absent.
    ///
    /// @param values the values
    /// @param groundTruth the ground truth, or null
    /// @return the metrics
    /// @throws EmptyDistributionException if no value is present
    public static SampleMetrics calcMetrics(double[] values, Double groundTruth) {
        double[] data = Arrays.stream(values).filter(v -> !Double.isNaN(v)).sorted().toArray();
        if (data.length == 0) {
            throw new EmptyDistributionException("All samples were absent");
        }
        if (data.length < values.length) {
            logger.warn("{} of {} samples were unresolved; metrics consider present samples only",
                values.length - data.length, values.length);
        }
        int n = data.length;
        double mean = Arrays.stream(data).average().orElseThrow();
        double median = data[n / 2];

        Map<String, Double> percentiles = new LinkedHashMap<>();
        percentiles.put("0.01", n >= 10_000 ? data[n / 10_000] : null);
        percentiles.put("0.1", n >= 1_000 ? data[n / 1_000] : null);
        percentiles.put("1", n >= 100 ? data[n / 100] : null);
        percentiles.put("10", n >= 10 ? data[n / 10] : null);
        percentiles.put("25", n >= 4 ? data[n / 4] : null);
        percentiles.put("50", median);
        percentiles.put("75", n >= 4 ? data[3 * n / 4] : null);

        double medianDev = 0.0;
        double meanDev = 0.0;
        for (double x : data) {
            medianDev += Math.abs(x - median);
            meanDev += Math.abs(x - mean);
        }
        double std = new StandardDeviation(false).evaluate(data);

        Double mae = null;
        Double mape = null;
        Double ra = null;
        Double rank = null;
        if (groundTruth != null) {
            double gt = groundTruth;
            double err = 0.0;
            for (double x : data) {
                err += Math.abs(x - gt);
            }
            mae = err / n;
            mape = mae / gt;
            ra = 1.0 - Math.abs(gt - mean) / gt;
            rank = percentileOfScore(data, gt);
        }
        return new SampleMetrics(data[0], data[n - 1], mean, median, std,
            Collections.unmodifiableMap(percentiles), medianDev / n, meanDev / n, n,
            mae, mape, ra, rank);
    }

    /// Percentile rank of `score` among sorted data; ties count half.
    static double percentileOfScore(double[] sorted, double score) {
        int left = 0;
        int right = 0;
        for (double x : sorted) {
            if (x < score) {
                left++;
            }
            if (x <= score) {
                right++;
            }
        }
        int plus = right > left ? 1 : 0;
        return (left + right + plus) * 50.0 / sorted.length;
    }
}
