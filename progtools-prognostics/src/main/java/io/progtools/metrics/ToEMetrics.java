package io.progtools.metrics;

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

import io.progtools.uncertain.KeySchema;
import io.progtools.uncertain.LabeledVector;
import io.progtools.uncertain.UncertainData;
import io.progtools.uncertain.UnweightedSamples;

import java.util.LinkedHashMap;
import java.util.Map;

/// Metrics over a single time-of-event distribution.
public final class ToEMetrics {

    /// Samples drawn from a parametric time-of-event distribution.
    public static final int DEFAULT_SAMPLES = 10_000;

    private ToEMetrics() {
    }

    public static Map<String, Double> probSuccess(UncertainData toe, double time) {
        return probSuccess(toe, time, DEFAULT_SAMPLES);
    }

    /// Probability that each event has not occurred by `time`.
    ///
    /// A sample whose event never occurred (absent or NaN) counts as a success.
    ///
    /// @param toe time-of-event distribution
    /// @param time the time of interest
    /// @param nSamples samples drawn when `toe` is not already a sample set
    /// @return event to probability in `[0, 1]`
    public static Map<String, Double> probSuccess(UncertainData toe, double time, int nSamples) {
        UnweightedSamples samples = toe instanceof UnweightedSamples s ? s : toe.sample(nSamples);
        KeySchema events = samples.schema();
        int[] successes = new int[events.size()];
        for (LabeledVector sample : samples) {
            for (int k = 0; k < successes.length; k++) {
                if (sample == null || Double.isNaN(sample.get(k)) || sample.get(k) > time) {
                    successes[k]++;
                }
            }
        }
        Map<String, Double> result = new LinkedHashMap<>();
        for (int k = 0; k < successes.length; k++) {
            result.put(events.key(k), samples.isEmpty() ? Double.NaN : successes[k] / (double) samples.size());
        }
        return result;
    }
}
