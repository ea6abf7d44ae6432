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

import io.progtools.predictors.ToEPredictionProfile;
import io.progtools.uncertain.LabeledVector;
import io.progtools.uncertain.UncertainData;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Metrics over a profile of time-of-event predictions made at successive times.
///
/// Every method walks the profile in increasing prediction time.
public final class ToEProfileMetrics {

    /// Decides, per event, whether a prediction is good enough.
    @FunctionalInterface
    public interface Criteria {

        /// @param timeToEvent the prediction as time-to-event
        /// @param groundTruthTimeToEvent event to true time-to-event
        /// @return event to whether the criterion holds
        Map<String, Boolean> test(UncertainData timeToEvent, Map<String, Double> groundTruthTimeToEvent);
    }

    private ToEProfileMetrics() {
    }

    public static Map<String, Boolean> alphaLambda(ToEPredictionProfile profile, Map<String, Double> groundTruth,
                                                   double lambda, double alpha, double beta) {
        return alphaLambda(profile, groundTruth, lambda, alpha, beta, null);
    }

    /// Alpha-lambda accuracy.
    ///
    /// Uses the first prediction made at or after `lambda`. For each event, the
    /// fraction of its time-of-event strictly inside
    /// `gt ± alpha·(gt - tPrediction)` is compared with `beta`.
    ///
    /// @param keys events to evaluate, or null for every event of the prediction
    /// @return event to whether at least `beta` of the distribution is in bounds,
    ///         or an empty map when no prediction was made at or after `lambda`
    public static Map<String, Boolean> alphaLambda(ToEPredictionProfile profile, Map<String, Double> groundTruth,
                                                   double lambda, double alpha, double beta, List<String> keys) {
        for (Map.Entry<Double, UncertainData> entry : profile.entries()) {
            double tPrediction = entry.getKey();
            if (tPrediction < lambda) {
                continue;
            }
            UncertainData toe = entry.getValue();
            Map<String, double[]> bounds = new LinkedHashMap<>();
            groundTruth.forEach((event, gt) -> bounds.put(event,
                new double[]{gt - alpha * (gt - tPrediction), gt + alpha * (gt - tPrediction)}));
            List<String> evaluated = keys == null ? toe.keys() : keys;
            Map<String, Double> inBounds = toe.percentageInBounds(bounds, evaluated, UncertainData.DEFAULT_BOUNDS_SAMPLES);
            Map<String, Boolean> result = new LinkedHashMap<>();
            for (String key : evaluated) {
                result.put(key, inBounds.get(key) >= beta);
            }
            return result;
        }
        return new LinkedHashMap<>();
    }

    /// Prognostic horizon: how long before the event the predictions first meet `criteria`.
    ///
    /// For each event, the first prediction time `t` at which the criterion holds
    /// gives `gt - t`. Events whose criterion is never met, or first met at or
    /// after the true event time, map to null.
    ///
    /// @return event (every ground-truth key) to horizon, or null when unresolved
    public static Map<String, Double> prognosticHorizon(ToEPredictionProfile profile, Criteria criteria,
                                                        Map<String, Double> groundTruth) {
        Map<String, Double> result = new LinkedHashMap<>();
        groundTruth.keySet().forEach(k -> result.put(k, null));
        for (Map.Entry<Double, UncertainData> entry : profile.entries()) {
            double tPrediction = entry.getKey();
            UncertainData tte = entry.getValue().subtract(tPrediction);
            Map<String, Double> gtTte = new LinkedHashMap<>();
            groundTruth.forEach((k, v) -> gtTte.put(k, v - tPrediction));
            for (Map.Entry<String, Boolean> met : criteria.test(tte, gtTte).entrySet()) {
                String event = met.getKey();
                if (Boolean.TRUE.equals(met.getValue()) && result.containsKey(event) && result.get(event) == null) {
                    double horizon = groundTruth.get(event) - tPrediction;
                    if (horizon > 0.0) {
                        result.put(event, horizon);
                    }
                }
            }
            if (result.values().stream().allMatch(v -> v != null)) {
                break;
            }
        }
        return result;
    }

    /// Cumulative relative accuracy: relative accuracy of the mean, averaged over the profile.
    ///
    /// @throws ArithmeticException if a ground truth value is zero
    public static Map<String, Double> cumulativeRelativeAccuracy(ToEPredictionProfile profile,
                                                                 Map<String, Double> groundTruth) {
        Map<String, Double> sums = new LinkedHashMap<>();
        for (UncertainData toe : profile.values()) {
            toe.relativeAccuracy(groundTruth).forEach((event, ra) -> sums.merge(event, ra, Double::sum));
        }
        Map<String, Double> result = new LinkedHashMap<>();
        sums.forEach((event, sum) -> result.put(event, sum / profile.size()));
        return result;
    }

    /// Monotonicity of the mean time-to-event across the profile, per event.
    public static Map<String, Double> monotonicity(ToEPredictionProfile profile) {
        Map<String, List<Double>> byEvent = new LinkedHashMap<>();
        for (Map.Entry<Double, UncertainData> entry : profile.entries()) {
            LabeledVector mean = entry.getValue().mean();
            for (int k = 0; k < mean.size(); k++) {
                byEvent.computeIfAbsent(mean.schema().key(k), e -> new ArrayList<>())
                    .add(mean.get(k) - entry.getKey());
            }
        }
        Map<String, Double> result = new LinkedHashMap<>();
        byEvent.forEach((event, values) ->
            result.put(event, Monotonicity.of(values.stream().mapToDouble(Double::doubleValue).toArray())));
        return result;
    }
}
