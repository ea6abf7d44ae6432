package io.progtools.predictors;

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

import io.progtools.metrics.ToEProfileMetrics;
import io.progtools.uncertain.UncertainData;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.BiConsumer;

/// Time-of-event predictions keyed by the time each prediction was made.
///
/// Iteration is always in increasing prediction time, whatever the insertion order.
///
/// ```java
/// ToEPredictionProfile profile = new ToEPredictionProfile();
/// for (double t : measurementTimes) {
///     filter.estimate(t, u, z);
///     profile.addPrediction(t, predictor.predict(filter.getState(), load).timeOfEvent());
/// }
/// Map<String, Boolean> al = profile.alphaLambda(Map.of("impact", 8.2), 2.0, 0.2, 0.5);
/// ```
public class ToEPredictionProfile {

    private final NavigableMap<Double, UncertainData> predictions = new TreeMap<>();

    /// Adds a prediction, replacing any previous one made at the same time.
    public void addPrediction(double timeOfPrediction, UncertainData toe) {
        predictions.put(timeOfPrediction, toe);
    }

    /// @return the prediction made at `timeOfPrediction`, or null
    public UncertainData get(double timeOfPrediction) {
        return predictions.get(timeOfPrediction);
    }

    public UncertainData remove(double timeOfPrediction) {
        return predictions.remove(timeOfPrediction);
    }

    public int size() {
        return predictions.size();
    }

    public boolean isEmpty() {
        return predictions.isEmpty();
    }

    /// @return prediction times, increasing
    public List<Double> times() {
        return new ArrayList<>(predictions.keySet());
    }

    /// @return predictions in increasing prediction time
    public List<UncertainData> values() {
        return new ArrayList<>(predictions.values());
    }

    /// @return read-only view of the (time, prediction) pairs, increasing
    public Set<Map.Entry<Double, UncertainData>> entries() {
        return Collections.unmodifiableSet(predictions.entrySet());
    }

    public void forEach(BiConsumer<Double, UncertainData> action) {
        predictions.forEach(action);
    }

    public Map<String, Boolean> alphaLambda(Map<String, Double> groundTruth, double lambda, double alpha, double beta) {
        return ToEProfileMetrics.alphaLambda(this, groundTruth, lambda, alpha, beta);
    }

    public Map<String, Boolean> alphaLambda(Map<String, Double> groundTruth, double lambda, double alpha, double beta,
                                            List<String> keys) {
        return ToEProfileMetrics.alphaLambda(this, groundTruth, lambda, alpha, beta, keys);
    }

    public Map<String, Double> prognosticHorizon(ToEProfileMetrics.Criteria criteria, Map<String, Double> groundTruth) {
        return ToEProfileMetrics.prognosticHorizon(this, criteria, groundTruth);
    }

    public Map<String, Double> cumulativeRelativeAccuracy(Map<String, Double> groundTruth) {
        return ToEProfileMetrics.cumulativeRelativeAccuracy(this, groundTruth);
    }

    public Map<String, Double> monotonicity() {
        return ToEProfileMetrics.monotonicity(this);
    }

    @Override
    public String toString() {
        return "ToEPredictionProfile[" + predictions.size() + " predictions]";
    }
}
