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

import io.progtools.metrics.Monotonicity;
import io.progtools.uncertain.LabeledVector;
import io.progtools.uncertain.UncertainData;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// A predicted quantity over time: `snapshot(i)` is its distribution at `times().get(i)`.
public class Prediction {

    private final List<Double> times;
    private final List<UncertainData> data;

    public Prediction(List<Double> times, List<UncertainData> data) {
        if (data != null && data.size() != times.size()) {
            throw new IllegalArgumentException("Times (" + times.size() + ") and data (" + data.size()
                + ") must have the same length");
        }
        this.times = Collections.unmodifiableList(new ArrayList<>(times));
        this.data = data == null ? null : Collections.unmodifiableList(new ArrayList<>(data));
    }

    /// For subclasses that compute snapshots on demand.
    protected Prediction(List<Double> times) {
        this(times, null);
    }

    public List<Double> times() {
        return times;
    }

    public int size() {
        return times.size();
    }

    /// @param timeIndex index into [#times()]
    /// @return the distribution at that time
    public UncertainData snapshot(int timeIndex) {
        return data.get(timeIndex);
    }

    /// @return the mean at every saved time
    public List<LabeledVector> mean() {
        List<LabeledVector> means = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            means.add(snapshot(i).mean());
        }
        return means;
    }

    /// Monotonicity of each key's mean across the saved times.
    public Map<String, Double> monotonicity() {
        List<LabeledVector> means = mean();
        Map<String, Double> result = new LinkedHashMap<>();
        if (means.isEmpty()) {
            return result;
        }
        for (String key : means.get(0).schema().keys()) {
            double[] series = new double[means.size()];
            for (int i = 0; i < series.length; i++) {
                series[i] = means.get(i).get(key);
            }
            result.put(key, Monotonicity.of(series));
        }
        return result;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + " with " + size() + " savepoints";
    }
}
