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

import io.progtools.model.SimResult;
import io.progtools.uncertain.KeySchema;
import io.progtools.uncertain.UnweightedSamples;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/// A sample-based prediction: one [SimResult] per realization.
///
/// Snapshots are the transpose, built once on first access. Snapshot `i` holds
/// entry `i` of every realization; realizations with fewer than `i + 1` saved
/// points contribute an absent entry. The prediction is read only.
public class UnweightedSamplesPrediction extends Prediction implements Iterable<SimResult> {

    private final KeySchema schema;
    private final List<SimResult> samples;
    private List<UnweightedSamples> transposed;

    /// @param times the longest time grid of any realization
    /// @param schema keys of the predicted quantity
    /// @param samples one series per realization
    public UnweightedSamplesPrediction(List<Double> times, KeySchema schema, List<SimResult> samples) {
        super(times);
        this.schema = schema;
        this.samples = Collections.unmodifiableList(new ArrayList<>(samples));
    }

    /// @return the series of one realization
    public SimResult sample(int index) {
        return samples.get(index);
    }

    public int numSamples() {
        return samples.size();
    }

    @Override
    public UnweightedSamples snapshot(int timeIndex) {
        if (transposed == null) {
            transposed = transpose();
        }
        return transposed.get(timeIndex);
    }

    private List<UnweightedSamples> transpose() {
        List<UnweightedSamples> result = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            UnweightedSamples snapshot = new UnweightedSamples(schema);
            for (SimResult sample : samples) {
                snapshot.add(sample.size() > i ? sample.get(i) : null);
            }
            result.add(snapshot);
        }
        return result;
    }

    @Override
    public Iterator<SimResult> iterator() {
        return samples.iterator();
    }
}
