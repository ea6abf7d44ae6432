package io.progtools.model;

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

import io.progtools.uncertain.LabeledVector;

import java.util.Collections;
import java.util.List;

/// A time-indexed series of vectors: `data().get(i)` holds at `times().get(i)`.
public class SimResult {

    private final List<Double> times;
    private List<LabeledVector> data;

    public SimResult(List<Double> times, List<LabeledVector> data) {
        if (data != null && times.size() != data.size()) {
            throw new IllegalArgumentException("Times (" + times.size() + ") and data (" + data.size()
                + ") must have the same length");
        }
        this.times = Collections.unmodifiableList(times);
        this.data = data == null ? null : Collections.unmodifiableList(data);
    }

    public List<Double> times() {
        return times;
    }

    public List<LabeledVector> data() {
        return data;
    }

    public int size() {
        return times.size();
    }

    public boolean isEmpty() {
        return times.isEmpty();
    }

    public double time(int i) {
        return times.get(i);
    }

    public LabeledVector get(int i) {
        return data().get(i);
    }

    public LabeledVector last() {
        return get(size() - 1);
    }

    /// @return the values of one key across the series
    public double[] key(String key) {
        List<LabeledVector> d = data();
        double[] out = new double[d.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = d.get(i).get(key);
        }
        return out;
    }

    protected void setData(List<LabeledVector> data) {
        this.data = Collections.unmodifiableList(data);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + size() + " points]";
    }
}
