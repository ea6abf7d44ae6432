package io.progtools.loading;

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

import io.progtools.model.ConfigurationException;
import io.progtools.uncertain.KeySchema;
import io.progtools.uncertain.LabeledVector;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/// Piecewise-constant load.
///
/// `values[i]` applies until `times[i]`. Each value list holds either as
/// many entries as there are times, or one more; the extra entry applies after
/// the last time. Without it the last value is held.
///
/// ```java
/// // 0 until t=10, then 1 until t=20, then 0.2
/// new PiecewiseLoad(inputs, List.of(10.0, 20.0), Map.of("i", new double[]{0, 1, 0.2}));
/// ```
public final class PiecewiseLoad implements LoadingFunction {

    private final KeySchema inputs;
    private final double[] times;
    private final double[][] values;

    /// @param inputs the model input schema, every key must have values
    /// @param times increasing change times (s)
    /// @param values input key to its values
    /// @throws ConfigurationException if value lists differ in length, do not fit
    ///         the times, or an input has no values
    public PiecewiseLoad(KeySchema inputs, List<Double> times, Map<String, double[]> values) {
        this.inputs = inputs;
        Integer n = null;
        for (Map.Entry<String, double[]> entry : values.entrySet()) {
            int length = entry.getValue().length;
            if (n == null) {
                n = length;
            } else if (n != length) {
                int diff = length - n;
                throw new ConfigurationException(entry.getKey(), "All elements in values must have the same number of "
                    + "elements. " + entry.getKey() + " had " + (diff > 0 ? diff + " more" : -diff + " less"));
            }
        }
        if (n != null && n != times.size() && n != times.size() + 1) {
            throw new ConfigurationException("values", "Elements in values must have the same or one more element "
                + "than times (" + times.size() + "), had " + n);
        }
        if (n != null && n == 0) {
            throw new ConfigurationException("values", "At least one value is required");
        }
        double[] t = times.stream().mapToDouble(Double::doubleValue).toArray();
        if (n != null && n == t.length + 1) {
            t = Arrays.copyOf(t, t.length + 1);
            t[t.length - 1] = Double.POSITIVE_INFINITY;
        }
        this.times = t;
        this.values = new double[inputs.size()][];
        for (int k = 0; k < inputs.size(); k++) {
            double[] v = values.get(inputs.key(k));
            if (v == null) {
                throw new ConfigurationException(inputs.key(k), "No values given for input '" + inputs.key(k) + "'");
            }
            this.values[k] = v.clone();
        }
    }

    @Override
    public LabeledVector load(double t, LabeledVector x) {
        int segment = times.length - 1;
        for (int i = 0; i < times.length; i++) {
            if (times[i] > t) {
                segment = i;
                break;
            }
        }
        double[] u = new double[values.length];
        for (int k = 0; k < u.length; k++) {
            u[k] = values[k][segment];
        }
        return LabeledVector.of(inputs, u);
    }
}
