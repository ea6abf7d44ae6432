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

import com.google.gson.annotations.SerializedName;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A single deterministic vector, the degenerate distribution.
///
/// Mean and median are the vector itself, the covariance is all zeros, and
/// sampling returns identical copies. Bounds fractions are exact: 1 when the
/// value lies strictly inside the bounds, otherwise 0.
@DistributionType(ScalarData.TYPE)
public final class ScalarData extends UncertainData {

    public static final String TYPE = "scalar";

    @SerializedName("keys")
    private final List<String> keys;

    @SerializedName("values")
    private final double[] values;

    private transient KeySchema schema;

    public ScalarData(LabeledVector value) {
        this.schema = value.schema();
        this.keys = new ArrayList<>(schema.keys());
        this.values = value.toArray();
    }

    public ScalarData(KeySchema schema, double... values) {
        this(LabeledVector.of(schema, values));
    }

    /// Creates scalar data from an ordered map of key to value.
    public static ScalarData of(Map<String, Double> values) {
        return new ScalarData(KeySchema.of(values.keySet()).vector(values));
    }

    @Override
    public KeySchema schema() {
        if (schema == null) {
            schema = KeySchema.of(keys);
        }
        return schema;
    }

    /// @return the deterministic value
    public LabeledVector value() {
        return new LabeledVector(schema(), values.clone());
    }

    @Override
    public UnweightedSamples sample(int n, UniformRandomProvider rng) {
        requirePositiveCount(n);
        UnweightedSamples samples = new UnweightedSamples(schema());
        LabeledVector v = value();
        for (int i = 0; i < n; i++) {
            samples.add(v);
        }
        return samples;
    }

    @Override
    public LabeledVector mean() {
        return value();
    }

    @Override
    public LabeledVector median() {
        return value();
    }

    @Override
    public double[][] cov() {
        return new double[values.length][values.length];
    }

    @Override
    public ScalarData add(double offset) {
        return new ScalarData(value().plus(offset));
    }

    @Override
    public Map<String, Double> percentageInBounds(Map<String, double[]> bounds, List<String> keys, int nSamples) {
        Map<String, Double> result = new LinkedHashMap<>();
        KeySchema s = schema();
        for (String key : keys) {
            double[] b = requireBounds(bounds, key);
            double x = values[s.indexOf(key)];
            result.put(key, (b[0] < x && x < b[1]) ? 1.0 : 0.0);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalarData)) return false;
        ScalarData that = (ScalarData) o;
        return keys.equals(that.keys) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keys, Arrays.hashCode(values));
    }

    @Override
    public String toString() {
        return "ScalarData" + value();
    }
}
