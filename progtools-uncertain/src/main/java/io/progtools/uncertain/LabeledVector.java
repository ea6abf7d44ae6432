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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A numeric vector whose components are named by a [KeySchema].
///
/// LabeledVector is the fixed-schema replacement for a loose key/value map. The
/// schema is validated once; components are read by index on hot paths and by
/// key where readability matters.
///
/// `Double.NaN` marks an absent or unresolved component, for example the time
/// of an event that was not reached within the prediction horizon.
///
/// Instances are immutable. Arithmetic helpers return new vectors.
public final class LabeledVector {

    private final KeySchema schema;
    private final double[] values;

    LabeledVector(KeySchema schema, double[] values) {
        if (values.length != schema.size()) {
            throw new IllegalArgumentException("Expected " + schema.size() + " values for " + schema.keys()
                + ", got " + values.length);
        }
        this.schema = schema;
        this.values = values;
    }

    /// Creates a vector, copying the values.
    ///
    /// @param schema the schema
    /// @param values one value per schema key
    /// @return the vector
    public static LabeledVector of(KeySchema schema, double[] values) {
        return new LabeledVector(schema, values.clone());
    }

    public KeySchema schema() {
        return schema;
    }

    public int size() {
        return values.length;
    }

    public double get(int i) {
        return values[i];
    }

    /// @param key a schema key
    /// @return the component value, NaN when unresolved
    /// @throws KeyNotFoundException if the key is not in the schema
    public double get(String key) {
        return values[schema.indexOf(key)];
    }

    /// @return whether the named component holds a value (is not NaN)
    public boolean isPresent(String key) {
        return !Double.isNaN(get(key));
    }

    /// @return a copy of the component values, in schema order
    public double[] toArray() {
        return values.clone();
    }

    /// @return an insertion-ordered map of key to value
    public Map<String, Double> toMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(schema.key(i), values[i]);
        }
        return map;
    }

    /// Returns a copy with one component replaced.
    public LabeledVector with(String key, double value) {
        double[] copy = values.clone();
        copy[schema.indexOf(key)] = value;
        return new LabeledVector(schema, copy);
    }

    /// Returns a vector of the same schema with new values.
    public LabeledVector withValues(double[] newValues) {
        return new LabeledVector(schema, newValues.clone());
    }

    /// Returns this vector re-ordered (and possibly narrowed) into `target`.
    ///
    /// @throws KeyNotFoundException if `target` holds a key not present here
    public LabeledVector reorder(KeySchema target) {
        if (target.equals(schema)) {
            return this;
        }
        int[] mapping = schema.mappingTo(target);
        double[] out = new double[mapping.length];
        for (int i = 0; i < mapping.length; i++) {
            out[i] = values[mapping[i]];
        }
        return new LabeledVector(target, out);
    }

    public LabeledVector plus(double offset) {
        double[] out = new double[values.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = values[i] + offset;
        }
        return new LabeledVector(schema, out);
    }

    public LabeledVector minus(LabeledVector other) {
        requireSameSchema(other);
        double[] out = new double[values.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = values[i] - other.values[i];
        }
        return new LabeledVector(schema, out);
    }

    public LabeledVector plus(LabeledVector other) {
        requireSameSchema(other);
        double[] out = new double[values.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = values[i] + other.values[i];
        }
        return new LabeledVector(schema, out);
    }

    private void requireSameSchema(LabeledVector other) {
        if (!schema.equals(other.schema)) {
            throw new IllegalArgumentException("Schema mismatch: " + schema.keys() + " vs " + other.schema.keys());
        }
    }

    double[] rawValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LabeledVector)) return false;
        LabeledVector that = (LabeledVector) o;
        return schema.equals(that.schema) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, Arrays.hashCode(values));
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
