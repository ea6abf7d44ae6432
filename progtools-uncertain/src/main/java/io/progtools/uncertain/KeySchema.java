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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/// Immutable, ordered set of keys with a key-to-index lookup.
///
/// ## Purpose
///
/// States, inputs, outputs and events are all described by an ordered list of
/// names. A KeySchema is built once from such a list, after which every access
/// to a [LabeledVector] or a distribution goes through validated indices.
///
/// ```
///   KeySchema ["x", "v"]
///        │
///        ├── indexOf("x") ─► 0
///        ├── indexOf("v") ─► 1
///        └── indexOf("q") ─► KeyNotFoundException
/// ```
///
/// Two schemas are equal when their key lists are equal in order.
public final class KeySchema {

    private static final KeySchema EMPTY = new KeySchema(List.of());

    private final List<String> keys;
    private final Map<String, Integer> index;

    private KeySchema(List<String> keys) {
        this.keys = Collections.unmodifiableList(new ArrayList<>(keys));
        this.index = new HashMap<>();
        for (int i = 0; i < this.keys.size(); i++) {
            String key = this.keys.get(i);
            if (key == null) {
                throw new IllegalArgumentException("Schema keys must not be null: " + keys);
            }
            if (index.put(key, i) != null) {
                throw new IllegalArgumentException("Duplicate key '" + key + "' in schema " + keys);
            }
        }
    }

    /// Creates a schema from an ordered collection of keys.
    ///
    /// @param keys the keys, in order
    /// @return the schema
    /// @throws IllegalArgumentException if a key is duplicated or null
    public static KeySchema of(Collection<String> keys) {
        if (keys.isEmpty()) {
            return EMPTY;
        }
        return new KeySchema(new ArrayList<>(keys));
    }

    /// Creates a schema from keys given in order.
    ///
    /// @param keys the keys, in order
    /// @return the schema
    public static KeySchema of(String... keys) {
        return of(List.of(keys));
    }

    /// @return the empty schema
    public static KeySchema empty() {
        return EMPTY;
    }

    /// @return the keys in declaration order (unmodifiable)
    public List<String> keys() {
        return keys;
    }

    /// @return the number of keys
    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    public boolean contains(String key) {
        return index.containsKey(key);
    }

    /// Returns the position of a key.
    ///
    /// @param key the key
    /// @return its index
    /// @throws KeyNotFoundException if the key is not part of this schema
    public int indexOf(String key) {
        Integer i = index.get(key);
        if (i == null) {
            throw new KeyNotFoundException(key, keys);
        }
        return i;
    }

    /// @param i an index
    /// @return the key at that index
    public String key(int i) {
        return keys.get(i);
    }

    /// Computes, for each key of `target`, its index in this schema.
    ///
    /// Used to re-order a vector or matrix laid out in this schema into the
    /// order of `target`.
    ///
    /// @param target the schema to map to
    /// @return `mapping[i]` = index in this schema of `target.key(i)`
    /// @throws KeyNotFoundException if `target` names a key this schema lacks
    public int[] mappingTo(KeySchema target) {
        int[] mapping = new int[target.size()];
        for (int i = 0; i < mapping.length; i++) {
            mapping[i] = indexOf(target.key(i));
        }
        return mapping;
    }

    /// Creates a vector in this schema.
    ///
    /// @param values one value per key, in key order
    /// @return the labeled vector
    public LabeledVector vector(double... values) {
        return new LabeledVector(this, values.clone());
    }

    /// Creates a vector in this schema from a map, which must hold every key.
    ///
    /// @param values key to value
    /// @return the labeled vector
    /// @throws KeyNotFoundException if a key of this schema is missing from the map
    public LabeledVector vector(Map<String, ? extends Number> values) {
        double[] array = new double[keys.size()];
        for (int i = 0; i < array.length; i++) {
            Number value = values.get(keys.get(i));
            if (value == null && !values.containsKey(keys.get(i))) {
                throw new KeyNotFoundException(keys.get(i), new ArrayList<>(values.keySet()));
            }
            array[i] = value == null ? Double.NaN : value.doubleValue();
        }
        return new LabeledVector(this, array);
    }

    /// @return a vector of this schema with every component zero
    public LabeledVector zeros() {
        return new LabeledVector(this, new double[keys.size()]);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeySchema)) return false;
        return keys.equals(((KeySchema) o).keys);
    }

    @Override
    public int hashCode() {
        return keys.hashCode();
    }

    @Override
    public String toString() {
        return "KeySchema" + keys;
    }
}
