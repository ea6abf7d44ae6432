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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class KeySchemaTest {

    @Test
    void indexLookupFollowsDeclarationOrder() {
        KeySchema schema = KeySchema.of("x", "v", "a");
        assertEquals(0, schema.indexOf("x"));
        assertEquals(2, schema.indexOf("a"));
        assertEquals("v", schema.key(1));
        assertEquals(List.of("x", "v", "a"), schema.keys());
    }

    @Test
    void unknownKeyNamesTheKey() {
        KeySchema schema = KeySchema.of("x", "v");
        KeyNotFoundException e = assertThrows(KeyNotFoundException.class, () -> schema.indexOf("q"));
        assertEquals("q", e.getKey());
        assertThat(e.getMessage()).contains("'q'").contains("[x, v]");
    }

    @Test
    void duplicateKeysRejected() {
        assertThrows(IllegalArgumentException.class, () -> KeySchema.of("x", "x"));
    }

    @Test
    void equalityIsOrderSensitive() {
        assertEquals(KeySchema.of("x", "v"), KeySchema.of(List.of("x", "v")));
        assertNotEquals(KeySchema.of("x", "v"), KeySchema.of("v", "x"));
    }

    @Test
    void vectorFromMapRequiresEveryKey() {
        KeySchema schema = KeySchema.of("x", "v");
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("v", 2.0);
        values.put("x", 1.0);
        LabeledVector vector = schema.vector(values);
        assertArrayEquals(new double[]{1.0, 2.0}, vector.toArray());

        assertThrows(KeyNotFoundException.class, () -> schema.vector(Map.of("x", 1.0)));
    }

    @Test
    void reorderNarrowsAndPermutes() {
        LabeledVector v = KeySchema.of("a", "b", "c").vector(1, 2, 3);
        LabeledVector r = v.reorder(KeySchema.of("c", "a"));
        assertArrayEquals(new double[]{3, 1}, r.toArray());
        assertThrows(KeyNotFoundException.class, () -> v.reorder(KeySchema.of("z")));
    }

    @Test
    void vectorArithmetic() {
        KeySchema schema = KeySchema.of("a", "b");
        LabeledVector v = schema.vector(1, 2);
        assertArrayEquals(new double[]{2, 3}, v.plus(1).toArray());
        assertArrayEquals(new double[]{0, 0}, v.minus(v).toArray());
        assertArrayEquals(new double[]{2, 4}, v.plus(v).toArray());
        assertEquals(5.0, v.with("b", 5).get("b"));
        assertEquals(2.0, v.get("b"), "original is unchanged");
        assertThrows(IllegalArgumentException.class, () -> v.plus(KeySchema.of("b", "a").vector(1, 2)));
    }

    @Test
    void nanMarksAbsentComponent() {
        LabeledVector toe = KeySchema.of("falling", "impact").vector(3.9, Double.NaN);
        assertTrue(toe.isPresent("falling"));
        assertFalse(toe.isPresent("impact"));
        assertThat(toe.toMap()).containsKeys("falling", "impact");
    }
}
