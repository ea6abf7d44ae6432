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

import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class UnweightedSamplesTest {

    private final KeySchema schema = KeySchema.of("a", "b");

    private UnweightedSamples fourPoints() {
        return new UnweightedSamples(schema, List.of(
            schema.vector(1, 2),
            schema.vector(3, 4),
            schema.vector(5, 0),
            schema.vector(-1, 6)));
    }

    @Test
    void meanIsElementwiseAverage() {
        LabeledVector mean = fourPoints().mean();
        assertEquals(2.0, mean.get("a"), 1e-12);
        assertEquals(3.0, mean.get("b"), 1e-12);
    }

    @Test
    void sampleDrawsFromThePool() {
        UnweightedSamples s = fourPoints();
        List<LabeledVector> pool = new ArrayList<>();
        s.forEach(pool::add);

        UnweightedSamples drawn = s.sample(25, RandomGenerators.create(7L));
        assertEquals(25, drawn.size());
        for (LabeledVector v : drawn) {
            assertThat(pool).contains(v);
        }
    }

    @Test
    void sampleFromEmptyFails() {
        UnweightedSamples empty = new UnweightedSamples(schema);
        assertThrows(EmptyDistributionException.class, () -> empty.sample(1));
        assertThrows(EmptyDistributionException.class, empty::mean);
        assertThrows(IllegalArgumentException.class, () -> fourPoints().sample(0));
    }

    @Test
    void geometricMedianIsAStoredPoint() {
        UnweightedSamples s = new UnweightedSamples(KeySchema.of("x"), List.of(
            KeySchema.of("x").vector(0),
            KeySchema.of("x").vector(1),
            KeySchema.of("x").vector(2),
            KeySchema.of("x").vector(100)));
        // total squared distance is smallest for 2
        assertEquals(2.0, s.median().get("x"));
    }

    @Test
    void covarianceIsUnbiased() {
        UnweightedSamples s = UnweightedSamples.ofColumns(orderedColumns(
            "a", new double[]{1, 2, 3, 4},
            "b", new double[]{2, 4, 6, 8}));
        double[][] cov = s.cov();
        // var(a) with n-1 = 5/3
        assertEquals(5.0 / 3.0, cov[0][0], 1e-12);
        assertEquals(10.0 / 3.0, cov[0][1], 1e-12);
        assertEquals(cov[0][1], cov[1][0], 1e-12);
        assertEquals(20.0 / 3.0, cov[1][1], 1e-12);
    }

    @Test
    void covarianceOfSingleSampleIsUndefined() {
        UnweightedSamples s = new UnweightedSamples(schema, List.of(schema.vector(1, 2)));
        double[][] cov = s.cov();
        assertEquals(2, cov.length);
        assertTrue(Double.isNaN(cov[0][0]));
    }

    @Test
    void absentEntriesAreSkippedByStatistics() {
        UnweightedSamples s = fourPoints();
        s.add(null);
        s.add(schema.vector(Double.NaN, 3));
        assertEquals(6, s.size());
        assertEquals(5, s.presentCount());
        assertNull(s.get(4));

        LabeledVector mean = s.mean();
        assertEquals(2.0, mean.get("a"), 1e-12);
        assertEquals(3.0, mean.get("b"), 1e-12);
        assertEquals(2, s.cov().length);
        assertNotNull(s.median());
        assertEquals(5, s.key("a").length);
    }

    @Test
    void boundsCountStoredSamplesOverTotal() {
        UnweightedSamples s = fourPoints();
        s.add(null);
        Map<String, Double> pct = s.percentageInBounds(0.5, 4.5);
        // a: 1, 3 inside of 5 entries; b: 2, 4 inside
        assertEquals(0.4, pct.get("a"), 1e-12);
        assertEquals(0.4, pct.get("b"), 1e-12);
    }

    @Test
    void listOperations() {
        UnweightedSamples s = fourPoints();
        s.set(0, schema.vector(10, 20));
        assertEquals(10.0, s.get(0).get("a"));
        LabeledVector removed = s.remove(0);
        assertEquals(20.0, removed.get("b"));
        assertEquals(3, s.size());
        assertArrayEquals(new double[]{3, 5, -1}, s.key("a"));
    }

    @Test
    void addReordersByKey() {
        UnweightedSamples s = new UnweightedSamples(schema);
        s.add(KeySchema.of("b", "a").vector(2, 1));
        assertArrayEquals(new double[]{1, 2}, s.get(0).toArray());
        assertThrows(KeyNotFoundException.class, () -> s.add(KeySchema.of("a").vector(1)));
    }

    @Test
    void mismatchedColumnsRejected() {
        assertThrows(IllegalArgumentException.class, () -> UnweightedSamples.ofColumns(orderedColumns(
            "a", new double[]{1, 2}, "b", new double[]{1})));
    }

    @Test
    void shiftKeepsAbsentEntries() {
        UnweightedSamples s = fourPoints();
        s.add(null);
        UnweightedSamples shifted = s.add(1.0);
        assertEquals(5, shifted.size());
        assertNull(shifted.get(4));
        assertArrayEquals(new double[]{2, 3}, shifted.get(0).toArray());
    }

    @Test
    void sameSeedSameDraws() {
        UnweightedSamples s = fourPoints();
        UniformRandomProvider r1 = RandomGenerators.create(99L);
        UniformRandomProvider r2 = RandomGenerators.create(99L);
        assertEquals(s.sample(50, r1), s.sample(50, r2));
        assertNotEquals(s.sample(50, RandomGenerators.create(1L)), s.sample(50, RandomGenerators.create(2L)));
        assertTrue(Arrays.stream(s.key("a")).allMatch(Double::isFinite));
    }

    private static Map<String, double[]> orderedColumns(String k1, double[] v1, String k2, double[] v2) {
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put(k1, v1);
        columns.put(k2, v2);
        return columns;
    }
}
