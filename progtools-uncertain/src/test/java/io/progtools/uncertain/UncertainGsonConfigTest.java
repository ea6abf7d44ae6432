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

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class UncertainGsonConfigTest {

    private final Gson gson = UncertainGsonConfig.gson();
    private final KeySchema schema = KeySchema.of("falling", "impact");

    @Test
    void scalarRoundTrip() {
        ScalarData original = new ScalarData(schema, 3.9, 8.2);
        String json = gson.toJson(original, UncertainData.class);
        assertThat(json).contains("\"type\": \"scalar\"");

        UncertainData restored = gson.fromJson(json, UncertainData.class);
        assertInstanceOf(ScalarData.class, restored);
        assertEquals(original.mean(), restored.mean());
        assertArrayEquals(original.cov()[0], restored.cov()[0]);
        assertEquals(original.keys(), restored.keys());
    }

    @Test
    void multivariateNormalRoundTrip() {
        MultivariateNormalDist original = new MultivariateNormalDist(schema.vector(3.9, 8.2),
            new double[][]{{0.01, 0.002}, {0.002, 0.04}});
        String json = gson.toJson(original, UncertainData.class);
        assertThat(json).contains("multivariate_normal");

        UncertainData restored = gson.fromJson(json, UncertainData.class);
        assertEquals(original, restored);
        assertEquals(original.mean(), restored.mean());
        assertArrayEquals(original.cov()[1], restored.cov()[1]);
    }

    @Test
    void samplesRoundTripWithAbsentAndUnresolvedEntries() {
        UnweightedSamples original = new UnweightedSamples(schema);
        original.add(schema.vector(3.9, 8.2));
        original.add(null);
        original.add(schema.vector(4.0, Double.NaN));

        String json = UncertainGsonConfig.compactGson().toJson(original, UncertainData.class);
        UncertainData restored = UncertainGsonConfig.compactGson().fromJson(json, UncertainData.class);

        assertInstanceOf(UnweightedSamples.class, restored);
        UnweightedSamples samples = (UnweightedSamples) restored;
        assertEquals(3, samples.size());
        assertNull(samples.get(1));
        assertTrue(Double.isNaN(samples.get(2).get("impact")));
        assertEquals(original, samples);
        assertEquals(original.mean(), samples.mean());
    }

    @Test
    void concreteTypeCanBeRequested() {
        ScalarData original = new ScalarData(KeySchema.of("x"), 1.0);
        String json = gson.toJson(original, UncertainData.class);
        ScalarData restored = gson.fromJson(json, ScalarData.class);
        assertEquals(original, restored);
        assertEquals(KeySchema.of("x"), restored.schema());
    }

    @Test
    void unknownTypeRejected() {
        String json = "{\"type\":\"weighted\",\"keys\":[\"x\"]}";
        JsonParseException e = assertThrows(JsonParseException.class, () -> gson.fromJson(json, UncertainData.class));
        assertThat(e.getMessage()).contains("weighted");
    }

    @Test
    void missingTypeRejected() {
        assertThrows(JsonParseException.class, () -> gson.fromJson("{\"keys\":[\"x\"]}", UncertainData.class));
    }

    @Test
    void mismatchedConcreteTypeRejected() {
        String json = gson.toJson(new ScalarData(KeySchema.of("x"), 1.0), UncertainData.class);
        assertThrows(JsonParseException.class, () -> gson.fromJson(json, MultivariateNormalDist.class));
    }

    @Test
    void listsOfDistributionsSerialize() {
        List<UncertainData> data = List.of(new ScalarData(KeySchema.of("x"), 1.0),
            new MultivariateNormalDist(KeySchema.of("x").vector(2.0), new double[][]{{1.0}}));
        String json = gson.toJson(data);
        assertThat(json).contains("scalar").contains("multivariate_normal");
    }
}
