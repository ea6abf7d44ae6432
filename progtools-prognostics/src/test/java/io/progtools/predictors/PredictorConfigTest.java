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

import io.progtools.model.ConfigurationException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class PredictorConfigTest {

    @Test
    void parsesSnakeCaseJson() {
        PredictorConfig config = PredictorConfig.fromJson("""
            {
              "n_samples": 500,
              "dt": 0.01,
              "save_pts": [1.0, 2.5],
              "events": ["impact"],
              "event_strategy": "first",
              "constant_noise": true,
              "seed": 7
            }
            """);
        assertEquals(500, config.getNSamples());
        assertEquals(0.01, config.getDt());
        assertThat(config.getSavePts()).containsExactly(1.0, 2.5);
        assertThat(config.getEvents()).containsExactly("impact");
        assertEquals(EventStrategy.FIRST, config.getEventStrategy());
        assertTrue(config.getConstantNoise());
        assertEquals(7L, config.getSeed());
        assertNull(config.getHorizon());
    }

    @Test
    void anyIsAnAliasForFirst() {
        assertEquals(EventStrategy.FIRST, PredictorConfig.fromJson("{\"event_strategy\": \"any\"}").getEventStrategy());
        assertEquals(EventStrategy.FIRST, new PredictorConfig().setEventStrategy("Any").getEventStrategy());
        assertEquals(EventStrategy.ALL, EventStrategy.fromName("ALL"));
    }

    @Test
    void unknownStrategyIsRejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> new PredictorConfig().setEventStrategy("sometimes"));
        assertEquals("event_strategy", e.getParameter());
        assertThat(e.getMessage()).contains("sometimes");
    }

    @Test
    void unknownStrategyInJsonIsRejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> PredictorConfig.fromJson("{\"dt\": 0.5, \"event_strategy\": \"bogus\"}"));
        assertEquals("event_strategy", e.getParameter());
        assertThat(e.getMessage()).contains("bogus");

        assertEquals(EventStrategy.ALL, PredictorConfig.fromJson("{\"event_strategy\": \"ALL\"}").getEventStrategy());
        assertNull(PredictorConfig.fromJson("{\"event_strategy\": null}").getEventStrategy());
        assertThat(new PredictorConfig().setEventStrategy(EventStrategy.FIRST).toJson())
            .contains("\"event_strategy\": \"first\"");
    }

    @Test
    void mergeOverridesOnlySetFields() {
        PredictorConfig base = new PredictorConfig().setDt(1.0).setHorizon(20.0).setEvents(List.of("a", "b"));
        PredictorConfig merged = base.merge(new PredictorConfig().setDt(0.1).setEvents(List.of("b")));

        assertEquals(0.1, merged.getDt());
        assertEquals(20.0, merged.getHorizon());
        assertThat(merged.getEvents()).containsExactly("b");
        assertEquals(1.0, base.getDt());
        assertThat(base.getEvents()).containsExactly("a", "b");
        assertEquals(1.0, base.merge(null).getDt());
    }

    @Test
    void savesAndLoadsFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("predictor.json");
        new PredictorConfig().setNSamples(40).setEventStrategy(EventStrategy.ALL).setQ(new double[][]{{1e-6}})
            .saveToFile(file);
        PredictorConfig loaded = PredictorConfig.loadFromFile(file);
        assertEquals(40, loaded.getNSamples());
        assertEquals(EventStrategy.ALL, loaded.getEventStrategy());
        assertEquals(1e-6, loaded.getQ()[0][0]);
    }
}
