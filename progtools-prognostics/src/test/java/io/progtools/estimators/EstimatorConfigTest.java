package io.progtools.estimators;

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
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class EstimatorConfigTest {

    @Test
    void parsesSnakeCaseJson() {
        EstimatorConfig config = EstimatorConfig.fromJson("""
            {
              "dt": 0.5,
              "Q": [[0.1, 0.0], [0.0, 0.2]],
              "num_particles": 250,
              "measurement_noise": {"x": 0.3},
              "resampling": "SYSTEMATIC",
              "seed": 9
            }
            """);
        assertEquals(0.5, config.getDt());
        assertEquals(0.2, config.getQ()[1][1]);
        assertEquals(250, config.getNumParticles());
        assertEquals(0.3, config.getMeasurementNoise().get("x"));
        assertEquals(ResamplingStrategy.SYSTEMATIC, config.getResampling());
        assertEquals(9L, config.getSeed());
        assertNull(config.getT0());
        assertNull(config.getAlpha());
    }

    @Test
    void savesAndLoadsFile(@TempDir Path dir) throws IOException {
        EstimatorConfig config = new EstimatorConfig().setT0(1.0).setKappa(0.5).setMeasurementNoise(Map.of("x", 2.0));
        Path file = dir.resolve("estimator.json");
        config.saveToFile(file);
        EstimatorConfig loaded = EstimatorConfig.loadFromFile(file);
        assertEquals(1.0, loaded.getT0());
        assertEquals(0.5, loaded.getKappa());
        assertEquals(2.0, loaded.getMeasurementNoise().get("x"));
    }
}
