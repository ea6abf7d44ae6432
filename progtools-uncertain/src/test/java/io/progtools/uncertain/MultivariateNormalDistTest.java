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

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class MultivariateNormalDistTest {

    private final KeySchema schema = KeySchema.of("x", "v");

    @Test
    void sampleMomentsApproachParameters() {
        MultivariateNormalDist dist = new MultivariateNormalDist(schema, new double[]{1.0, -2.0},
            new double[][]{{4.0, 1.0}, {1.0, 2.0}});
        UnweightedSamples samples = dist.sample(20_000, RandomGenerators.create(42L));

        LabeledVector mean = samples.mean();
        assertEquals(1.0, mean.get("x"), 0.06);
        assertEquals(-2.0, mean.get("v"), 0.06);

        double[][] cov = samples.cov();
        assertEquals(4.0, cov[0][0], 0.2);
        assertEquals(1.0, cov[0][1], 0.1);
        assertEquals(2.0, cov[1][1], 0.1);
    }

    @Test
    void singularCovarianceSamplesOnALine() {
        MultivariateNormalDist dist = new MultivariateNormalDist(schema, new double[]{0.0, 0.0},
            new double[][]{{1.0, 1.0}, {1.0, 1.0}});
        for (LabeledVector s : dist.sample(100, RandomGenerators.create(3L))) {
            assertEquals(s.get("x"), s.get("v"), 1e-6);
        }
    }

    @Test
    void medianIsMean() {
        MultivariateNormalDist dist = new MultivariateNormalDist(schema.vector(3, 4), new double[][]{{1, 0}, {0, 1}});
        assertEquals(dist.mean(), dist.median());
    }

    @Test
    void dimensionMismatchRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new MultivariateNormalDist(schema, new double[]{1.0}, new double[][]{{1, 0}, {0, 1}}));
        assertThrows(IllegalArgumentException.class,
            () -> new MultivariateNormalDist(schema, new double[]{1.0, 2.0}, new double[][]{{1, 0}}));
    }

    @Test
    void covIsDefensiveCopy() {
        MultivariateNormalDist dist = new MultivariateNormalDist(schema.vector(0, 0), new double[][]{{1, 0}, {0, 1}});
        dist.cov()[0][0] = 99;
        assertEquals(1.0, dist.cov()[0][0]);
    }

    @Test
    void boundsFractionIsSampled() {
        MultivariateNormalDist dist = new MultivariateNormalDist(schema.vector(0, 0), new double[][]{{1, 0}, {0, 1}});
        Map<String, Double> pct = dist.percentageInBounds(-1.0, 1.0);
        // P(|Z| < 1) = 0.6827
        assertEquals(0.68, pct.get("x"), 0.06);
        assertEquals(0.68, pct.get("v"), 0.06);
    }

    @Test
    void shiftMovesMeanOnly() {
        MultivariateNormalDist dist = new MultivariateNormalDist(schema.vector(1, 2), new double[][]{{1, 0}, {0, 1}});
        MultivariateNormalDist shifted = dist.add(10);
        assertArrayEquals(new double[]{11, 12}, shifted.mean().toArray());
        assertArrayEquals(dist.cov()[1], shifted.cov()[1]);
    }

    @Test
    void unresolvedComponentSamplesAsNaN() {
        double nan = Double.NaN;
        MultivariateNormalDist dist = new MultivariateNormalDist(schema, new double[]{4.1, nan},
            new double[][]{{0.01, nan}, {nan, nan}});
        UnweightedSamples samples = dist.sample(500, RandomGenerators.create(9L));

        double sum = 0.0;
        for (LabeledVector sample : samples) {
            assertTrue(Double.isFinite(sample.get("x")));
            assertTrue(Double.isNaN(sample.get("v")));
            sum += sample.get("x");
        }
        assertEquals(4.1, sum / 500, 0.02);
        Map<String, Double> inBounds = dist.percentageInBounds(Map.of("x", new double[]{3.5, 4.7}, "v", new double[]{0, 10}));
        assertEquals(1.0, inBounds.get("x"), 1e-12);
        assertEquals(0.0, inBounds.get("v"), 1e-12);
    }

    @Test
    void everyComponentUnresolvedStillSamples() {
        double nan = Double.NaN;
        MultivariateNormalDist dist = new MultivariateNormalDist(schema, new double[]{nan, nan},
            new double[][]{{nan, nan}, {nan, nan}});
        for (LabeledVector sample : dist.sample(10, RandomGenerators.create(1L))) {
            assertTrue(Double.isNaN(sample.get("x")));
            assertTrue(Double.isNaN(sample.get("v")));
        }
    }
}
