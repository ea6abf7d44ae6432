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

import io.progtools.uncertain.KeySchema;
import io.progtools.uncertain.LabeledVector;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class GaussianNoiseLoadWrapperTest {

    private final KeySchema inputs = KeySchema.of("u1", "u2");
    private final LoadingFunction constant = (t, x) -> inputs.vector(1.0, 2.0);

    @Test
    void sameSeedSameNoise() {
        GaussianNoiseLoadWrapper a = new GaussianNoiseLoadWrapper(constant, 0.5, 42L);
        GaussianNoiseLoadWrapper b = new GaussianNoiseLoadWrapper(constant, 0.5, 42L);
        for (int i = 0; i < 20; i++) {
            assertEquals(a.load(i, null), b.load(i, null));
        }
    }

    @Test
    void differentSeedsDiffer() {
        LabeledVector a = new GaussianNoiseLoadWrapper(constant, 0.5, 1L).load(0, null);
        LabeledVector b = new GaussianNoiseLoadWrapper(constant, 0.5, 2L).load(0, null);
        assertNotEquals(a, b);
    }

    @Test
    void zeroStdIsTransparent() {
        GaussianNoiseLoadWrapper wrapper = new GaussianNoiseLoadWrapper(constant, 0.0, 3L);
        assertEquals(inputs.vector(1.0, 2.0), wrapper.load(5, null));
    }

    @Test
    void noiseIsCenteredWithRequestedSpread() {
        GaussianNoiseLoadWrapper wrapper = new GaussianNoiseLoadWrapper(constant, 0.5, 7L);
        int n = 20_000;
        double sum = 0;
        double sumSq = 0;
        for (int i = 0; i < n; i++) {
            double d = wrapper.load(i, null).get("u1") - 1.0;
            sum += d;
            sumSq += d * d;
        }
        assertThat(sum / n).isCloseTo(0.0, within(0.02));
        assertThat(Math.sqrt(sumSq / n)).isCloseTo(0.5, within(0.02));
    }

    @Test
    void stdGrowsWithSlopeAfterStart() {
        GaussianNoiseLoadWrapper wrapper = new GaussianNoiseLoadWrapper(constant, 0.1, 1L, 0.01, 10.0);
        assertEquals(0.1, wrapper.stdAt(5.0));
        assertThat(wrapper.stdAt(20.0)).isCloseTo(0.2, within(1e-12));
    }

    @Test
    void negativeStdRejected() {
        assertThrows(IllegalArgumentException.class, () -> new GaussianNoiseLoadWrapper(constant, -1.0, 1L));
    }
}
