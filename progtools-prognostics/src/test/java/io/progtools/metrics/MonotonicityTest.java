package io.progtools.metrics;

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

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class MonotonicityTest {

    @Test
    void strictlyIncreasingOrDecreasing() {
        double[] rising = new double[10];
        for (int i = 0; i < rising.length; i++) {
            rising[i] = i * i;
        }
        assertEquals(1.0, Monotonicity.of(rising));
        assertEquals(1.0, Monotonicity.of(new double[]{5, 4, 3, 2}));
    }

    @Test
    void alternatingCancelsOut() {
        assertEquals(0.0, Monotonicity.of(new double[]{1, 2, 1, 2, 1}));
    }

    @Test
    void evenLengthAlternatingKeepsOneStep() {
        assertEquals(1.0 / 3.0, Monotonicity.of(new double[]{1, 2, 1, 2}), 1e-12);
        assertEquals(1.0 / 5.0, Monotonicity.of(new double[]{4, 3, 4, 3, 4, 3}), 1e-12);
    }

    @Test
    void flatStepsCountAsZero() {
        assertEquals(0.5, Monotonicity.of(new double[]{1, 2, 2}));
    }

    @Test
    void tooShortIsNaN() {
        assertTrue(Double.isNaN(Monotonicity.of(new double[]{3})));
        assertTrue(Double.isNaN(Monotonicity.of(new double[0])));
    }
}
