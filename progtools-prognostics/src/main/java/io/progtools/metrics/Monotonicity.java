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

/// Monotonicity of a sequence: `|Σ sign(x[i+1] - x[i])| / (N - 1)`.
///
/// 1 for a strictly increasing or decreasing sequence, 0 when rises and falls
/// cancel out, as for an alternating sequence of an odd number of values. An
/// alternating sequence of an even number of values has one unmatched step and
/// gives `1 / (N - 1)`. Fewer than two values give NaN.
public final class Monotonicity {

    private Monotonicity() {
    }

    public static double of(double[] values) {
        if (values.length < 2) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (int i = 0; i < values.length - 1; i++) {
            sum += Math.signum(values[i + 1] - values[i]);
        }
        return Math.abs(sum / (values.length - 1));
    }
}
