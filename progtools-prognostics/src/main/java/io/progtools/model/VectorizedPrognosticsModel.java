package io.progtools.model;

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

import io.progtools.uncertain.LabeledVector;
import org.apache.commons.rng.UniformRandomProvider;

/// A model that can advance many states at once.
///
/// Batches are laid out `[particle][component]`, components in schema order.
/// The noise and limit defaults fall back to the single-state methods.
public interface VectorizedPrognosticsModel extends PrognosticsModel {

    /// Noise-free transition of every state in the batch.
    double[][] nextStates(double[][] x, LabeledVector u, double dt);

    /// Noise-free measurement of every state in the batch.
    double[][] outputs(double[][] x);

    default double[][] applyProcessNoise(double[][] x, double dt, UniformRandomProvider rng) {
        double[][] out = new double[x.length][];
        for (int p = 0; p < x.length; p++) {
            out[p] = applyProcessNoise(LabeledVector.of(states(), x[p]), dt, rng).toArray();
        }
        return out;
    }

    default double[][] applyLimits(double[][] x) {
        double[][] out = new double[x.length][];
        for (int p = 0; p < x.length; p++) {
            out[p] = applyLimits(LabeledVector.of(states(), x[p])).toArray();
        }
        return out;
    }
}
