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

import io.progtools.model.PrognosticsModel;
import io.progtools.model.VectorizedPrognosticsModel;
import io.progtools.uncertain.LabeledVector;
import org.apache.commons.rng.UniformRandomProvider;

/// Moves a particle set through the model, `[particle][state]` in model state order.
///
/// The implementation is chosen once per filter by [#forModel]: models that
/// implement [VectorizedPrognosticsModel] get a batch propagator, all others a loop.
public interface ParticlePropagator {

    /// Advances every particle by `dt`: transition, process noise, then limits.
    double[][] propagate(double[][] particles, LabeledVector u, double dt, UniformRandomProvider rng);

    /// Noise-free output of every particle, `[particle][output]` in model output order.
    double[][] outputs(double[][] particles);

    static ParticlePropagator forModel(PrognosticsModel model) {
        if (model instanceof VectorizedPrognosticsModel vectorized) {
            return new BatchParticlePropagator(vectorized);
        }
        return new LoopParticlePropagator(model);
    }
}
