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

import io.progtools.model.VectorizedPrognosticsModel;
import io.progtools.uncertain.LabeledVector;
import org.apache.commons.rng.UniformRandomProvider;

/// Propagates the whole particle set with one call per model stage.
public final class BatchParticlePropagator implements ParticlePropagator {

    private final VectorizedPrognosticsModel model;

    public BatchParticlePropagator(VectorizedPrognosticsModel model) {
        this.model = model;
    }

    @Override
    public double[][] propagate(double[][] particles, LabeledVector u, double dt, UniformRandomProvider rng) {
        double[][] next = model.nextStates(particles, u, dt);
        return model.applyLimits(model.applyProcessNoise(next, dt, rng));
    }

    @Override
    public double[][] outputs(double[][] particles) {
        return model.outputs(particles);
    }
}
