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
import io.progtools.uncertain.KeySchema;
import io.progtools.uncertain.LabeledVector;
import org.apache.commons.rng.UniformRandomProvider;

/// Propagates particles one at a time through the single-state model methods.
public final class LoopParticlePropagator implements ParticlePropagator {

    private final PrognosticsModel model;

    public LoopParticlePropagator(PrognosticsModel model) {
        this.model = model;
    }

    @Override
    public double[][] propagate(double[][] particles, LabeledVector u, double dt, UniformRandomProvider rng) {
        KeySchema states = model.states();
        double[][] next = new double[particles.length][];
        for (int i = 0; i < particles.length; i++) {
            LabeledVector x = model.nextState(LabeledVector.of(states, particles[i]), u, dt);
            x = model.applyLimits(model.applyProcessNoise(x, dt, rng));
            next[i] = x.reorder(states).toArray();
        }
        return next;
    }

    @Override
    public double[][] outputs(double[][] particles) {
        KeySchema states = model.states();
        double[][] z = new double[particles.length][];
        for (int i = 0; i < particles.length; i++) {
            z[i] = model.output(LabeledVector.of(states, particles[i])).reorder(model.outputs()).toArray();
        }
        return z;
    }
}
