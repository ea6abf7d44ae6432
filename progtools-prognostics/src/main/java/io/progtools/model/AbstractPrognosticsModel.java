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

import io.progtools.uncertain.KeySchema;
import io.progtools.uncertain.LabeledVector;
import org.apache.commons.rng.UniformRandomProvider;

/// Base for models with independent per-component process and measurement noise.
///
/// Process noise scales with the step: `x + dt · ε`, `ε ~ D(0, processNoise)`.
/// Measurement noise does not: `z + ε`, `ε ~ D(0, measurementNoise)`.
/// Both default to zero.
public abstract class AbstractPrognosticsModel implements PrognosticsModel {

    private final KeySchema states;
    private final KeySchema inputs;
    private final KeySchema outputs;
    private final KeySchema events;

    private LabeledVector processNoise;
    private LabeledVector measurementNoise;
    private NoiseDistribution processNoiseDistribution = NoiseDistribution.NORMAL;
    private NoiseDistribution measurementNoiseDistribution = NoiseDistribution.NORMAL;

    protected AbstractPrognosticsModel(KeySchema states, KeySchema inputs, KeySchema outputs, KeySchema events) {
        this.states = states;
        this.inputs = inputs;
        this.outputs = outputs;
        this.events = events;
        this.processNoise = states.zeros();
        this.measurementNoise = outputs.zeros();
    }

    @Override
    public KeySchema states() {
        return states;
    }

    @Override
    public KeySchema inputs() {
        return inputs;
    }

    @Override
    public KeySchema outputs() {
        return outputs;
    }

    @Override
    public KeySchema events() {
        return events;
    }

    @Override
    public LabeledVector processNoise() {
        return processNoise;
    }

    @Override
    public LabeledVector measurementNoise() {
        return measurementNoise;
    }

    /// Sets the same process noise standard deviation for every state.
    public void setProcessNoise(double std) {
        this.processNoise = states.zeros().plus(std);
    }

    /// @throws io.progtools.uncertain.KeyNotFoundException if a state is missing
    public void setProcessNoise(LabeledVector std) {
        this.processNoise = std.reorder(states);
    }

    public void setMeasurementNoise(double std) {
        this.measurementNoise = outputs.zeros().plus(std);
    }

    public void setMeasurementNoise(LabeledVector std) {
        this.measurementNoise = std.reorder(outputs);
    }

    public NoiseDistribution getProcessNoiseDistribution() {
        return processNoiseDistribution;
    }

    public void setProcessNoiseDistribution(NoiseDistribution distribution) {
        this.processNoiseDistribution = distribution;
    }

    public NoiseDistribution getMeasurementNoiseDistribution() {
        return measurementNoiseDistribution;
    }

    public void setMeasurementNoiseDistribution(NoiseDistribution distribution) {
        this.measurementNoiseDistribution = distribution;
    }

    @Override
    public LabeledVector applyProcessNoise(LabeledVector x, double dt, UniformRandomProvider rng) {
        return addNoise(x, processNoise, processNoiseDistribution, dt, rng);
    }

    @Override
    public LabeledVector applyMeasurementNoise(LabeledVector z, UniformRandomProvider rng) {
        return addNoise(z, measurementNoise, measurementNoiseDistribution, 1.0, rng);
    }

    private static LabeledVector addNoise(LabeledVector v, LabeledVector std, NoiseDistribution distribution,
                                          double scale, UniformRandomProvider rng) {
        if (distribution == NoiseDistribution.NONE) {
            return v;
        }
        NoiseDistribution.Source source = distribution.source(rng);
        double[] values = v.toArray();
        for (int i = 0; i < values.length; i++) {
            double s = std.get(i);
            if (s != 0.0) {
                values[i] += scale * source.draw(s);
            }
        }
        return v.withValues(values);
    }
}
