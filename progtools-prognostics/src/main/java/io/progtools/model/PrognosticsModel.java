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

import io.progtools.loading.LoadingFunction;
import io.progtools.uncertain.KeySchema;
import io.progtools.uncertain.LabeledVector;
import org.apache.commons.rng.UniformRandomProvider;

/// A dynamic system whose degradation is tracked and predicted.
///
/// ## Contract
///
/// The four schemas are fixed for the lifetime of the model and name every
/// vector the model consumes or produces:
///
/// | Method | Argument schema | Result schema |
/// |--------|-----------------|---------------|
/// | [#nextState] | states, inputs | states |
/// | [#output] | states | outputs |
/// | [#eventState] | states | events, each in `[0, 1]` where 0 means the event occurred |
/// | [#thresholdMet] | states | one flag per event, in event order |
///
/// Noise is applied only through [#applyProcessNoise] and
/// [#applyMeasurementNoise], so filters that carry uncertainty in a covariance
/// can propagate with the noise-free [#nextState] and [#output].
public interface PrognosticsModel {

    KeySchema states();

    KeySchema inputs();

    KeySchema outputs();

    KeySchema events();

    /// Initial state for the given input and output.
    ///
    /// @param u input, may be null
    /// @param z output, may be null
    /// @return the initial state
    LabeledVector initialize(LabeledVector u, LabeledVector z);

    /// Noise-free state transition over `dt` seconds.
    LabeledVector nextState(LabeledVector x, LabeledVector u, double dt);

    /// Noise-free measurement of a state.
    LabeledVector output(LabeledVector x);

    /// Progress toward each event, 1 far from the event and 0 once it occurred.
    LabeledVector eventState(LabeledVector x);

    /// Whether each event threshold has been reached, indexed like [#events()].
    ///
    /// The default treats an event state at or below zero as met.
    default boolean[] thresholdMet(LabeledVector x) {
        LabeledVector es = eventState(x);
        boolean[] met = new boolean[es.size()];
        for (int i = 0; i < met.length; i++) {
            met[i] = es.get(i) <= 0.0;
        }
        return met;
    }

    /// Clamps a state into its physical limits. The default is the identity.
    default LabeledVector applyLimits(LabeledVector x) {
        return x;
    }

    /// Adds process noise for a step of `dt` seconds. The default adds none.
    default LabeledVector applyProcessNoise(LabeledVector x, double dt, UniformRandomProvider rng) {
        return x;
    }

    /// Adds measurement noise to an output. The default adds none.
    default LabeledVector applyMeasurementNoise(LabeledVector z, UniformRandomProvider rng) {
        return z;
    }

    /// @return per-state process noise standard deviation
    default LabeledVector processNoise() {
        return states().zeros();
    }

    /// @return per-output measurement noise standard deviation
    default LabeledVector measurementNoise() {
        return outputs().zeros();
    }

    /// Simulates from `x0` until a requested event threshold is met or the
    /// horizon elapses.
    ///
    /// @param load future loading
    /// @param x0 initial state
    /// @param config simulation parameters
    /// @param rng generator for process noise
    /// @return the saved trajectory
    /// @throws ConfigurationException if the events or step parameters are invalid
    default SimulationResults simulateToThreshold(LoadingFunction load, LabeledVector x0,
                                                  SimulationConfig config, UniformRandomProvider rng) {
        return new ThresholdSimulator(this).simulate(load, x0, config, rng);
    }
}
