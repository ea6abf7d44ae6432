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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// Fixed-step simulation of a model until a requested event threshold is met.
///
/// ## Loop
///
/// ```
///  save(t0, u0, x0) ──► any event met? ──yes──► done
///        │ no
///        ▼
///  ┌─► t < t0 + horizon? ──no──► save last ──► done
///  │     │ yes
///  │     ▼
///  │   u = load(t + dt/2, x)
///  │   x = limits(noise(nextState(x, u, dt)))
///  │   t += dt
///  │     │
///  │     ├─ event met ─────────► save last ──► done
///  │     └─ save point reached ─► save
///  └─────┘
/// ```
///
/// The last step is shortened to land exactly on the horizon. Save points are
/// every multiple of `saveFreq` after the save origin (`t0` unless configured)
/// plus the explicit `savePts`. The first
/// and the last simulated instants are always saved.
public final class ThresholdSimulator {

    private static final Logger logger = LogManager.getLogger(ThresholdSimulator.class);

    /// Relative slack when comparing accumulated time against save points.
    private static final double TIME_EPSILON = 1e-9;

    private final PrognosticsModel model;

    public ThresholdSimulator(PrognosticsModel model) {
        this.model = model;
    }

    /// Validates the requested events against the model.
    ///
    /// @param model the model
    /// @param requested requested event names, or null for every model event
    /// @param horizon the simulation horizon
    /// @return the event names to simulate to
    /// @throws ConfigurationException for an unknown event, or for no events with
    ///         an infinite horizon
    public static List<String> resolveEvents(PrognosticsModel model, List<String> requested, double horizon) {
        List<String> events = requested == null ? model.events().keys() : requested;
        for (String event : events) {
            if (!model.events().contains(event)) {
                throw new ConfigurationException(event, "Unknown event '" + event + "'. Model events: "
                    + model.events().keys());
            }
        }
        if (events.isEmpty() && Double.isInfinite(horizon)) {
            throw new ConfigurationException("horizon",
                "If specifying no event (i.e., simulate to time), a finite horizon is required");
        }
        return List.copyOf(events);
    }

    /// Runs one simulation.
    ///
    /// @param load future loading, evaluated at the middle of each step
    /// @param x0 initial state, reordered into the model's state schema
    /// @param config simulation parameters
    /// @param rng process noise generator
    /// @return the saved trajectory, outputs and event states derived lazily
    /// @throws ConfigurationException if events, step or horizon are invalid
    public SimulationResults simulate(LoadingFunction load, LabeledVector x0, SimulationConfig config,
                                      UniformRandomProvider rng) {
        double dt = config.getDt();
        if (!(dt > 0.0)) {
            throw new ConfigurationException("dt", "dt must be positive, was " + dt);
        }
        double horizon = config.getHorizon();
        if (Double.isNaN(horizon) || horizon < 0.0) {
            throw new ConfigurationException("horizon", "horizon must not be negative, was " + horizon);
        }
        double saveFreq = config.getSaveFreq();
        if (!(saveFreq > 0.0)) {
            throw new ConfigurationException("save_freq", "save_freq must be positive, was " + saveFreq);
        }
        List<String> events = resolveEvents(model, config.getEvents(), horizon);
        KeySchema eventSchema = model.events();
        int[] eventIndex = new int[events.size()];
        for (int i = 0; i < eventIndex.length; i++) {
            eventIndex[i] = eventSchema.indexOf(events.get(i));
        }
        double[] constantNoise = config.getConstantProcessNoise();
        if (constantNoise != null && constantNoise.length != model.states().size()) {
            throw new ConfigurationException("constant_process_noise", "Expected " + model.states().size()
                + " values, one per state, got " + constantNoise.length);
        }
        double[] savePts = config.getSavePts().stream().mapToDouble(Double::doubleValue).sorted().toArray();

        double t0 = config.getT0();
        double tEnd = t0 + horizon;
        List<Double> times = new ArrayList<>();
        List<LabeledVector> inputs = new ArrayList<>();
        List<LabeledVector> states = new ArrayList<>();

        double t = t0;
        LabeledVector x = model.applyLimits(x0.reorder(model.states()));
        LabeledVector u = load.load(t, x);
        times.add(t);
        inputs.add(u);
        states.add(x);

        int savePtIndex = 0;
        while (savePtIndex < savePts.length && savePts[savePtIndex] <= t0) {
            savePtIndex++;
        }
        double nextSave = firstSaveAfter(t0, config.getSaveOrigin() == null ? t0 : config.getSaveOrigin(), saveFreq);
        long steps = 0;
        boolean met = anyMet(x, eventIndex);

        while (!met && t < tEnd) {
            double stepEnd = t0 + (steps + 1) * dt;
            double step = dt;
            if (stepEnd >= tEnd) {
                stepEnd = tEnd;
                step = tEnd - t;
            }
            u = load.load(t + step / 2.0, x);
            x = model.nextState(x, u, step);
            x = constantNoise != null ? addConstantNoise(x, constantNoise, step) : model.applyProcessNoise(x, step, rng);
            x = model.applyLimits(x);
            t = stepEnd;
            steps++;

            met = anyMet(x, eventIndex);
            if (met || t >= tEnd) {
                break;
            }
            boolean save = false;
            if (reached(t, nextSave)) {
                save = true;
                while (reached(t, nextSave)) {
                    nextSave += saveFreq;
                }
            }
            if (savePtIndex < savePts.length && reached(t, savePts[savePtIndex])) {
                save = true;
                while (savePtIndex < savePts.length && reached(t, savePts[savePtIndex])) {
                    savePtIndex++;
                }
            }
            if (save) {
                times.add(t);
                inputs.add(u);
                states.add(x);
            }
        }
        if (steps > 0) {
            times.add(t);
            inputs.add(u);
            states.add(x);
        }
        logger.debug("Simulated {} steps from t={} to t={}, event met: {}", steps, t0, t, met);

        SimResult stateSeries = new SimResult(times, states);
        return new SimulationResults(
            new SimResult(times, inputs),
            stateSeries,
            new LazySimResult(stateSeries, model::output),
            new LazySimResult(stateSeries, model::eventState));
    }

    private boolean anyMet(LabeledVector x, int[] eventIndex) {
        if (eventIndex.length == 0) {
            return false;
        }
        boolean[] met = model.thresholdMet(x);
        for (int i : eventIndex) {
            if (met[i]) {
                return true;
            }
        }
        return false;
    }

    private static double firstSaveAfter(double t0, double origin, double saveFreq) {
        double k = t0 > origin ? Math.floor((t0 - origin) / saveFreq) + 1.0 : 1.0;
        double next = origin + k * saveFreq;
        while (reached(t0, next)) {
            next += saveFreq;
        }
        return next;
    }

    private static boolean reached(double t, double target) {
        return t >= target - TIME_EPSILON * Math.max(1.0, Math.abs(target));
    }

    private static LabeledVector addConstantNoise(LabeledVector x, double[] noise, double dt) {
        double[] values = x.toArray();
        for (int i = 0; i < values.length; i++) {
            values[i] += dt * noise[i];
        }
        return x.withValues(values);
    }
}
