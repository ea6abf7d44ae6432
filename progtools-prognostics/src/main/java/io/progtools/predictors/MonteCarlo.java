package io.progtools.predictors;

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
import io.progtools.model.ConfigurationException;
import io.progtools.model.LazySimResult;
import io.progtools.model.PrognosticsModel;
import io.progtools.model.SimResult;
import io.progtools.model.SimulationConfig;
import io.progtools.model.SimulationResults;
import io.progtools.uncertain.KeySchema;
import io.progtools.uncertain.LabeledVector;
import io.progtools.uncertain.RandomGenerators;
import io.progtools.uncertain.UncertainData;
import io.progtools.uncertain.UnweightedSamples;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Monte Carlo predictor: simulates independent realizations of the initial state.
///
/// ## Per realization
///
/// ```
///  remaining = events
///  loop:
///    simulateToThreshold(x, t, remaining, horizon left)
///    no event met ──────────────► remaining stay unresolved, stop
///    first met event e:
///      ToE[e] = t_end, finalState[e] = x_end
///      ALL:   remaining -= e      FIRST: remaining = {}
///      remaining empty ─────────► stop
///      otherwise continue from (t_end, x_end)
/// ```
///
/// The point an event was met at is recorded once: it ends one simulation and
/// starts the next. Series from all realizations are merged on the longest time
/// grid into [UnweightedSamplesPrediction]s.
///
/// ## Defaults
///
/// | Parameter | Default |
/// |-----------|---------|
/// | n_samples | 100, or the size of an [UnweightedSamples] state |
/// | t0 | 0 |
/// | dt | 1 |
/// | horizon | unbounded |
/// | save_freq | unbounded (first, last and explicit points only) |
/// | event_strategy | all |
/// | constant_noise | false |
public class MonteCarlo extends Predictor {

    private static final Logger logger = LogManager.getLogger(MonteCarlo.class);

    public static final int DEFAULT_N_SAMPLES = 100;

    public MonteCarlo(PrognosticsModel model) {
        this(model, null);
    }

    public MonteCarlo(PrognosticsModel model, PredictorConfig config) {
        super(model, builtInDefaults(), config);
    }

    private static PredictorConfig builtInDefaults() {
        return new PredictorConfig()
            .setT0(0.0)
            .setDt(1.0)
            .setHorizon(Double.POSITIVE_INFINITY)
            .setSaveFreq(Double.POSITIVE_INFINITY)
            .setSavePts(List.of())
            .setEventStrategy(EventStrategy.ALL)
            .setConstantNoise(false);
    }

    @Override
    protected PredictionResult runPrediction(UncertainData state, LoadingFunction load, PredictorConfig config,
                                             List<String> events) {
        UniformRandomProvider rng = RandomGenerators.create(config.getSeed());
        UnweightedSamples realizations = realizations(state, config.getNSamples(), rng);
        KeySchema eventSchema = KeySchema.of(events);
        EventStrategy strategy = config.getEventStrategy();
        double t0 = config.getT0();
        double horizon = config.getHorizon();
        logger.debug("Monte Carlo prediction of {} realizations to {} ({}), t0={}, dt={}, horizon={}",
            realizations.size(), events, strategy, t0, config.getDt(), horizon);

        List<Double> longestTimes = new ArrayList<>();
        List<SimResult> inputs = new ArrayList<>();
        List<SimResult> states = new ArrayList<>();
        List<SimResult> outputs = new ArrayList<>();
        List<SimResult> eventStates = new ArrayList<>();
        UnweightedSamples timeOfEvent = new UnweightedSamples(eventSchema);
        List<UnweightedSamples> finalStates = new ArrayList<>();
        for (int e = 0; e < events.size(); e++) {
            finalStates.add(new UnweightedSamples(model.states()));
        }

        for (int r = 0; r < realizations.size(); r++) {
            LabeledVector x = realizations.get(r);
            if (x == null) {
                throw new ConfigurationException("state", "Realization " + r + " of the initial state is absent");
            }
            x = x.reorder(model.states());
            SimulationConfig sim = new SimulationConfig()
                .setDt(config.getDt())
                .setSaveFreq(config.getSaveFreq())
                .setSaveOrigin(t0)
                .setSavePts(config.getSavePts());
            if (Boolean.TRUE.equals(config.getConstantNoise())) {
                sim.setConstantProcessNoise(model.applyProcessNoise(x, 1.0, rng).minus(x).toArray());
            }

            List<Double> times = new ArrayList<>();
            List<LabeledVector> u = new ArrayList<>();
            List<LabeledVector> xs = new ArrayList<>();
            double[] toe = new double[events.size()];
            Arrays.fill(toe, Double.NaN);
            LabeledVector[] lastStates = new LabeledVector[events.size()];

            List<String> remaining = new ArrayList<>(events);
            double tStart = t0;
            LabeledVector xStart = x;
            do {
                sim.setT0(tStart).setHorizon(horizon - (tStart - t0)).setEvents(remaining);
                SimulationResults result = model.simulateToThreshold(load, xStart, sim, rng);
                times.addAll(result.times());
                u.addAll(result.inputs().data());
                xs.addAll(result.states().data());
                if (remaining.isEmpty()) {
                    break;
                }
                String event = firstMet(xs.get(xs.size() - 1), remaining);
                if (event == null) {
                    break;
                }
                int e = eventSchema.indexOf(event);
                int last = times.size() - 1;
                toe[e] = times.get(last);
                lastStates[e] = xs.get(last);
                if (strategy == EventStrategy.ALL) {
                    remaining.remove(event);
                } else {
                    remaining.clear();
                }
                if (!remaining.isEmpty()) {
                    tStart = times.remove(last);
                    u.remove(last);
                    xStart = xs.remove(last);
                }
            } while (!remaining.isEmpty());

            if (times.size() > longestTimes.size()) {
                longestTimes = times;
            }
            SimResult stateSeries = new SimResult(times, xs);
            inputs.add(new SimResult(times, u));
            states.add(stateSeries);
            outputs.add(new LazySimResult(stateSeries, model::output));
            eventStates.add(new LazySimResult(stateSeries, model::eventState));
            timeOfEvent.add(LabeledVector.of(eventSchema, toe));
            for (int e = 0; e < lastStates.length; e++) {
                finalStates.get(e).add(lastStates[e]);
            }
        }

        Map<String, UncertainData> finalStateByEvent = new LinkedHashMap<>();
        for (int e = 0; e < events.size(); e++) {
            finalStateByEvent.put(events.get(e), finalStates.get(e));
        }
        return new PredictionResult(
            longestTimes,
            new UnweightedSamplesPrediction(longestTimes, model.inputs(), inputs),
            new UnweightedSamplesPrediction(longestTimes, model.states(), states),
            new UnweightedSamplesPrediction(longestTimes, model.outputs(), outputs),
            new UnweightedSamplesPrediction(longestTimes, model.events(), eventStates),
            timeOfEvent,
            finalStateByEvent);
    }

    private UnweightedSamples realizations(UncertainData state, Integer nSamples, UniformRandomProvider rng) {
        if (nSamples != null && nSamples <= 0) {
            throw new ConfigurationException("n_samples", "n_samples must be positive, was " + nSamples);
        }
        if (state instanceof UnweightedSamples samples && (nSamples == null || nSamples == samples.size())) {
            return samples;
        }
        return state.sample(nSamples == null ? DEFAULT_N_SAMPLES : nSamples, rng);
    }

    private String firstMet(LabeledVector x, List<String> remaining) {
        boolean[] met = model.thresholdMet(x);
        KeySchema modelEvents = model.events();
        for (String event : remaining) {
            if (met[modelEvents.indexOf(event)]) {
                return event;
            }
        }
        return null;
    }
}
