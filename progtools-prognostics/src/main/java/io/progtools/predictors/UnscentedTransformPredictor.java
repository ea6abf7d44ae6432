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
import io.progtools.math.MerweScaledSigmaPoints;
import io.progtools.math.UnscentedTransform;
import io.progtools.model.ConfigurationException;
import io.progtools.model.PrognosticsModel;
import io.progtools.model.SimResult;
import io.progtools.uncertain.KeySchema;
import io.progtools.uncertain.LabeledVector;
import io.progtools.uncertain.MultivariateNormalDist;
import io.progtools.uncertain.ScalarData;
import io.progtools.uncertain.UncertainData;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Predicts by propagating sigma points instead of random samples.
///
/// The state belief `(x, P)` is advanced in fixed steps of `dt` like the
/// predict half of an unscented Kalman filter, with the input evaluated at the
/// mean state and `Q` added every step. After each step fresh sigma points are
/// tested against every requested event; the first time a point meets an event,
/// the time and the point are frozen for that (point, event) pair. Points keep
/// propagating until every pair is resolved or the horizon is reached.
///
/// ## Time of event
///
/// The frozen times are recombined with the unscented transform into one joint
/// [MultivariateNormalDist] over the events. This assumes the time of event is
/// Gaussian, which does not hold for strongly nonlinear thresholds. If any point
/// never met an event, the estimate for that event is NaN and its final state is null.
///
/// Only [EventStrategy#ALL] is supported, and the state must carry a covariance,
/// so [ScalarData] is rejected.
public class UnscentedTransformPredictor extends Predictor {

    private static final Logger logger = LogManager.getLogger(UnscentedTransformPredictor.class);

    public static final double DEFAULT_Q = 1e-8;
    private static final double TIME_EPSILON = 1e-9;
    /// Step limit applied when no horizon is set; events are then required.
    private static final double MAX_HORIZON = 1e99;

    public UnscentedTransformPredictor(PrognosticsModel model) {
        this(model, null);
    }

    public UnscentedTransformPredictor(PrognosticsModel model, PredictorConfig config) {
        super(model, builtInDefaults(), config);
    }

    private static PredictorConfig builtInDefaults() {
        return new PredictorConfig()
            .setT0(0.0)
            .setDt(0.5)
            .setHorizon(Double.POSITIVE_INFINITY)
            .setSaveFreq(1e99)
            .setSavePts(List.of())
            .setEventStrategy(EventStrategy.ALL)
            .setAlpha(1.0)
            .setBeta(0.0)
            .setKappa(-1.0);
    }

    @Override
    protected PredictionResult runPrediction(UncertainData state, LoadingFunction load, PredictorConfig config,
                                             List<String> events) {
        if (config.getEventStrategy() != EventStrategy.ALL) {
            throw new ConfigurationException("event_strategy", "event_strategy " + config.getEventStrategy()
                + " not supported. Only 'all' is supported by the unscented transform predictor");
        }
        if (state instanceof ScalarData) {
            throw new ConfigurationException("state",
                "ScalarData has no covariance to propagate; use a distribution such as MultivariateNormalDist");
        }
        double dt = config.getDt();
        if (!(dt > 0.0)) {
            throw new ConfigurationException("dt", "dt must be positive, was " + dt);
        }
        KeySchema states = model.states();
        int n = states.size();
        double[][] q = config.getQ() == null ? scaledIdentity(n, DEFAULT_Q) : config.getQ();
        if (q.length != n) {
            throw new ConfigurationException("Q", "Q must be " + n + "x" + n + ", got " + q.length + " rows");
        }
        MerweScaledSigmaPoints points = new MerweScaledSigmaPoints(n, config.getAlpha(), config.getBeta(),
            config.getKappa());
        double[] wm = points.meanWeights();
        double[] wc = points.covarianceWeights();
        int nPoints = points.numSigmas();

        double[] x = state.mean().reorder(states).toArray();
        double[][] p = state.cov(states);
        double t0 = config.getT0();
        double horizon = config.getHorizon();
        double tEnd = t0 + (Double.isInfinite(horizon) ? MAX_HORIZON : horizon);
        double saveFreq = config.getSaveFreq();
        double[] savePts = config.getSavePts().stream().mapToDouble(Double::doubleValue).sorted().toArray();
        int savePtIndex = 0;
        while (savePtIndex < savePts.length && savePts[savePtIndex] <= t0) {
            savePtIndex++;
        }
        double nextSave = t0 + saveFreq;

        double[][] toe = new double[nPoints][events.size()];
        for (double[] row : toe) {
            Arrays.fill(row, Double.NaN);
        }
        double[][][] lastStates = new double[events.size()][nPoints][];
        int[] eventIndex = events.stream().mapToInt(model.events()::indexOf).toArray();

        List<Double> times = new ArrayList<>();
        List<LabeledVector> inputs = new ArrayList<>();
        List<UncertainData> stateSnapshots = new ArrayList<>();

        double t = t0;
        LabeledVector u = load.load(t, LabeledVector.of(states, x));
        save(times, inputs, stateSnapshots, t, u, x, p);
        logger.debug("UT prediction of {} sigma points to {}, t0={}, dt={}", nPoints, events, t0, dt);

        long steps = 0;
        while (t < tEnd) {
            t += dt;
            steps++;
            u = load.load(t, LabeledVector.of(states, x));
            double[][] sigmas = points.sigmaPoints(x, p);
            double[][] propagated = new double[nPoints][];
            for (int i = 0; i < nPoints; i++) {
                LabeledVector next = model.nextState(LabeledVector.of(states, sigmas[i]), u, dt);
                propagated[i] = model.applyLimits(next).reorder(states).toArray();
            }
            UnscentedTransform.Result predicted = UnscentedTransform.transform(propagated, wm, wc, q);
            x = predicted.mean();
            p = predicted.cov();

            boolean saved = false;
            if (reached(t, nextSave)) {
                while (reached(t, nextSave)) {
                    nextSave += saveFreq;
                }
                save(times, inputs, stateSnapshots, t, u, x, p);
                saved = true;
            }
            if (savePtIndex < savePts.length && reached(t, savePts[savePtIndex])) {
                while (savePtIndex < savePts.length && reached(t, savePts[savePtIndex])) {
                    savePtIndex++;
                }
                if (!saved) {
                    save(times, inputs, stateSnapshots, t, u, x, p);
                }
            }

            boolean allMet = !events.isEmpty();
            double[][] check = points.sigmaPoints(x, p);
            for (int i = 0; i < nPoints; i++) {
                boolean[] met = model.thresholdMet(LabeledVector.of(states, check[i]));
                for (int e = 0; e < eventIndex.length; e++) {
                    if (met[eventIndex[e]]) {
                        if (Double.isNaN(toe[i][e])) {
                            toe[i][e] = t;
                            lastStates[e][i] = check[i];
                        }
                    } else {
                        allMet = false;
                    }
                }
            }
            if (allMet) {
                break;
            }
        }
        if (steps > 0 && times.get(times.size() - 1) != t) {
            save(times, inputs, stateSnapshots, t, u, x, p);
        }
        logger.debug("UT prediction stopped at t={} after {} steps", t, steps);

        KeySchema eventSchema = KeySchema.of(events);
        UnscentedTransform.Result toeMoments = UnscentedTransform.transform(toe, wm, wc, null);
        MultivariateNormalDist timeOfEvent = new MultivariateNormalDist(eventSchema, toeMoments.mean(), toeMoments.cov());
        Map<String, UncertainData> finalStates = new LinkedHashMap<>();
        for (int e = 0; e < events.size(); e++) {
            finalStates.put(events.get(e), finalState(lastStates[e], wm, wc));
        }

        Prediction statePrediction = new Prediction(times, stateSnapshots);
        return new PredictionResult(
            times,
            new UnweightedSamplesPrediction(times, model.inputs(), List.of(new SimResult(times, inputs))),
            statePrediction,
            new LazyUTPrediction(statePrediction, points, model::output, model.outputs()),
            new LazyUTPrediction(statePrediction, points, model::eventState, model.events()),
            timeOfEvent,
            finalStates);
    }

    private MultivariateNormalDist finalState(double[][] pointStates, double[] wm, double[] wc) {
        for (double[] s : pointStates) {
            if (s == null) {
                return null;
            }
        }
        UnscentedTransform.Result moments = UnscentedTransform.transform(pointStates, wm, wc, null);
        return new MultivariateNormalDist(model.states(), moments.mean(), moments.cov());
    }

    private void save(List<Double> times, List<LabeledVector> inputs, List<UncertainData> states,
                      double t, LabeledVector u, double[] x, double[][] p) {
        times.add(t);
        inputs.add(u);
        states.add(new MultivariateNormalDist(model.states(), x.clone(), p));
    }

    private static boolean reached(double t, double target) {
        return t >= target - TIME_EPSILON * Math.max(1.0, Math.abs(target));
    }

    private static double[][] scaledIdentity(int n, double scale) {
        double[][] m = new double[n][n];
        for (int i = 0; i < n; i++) {
            m[i][i] = scale;
        }
        return m;
    }
}
