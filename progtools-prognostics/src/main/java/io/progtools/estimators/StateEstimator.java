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

import io.progtools.model.ConfigurationException;
import io.progtools.model.PrognosticsModel;
import io.progtools.uncertain.KeySchema;
import io.progtools.uncertain.LabeledVector;
import io.progtools.uncertain.ScalarData;
import io.progtools.uncertain.UncertainData;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Base class for recursive Bayesian filters over a [PrognosticsModel].
///
/// ## Estimate cycle
///
/// ```
/// estimate(t, u, z)
///   │
///   ├─ t <= clock ──────────────► TimeOrderingException
///   │
///   ├─ while clock < t:
///   │     step = min(dt, t - clock)
///   │     predict(u, step)
///   │     clock += step
///   │
///   └─ correct(z)
/// ```
///
/// The last sub-step lands exactly on `t`. Subclasses hold the belief in
/// whatever form suits them and expose it through [#getState()].
public abstract class StateEstimator {

    private static final Logger logger = LogManager.getLogger(StateEstimator.class);

    protected final PrognosticsModel model;
    protected final EstimatorConfig config;
    private final double dt;
    private double time;

    /// @param model the model to track
    /// @param x0 the initial belief, must hold every model state
    /// @param config tuning parameters, may be null
    /// @param defaultT0 initial time used when the config leaves it unset
    /// @param defaultDt maximum sub-step used when the config leaves it unset
    /// @throws ConfigurationException if `x0` lacks a model state or `dt` is not positive
    protected StateEstimator(PrognosticsModel model, UncertainData x0, EstimatorConfig config,
                             double defaultT0, double defaultDt) {
        this.model = model;
        this.config = config == null ? new EstimatorConfig() : config;
        requireStates(model, x0);
        this.time = this.config.t0Or(defaultT0);
        this.dt = this.config.dtOr(defaultDt);
        if (!(dt > 0.0)) {
            throw new ConfigurationException("dt", "dt must be positive, was " + dt);
        }
        logger.debug("{} starting at t={} with max step {}", getClass().getSimpleName(), time, dt);
    }

    /// Updates the belief with a measurement taken at time `t`.
    ///
    /// @param t measurement time, strictly after [#getTime()]
    /// @param u input held from the current time until `t`, may be null for input-free models
    /// @param z measured output
    /// @throws TimeOrderingException if `t` is not after the current time
    public void estimate(double t, LabeledVector u, LabeledVector z) {
        estimate(t, u, z, dt);
    }

    /// As [#estimate(double, LabeledVector, LabeledVector)] with a one-off maximum sub-step.
    public void estimate(double t, LabeledVector u, LabeledVector z, double maxStep) {
        if (!(t > time)) {
            throw new TimeOrderingException(time, t);
        }
        if (!(maxStep > 0.0)) {
            throw new ConfigurationException("dt", "dt must be positive, was " + maxStep);
        }
        LabeledVector input = u == null ? model.inputs().zeros() : u.reorder(model.inputs());
        LabeledVector output = z.reorder(model.outputs());
        double clock = time;
        int steps = 0;
        while (clock < t) {
            double remaining = t - clock;
            if (maxStep >= remaining) {
                predict(input, remaining);
                clock = t;
            } else {
                predict(input, maxStep);
                clock += maxStep;
            }
            steps++;
        }
        correct(output);
        time = t;
        logger.trace("Estimated t={} in {} sub-steps", t, steps);
    }

    /// Advances the belief by one sub-step without a measurement.
    protected abstract void predict(LabeledVector u, double dt);

    /// Corrects the belief with a measurement at the current time.
    protected abstract void correct(LabeledVector z);

    /// @return the current belief over the model states
    public abstract UncertainData getState();

    /// @return the time of the current belief
    public double getTime() {
        return time;
    }

    public PrognosticsModel getModel() {
        return model;
    }

    /// @throws ConfigurationException naming the first model state missing from `x0`
    static void requireStates(PrognosticsModel model, UncertainData x0) {
        for (String state : model.states().keys()) {
            if (!x0.contains(state)) {
                throw new ConfigurationException(state, "Initial state is missing state '" + state
                    + "'. Provided keys: " + x0.keys());
            }
        }
    }

    /// Covariance of `x0` in the order of `target`.
    ///
    /// A plain [ScalarData] carries no spread, so `fallback / 10` is used instead.
    static double[][] initialCovariance(UncertainData x0, KeySchema target, double[][] fallback) {
        if (x0 instanceof ScalarData) {
            logger.warn("Initial state is ScalarData with no covariance; using Q/10 as initial covariance");
            double[][] p = new double[fallback.length][fallback.length];
            for (int i = 0; i < p.length; i++) {
                for (int j = 0; j < p.length; j++) {
                    p[i][j] = fallback[i][j] / 10.0;
                }
            }
            return p;
        }
        return x0.cov(target);
    }

    /// `scale · I` of the given size.
    static double[][] diagonal(int n, double scale) {
        double[][] m = new double[n][n];
        for (int i = 0; i < n; i++) {
            m[i][i] = scale;
        }
        return m;
    }

    static double[][] requireSquare(String parameter, double[][] matrix, int n) {
        if (matrix.length != n) {
            throw new ConfigurationException(parameter, parameter + " must be " + n + "x" + n + ", got "
                + matrix.length + " rows");
        }
        for (double[] row : matrix) {
            if (row.length != n) {
                throw new ConfigurationException(parameter, parameter + " must be " + n + "x" + n
                    + ", got a row of " + row.length);
            }
        }
        return matrix;
    }
}
