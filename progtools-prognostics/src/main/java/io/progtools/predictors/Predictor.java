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
import io.progtools.model.PrognosticsModel;
import io.progtools.model.ThresholdSimulator;
import io.progtools.uncertain.UncertainData;

import java.util.List;

/// Base class for forward predictors.
///
/// A predictor binds to one model and holds a default [PredictorConfig]: the
/// subclass's built-in values overlaid with the values given at construction.
/// Each call to `predict` may override any of them again.
public abstract class Predictor {

    protected final PrognosticsModel model;
    private final PredictorConfig defaults;

    /// @param model the model to simulate
    /// @param builtIn the subclass defaults, every field set
    /// @param config user defaults, may be null
    protected Predictor(PrognosticsModel model, PredictorConfig builtIn, PredictorConfig config) {
        this.model = model;
        this.defaults = builtIn.merge(config);
    }

    public PredictionResult predict(UncertainData state, LoadingFunction load) {
        return predict(state, load, null);
    }

    /// Predicts forward from `state` until the requested events or the horizon.
    ///
    /// @param state belief over the model states at `t0`
    /// @param load future loading, null for zero input
    /// @param overrides per-call configuration, may be null
    /// @return the prediction
    /// @throws ConfigurationException for unknown events, no events without a horizon,
    ///         an unsupported strategy, or a state missing model keys
    public PredictionResult predict(UncertainData state, LoadingFunction load, PredictorConfig overrides) {
        PredictorConfig config = defaults.merge(overrides);
        for (String key : model.states().keys()) {
            if (!state.contains(key)) {
                throw new ConfigurationException(key, "State is missing state '" + key + "'. Provided keys: "
                    + state.keys());
            }
        }
        List<String> events = ThresholdSimulator.resolveEvents(model, config.getEvents(), config.getHorizon());
        LoadingFunction loading = load == null ? (t, x) -> model.inputs().zeros() : load;
        return runPrediction(state, loading, config, events);
    }

    /// Runs the prediction with a fully merged configuration and validated events.
    protected abstract PredictionResult runPrediction(UncertainData state, LoadingFunction load, PredictorConfig config,
                                                      List<String> events);

    /// @return a copy of the defaults this predictor runs with
    public PredictorConfig getDefaults() {
        return defaults.copy();
    }

    public PrognosticsModel getModel() {
        return model;
    }
}
