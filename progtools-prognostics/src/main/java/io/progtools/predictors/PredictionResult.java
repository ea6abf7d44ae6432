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

import io.progtools.uncertain.UncertainData;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Everything one `predict` call produces.
///
/// `inputs`, `states`, `outputs` and `eventStates` share the saved [#times()].
/// `timeOfEvent` holds one key per requested event. An event that was not
/// reached within the horizon is NaN (samples) or makes the joint estimate NaN
/// (unscented transform), and its [#finalState] is null or holds absent entries.
public final class PredictionResult {

    private final List<Double> times;
    private final Prediction inputs;
    private final Prediction states;
    private final Prediction outputs;
    private final Prediction eventStates;
    private final UncertainData timeOfEvent;
    private final Map<String, UncertainData> finalStates;

    public PredictionResult(List<Double> times, Prediction inputs, Prediction states, Prediction outputs,
                            Prediction eventStates, UncertainData timeOfEvent, Map<String, UncertainData> finalStates) {
        this.times = Collections.unmodifiableList(times);
        this.inputs = inputs;
        this.states = states;
        this.outputs = outputs;
        this.eventStates = eventStates;
        this.timeOfEvent = timeOfEvent;
        this.finalStates = Collections.unmodifiableMap(new LinkedHashMap<>(finalStates));
    }

    public List<Double> times() {
        return times;
    }

    public Prediction inputs() {
        return inputs;
    }

    public Prediction states() {
        return states;
    }

    public Prediction outputs() {
        return outputs;
    }

    public Prediction eventStates() {
        return eventStates;
    }

    public UncertainData timeOfEvent() {
        return timeOfEvent;
    }

    /// @param event a requested event
    /// @return the state distribution at the moment the event occurred, or null if
    ///         it is unresolved or was not requested
    public UncertainData finalState(String event) {
        return finalStates.get(event);
    }

    public Map<String, UncertainData> finalStates() {
        return finalStates;
    }
}
