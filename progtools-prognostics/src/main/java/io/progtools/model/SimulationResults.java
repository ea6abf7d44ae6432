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

import java.util.List;

/// The saved trajectory of one simulation. All series share the same times.
///
/// @param inputs input applied at each saved time
/// @param states state at each saved time
/// @param outputs output at each saved time, usually lazy
/// @param eventStates event state at each saved time, usually lazy
public record SimulationResults(SimResult inputs, SimResult states, SimResult outputs, SimResult eventStates) {

    public List<Double> times() {
        return states.times();
    }

    public int size() {
        return states.size();
    }
}
