package io.progtools.loading;

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

import io.progtools.uncertain.LabeledVector;

/// Future loading: the model input to apply at a given time.
///
/// The state argument is the current (or mean) state and may be `null` when
/// the caller has none, so implementations that ignore it are the common case.
@FunctionalInterface
public interface LoadingFunction {

    /// @param t simulation time (s)
    /// @param x current state, possibly null
    /// @return the input vector, in the model's input schema
    LabeledVector load(double t, LabeledVector x);
}
