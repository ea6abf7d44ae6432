/// Distributions over labeled numeric vectors.
///
/// [io.progtools.uncertain.UncertainData] is the belief representation used
/// throughout prognostics: estimator state, predicted snapshots, and
/// time-of-event. Vectors are addressed through a fixed
/// [io.progtools.uncertain.KeySchema] and carried as
/// [io.progtools.uncertain.LabeledVector]s.
package io.progtools.uncertain;

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

