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

import io.progtools.uncertain.LabeledVector;

/// [ThrownObject] that advances many states per call.
public class VectorizedThrownObject extends ThrownObject implements VectorizedPrognosticsModel {

    private int batchCalls;

    @Override
    public double[][] nextStates(double[][] x, LabeledVector u, double dt) {
        batchCalls++;
        double[][] next = new double[x.length][];
        for (int p = 0; p < x.length; p++) {
            next[p] = new double[]{x[p][0] + x[p][1] * dt, x[p][1] + G * dt};
        }
        return next;
    }

    @Override
    public double[][] outputs(double[][] x) {
        double[][] z = new double[x.length][];
        for (int p = 0; p < x.length; p++) {
            z[p] = new double[]{x[p][0]};
        }
        return z;
    }

    /// @return number of batch transitions so far
    public int batchCalls() {
        return batchCalls;
    }
}
