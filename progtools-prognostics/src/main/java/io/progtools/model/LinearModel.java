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

import io.progtools.uncertain.KeySchema;
import io.progtools.uncertain.LabeledVector;

/// A model with a linear state-space description:
///
/// ```
/// dx/dt = A·x + B·u + E
///     z = C·x + D
/// ```
///
/// `nextState` integrates with a forward Euler step and `output` evaluates the
/// measurement equation. Subclasses supply A and C, and override B, D and E
/// where they are not zero. Event states stay model specific.
public abstract class LinearModel extends AbstractPrognosticsModel {

    protected LinearModel(KeySchema states, KeySchema inputs, KeySchema outputs, KeySchema events) {
        super(states, inputs, outputs, events);
    }

    /// @return state matrix, states × states
    public abstract double[][] a();

    /// @return output matrix, outputs × states
    public abstract double[][] c();

    /// @return input matrix, states × inputs
    public double[][] b() {
        return new double[states().size()][inputs().size()];
    }

    /// @return output offset, one per output
    public double[] d() {
        return new double[outputs().size()];
    }

    /// @return constant state derivative term, one per state
    public double[] e() {
        return new double[states().size()];
    }

    @Override
    public LabeledVector nextState(LabeledVector x, LabeledVector u, double dt) {
        double[][] a = a();
        double[][] b = b();
        double[] e = e();
        int n = states().size();
        double[] next = new double[n];
        for (int i = 0; i < n; i++) {
            double dx = e[i];
            for (int j = 0; j < n; j++) {
                dx += a[i][j] * x.get(j);
            }
            for (int j = 0; j < b[i].length; j++) {
                dx += b[i][j] * u.get(j);
            }
            next[i] = x.get(i) + dx * dt;
        }
        return LabeledVector.of(states(), next);
    }

    @Override
    public LabeledVector output(LabeledVector x) {
        double[][] c = c();
        double[] d = d();
        double[] z = new double[outputs().size()];
        for (int i = 0; i < z.length; i++) {
            double sum = d[i];
            for (int j = 0; j < c[i].length; j++) {
                sum += c[i][j] * x.get(j);
            }
            z[i] = sum;
        }
        return LabeledVector.of(outputs(), z);
    }
}
