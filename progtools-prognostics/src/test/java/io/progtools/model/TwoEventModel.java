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

/// A counter rising at one unit per second with events at 2 (`early`) and 5 (`late`).
public class TwoEventModel extends LinearModel {

    public TwoEventModel() {
        super(KeySchema.of("x"), KeySchema.empty(), KeySchema.of("x"), KeySchema.of("early", "late"));
    }

    @Override
    public double[][] a() {
        return new double[][]{{0}};
    }

    @Override
    public double[][] c() {
        return new double[][]{{1}};
    }

    @Override
    public double[] e() {
        return new double[]{1};
    }

    @Override
    public LabeledVector initialize(LabeledVector u, LabeledVector z) {
        return states().vector(0.0);
    }

    @Override
    public LabeledVector eventState(LabeledVector x) {
        double v = x.get("x");
        return events().vector(Math.max(1.0 - v / 2.0, 0.0), Math.max(1.0 - v / 5.0, 0.0));
    }
}
