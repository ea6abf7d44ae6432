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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/// A series derived from another series, computed on first access.
///
/// Outputs and event states of a simulation are usually not all read, so they
/// are kept as a function of the state series until asked for.
public class LazySimResult extends SimResult {

    private final SimResult source;
    private final Function<LabeledVector, LabeledVector> transform;

    public LazySimResult(SimResult source, Function<LabeledVector, LabeledVector> transform) {
        super(source.times(), null);
        this.source = source;
        this.transform = transform;
    }

    public boolean isComputed() {
        return super.data() != null;
    }

    @Override
    public List<LabeledVector> data() {
        List<LabeledVector> data = super.data();
        if (data == null) {
            List<LabeledVector> computed = new ArrayList<>(source.size());
            for (LabeledVector x : source.data()) {
                computed.add(transform.apply(x));
            }
            setData(computed);
            data = super.data();
        }
        return data;
    }
}
