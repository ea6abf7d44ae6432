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

import io.progtools.math.MerweScaledSigmaPoints;
import io.progtools.math.UnscentedTransform;
import io.progtools.uncertain.KeySchema;
import io.progtools.uncertain.LabeledVector;
import io.progtools.uncertain.MultivariateNormalDist;
import io.progtools.uncertain.UncertainData;

import java.util.function.Function;

/// A prediction derived from a state prediction through a function of the state,
/// such as the model output or event state.
///
/// Each snapshot is computed when first read: sigma points of the state
/// snapshot are mapped through the function and recombined with the unscented
/// transform. Snapshots that are never read are never computed.
public class LazyUTPrediction extends Prediction {

    private final Prediction states;
    private final MerweScaledSigmaPoints points;
    private final Function<LabeledVector, LabeledVector> transform;
    private final KeySchema resultSchema;
    private final MultivariateNormalDist[] cache;

    public LazyUTPrediction(Prediction states, MerweScaledSigmaPoints points,
                            Function<LabeledVector, LabeledVector> transform, KeySchema resultSchema) {
        super(states.times());
        this.states = states;
        this.points = points;
        this.transform = transform;
        this.resultSchema = resultSchema;
        this.cache = new MultivariateNormalDist[states.size()];
    }

    @Override
    public MultivariateNormalDist snapshot(int timeIndex) {
        if (cache[timeIndex] == null) {
            cache[timeIndex] = compute(states.snapshot(timeIndex));
        }
        return cache[timeIndex];
    }

    /// @return whether the snapshot at `timeIndex` has been computed
    public boolean isComputed(int timeIndex) {
        return cache[timeIndex] != null;
    }

    private MultivariateNormalDist compute(UncertainData state) {
        KeySchema stateSchema = state.schema();
        double[][] sigmas = points.sigmaPoints(state.mean().toArray(), state.cov());
        double[][] mapped = new double[sigmas.length][];
        for (int i = 0; i < sigmas.length; i++) {
            mapped[i] = transform.apply(LabeledVector.of(stateSchema, sigmas[i])).reorder(resultSchema).toArray();
        }
        UnscentedTransform.Result result =
            UnscentedTransform.transform(mapped, points.meanWeights(), points.covarianceWeights(), null);
        return new MultivariateNormalDist(resultSchema, result.mean(), result.cov());
    }
}
