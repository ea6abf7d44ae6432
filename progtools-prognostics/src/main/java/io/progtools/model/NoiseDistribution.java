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

import io.progtools.uncertain.RandomGenerators;
import org.apache.commons.math3.distribution.TriangularDistribution;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;

/// Shape of the zero-mean noise a model adds to states or outputs.
///
/// `std` is the standard deviation for [#NORMAL] and the half-width for
/// [#UNIFORM] and [#TRIANGULAR].
public enum NoiseDistribution {
    NORMAL {
        @Override
        public Source source(UniformRandomProvider rng) {
            NormalizedGaussianSampler gaussian = RandomGenerators.createGaussianSampler(rng);
            return std -> std * gaussian.sample();
        }
    },
    UNIFORM {
        @Override
        public Source source(UniformRandomProvider rng) {
            ContinuousSampler unit = RandomGenerators.createUniformSampler(rng, -1.0, 1.0);
            return std -> std * unit.sample();
        }
    },
    TRIANGULAR {
        @Override
        public Source source(UniformRandomProvider rng) {
            TriangularDistribution unit = new TriangularDistribution(null, -1.0, 0.0, 1.0);
            return std -> std * unit.inverseCumulativeProbability(rng.nextDouble());
        }
    },
    NONE {
        @Override
        public Source source(UniformRandomProvider rng) {
            return std -> 0.0;
        }
    };

    /// A noise draw for a given scale.
    @FunctionalInterface
    public interface Source {
        double draw(double std);
    }

    /// @param rng the generator the draws consume
    /// @return a source of draws bound to `rng`
    public abstract Source source(UniformRandomProvider rng);
}
