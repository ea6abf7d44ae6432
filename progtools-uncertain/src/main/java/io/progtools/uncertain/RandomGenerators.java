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

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.ContinuousUniformSampler;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Random number generators for sampling, resampling and noise injection.
 * Based on Apache Commons RNG.
 *
 * <p>Every estimator and predictor owns its own provider, created here from an
 * optional seed, so that independent runs never share generator state.
 * XO_SHI_RO_256_PP is used for its statistical quality and speed.
 */
public final class RandomGenerators {

    private static final RandomSource SOURCE = RandomSource.XO_SHI_RO_256_PP;

    private RandomGenerators() {
    }

    /**
     * Creates a new generator with the given seed.
     *
     * @param seed The seed for deterministic random generation
     * @return A uniform random provider
     */
    public static UniformRandomProvider create(long seed) {
        return SOURCE.create(seed);
    }

    /**
     * Creates a new generator with a random seed.
     *
     * @return A uniform random provider
     */
    public static UniformRandomProvider create() {
        return SOURCE.create();
    }

    /**
     * Creates a generator from an optional seed.
     *
     * @param seed the seed, or null for a randomly seeded generator
     * @return A uniform random provider
     */
    public static UniformRandomProvider create(Long seed) {
        return seed == null ? create() : create(seed.longValue());
    }

    /**
     * Creates a standard normal N(0, 1) sampler bound to the given generator.
     *
     * @param rng The random number generator
     * @return a normalized Gaussian sampler
     */
    public static NormalizedGaussianSampler createGaussianSampler(UniformRandomProvider rng) {
        return ZigguratSampler.NormalizedGaussian.of(rng);
    }

    /**
     * Creates a continuous uniform sampler for the specified range.
     *
     * @param rng The random number generator
     * @param lower The lower bound (inclusive)
     * @param upper The upper bound (exclusive)
     * @return A continuous uniform sampler
     */
    public static ContinuousSampler createUniformSampler(UniformRandomProvider rng,
                                                         double lower, double upper) {
        return ContinuousUniformSampler.of(rng, lower, upper);
    }
}
