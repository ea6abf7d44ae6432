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
import io.progtools.uncertain.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;

/// Adds independent Gaussian noise to every component of a wrapped load.
///
/// The standard deviation is `std` up to `t0` and grows linearly by
/// `stdSlope` per second after it. The wrapper owns its generator, so the same
/// seed replays the same noise sequence for the same sequence of calls.
///
/// ```java
/// LoadingFunction noisy = new GaussianNoiseLoadWrapper(load, 0.1, 42L);
/// ```
public final class GaussianNoiseLoadWrapper implements LoadingFunction {

    private final LoadingFunction delegate;
    private final double std;
    private final double stdSlope;
    private final double t0;
    private final NormalizedGaussianSampler gaussian;

    /// @param delegate the load to wrap
    /// @param std standard deviation of the added noise
    /// @param seed generator seed, or null for an unseeded generator
    public GaussianNoiseLoadWrapper(LoadingFunction delegate, double std, Long seed) {
        this(delegate, std, seed, 0.0, 0.0);
    }

    /// @param delegate the load to wrap
    /// @param std standard deviation of the added noise at and before `t0`
    /// @param seed generator seed, or null for an unseeded generator
    /// @param stdSlope increase of the standard deviation per second after `t0`
    /// @param t0 time from which the slope applies
    public GaussianNoiseLoadWrapper(LoadingFunction delegate, double std, Long seed, double stdSlope, double t0) {
        this(delegate, std, RandomGenerators.create(seed), stdSlope, t0);
    }

    public GaussianNoiseLoadWrapper(LoadingFunction delegate, double std, UniformRandomProvider rng,
                                    double stdSlope, double t0) {
        if (std < 0) {
            throw new IllegalArgumentException("std must not be negative, was " + std);
        }
        this.delegate = delegate;
        this.std = std;
        this.stdSlope = stdSlope;
        this.t0 = t0;
        this.gaussian = RandomGenerators.createGaussianSampler(rng);
    }

    /// @return the standard deviation applied at time `t`
    public double stdAt(double t) {
        return t > t0 ? std + stdSlope * (t - t0) : std;
    }

    @Override
    public LabeledVector load(double t, LabeledVector x) {
        LabeledVector input = delegate.load(t, x);
        double sigma = stdAt(t);
        double[] values = input.toArray();
        for (int i = 0; i < values.length; i++) {
            values[i] += sigma * gaussian.sample();
        }
        return input.withValues(values);
    }
}
