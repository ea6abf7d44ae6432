package io.progtools.estimators;

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

import io.progtools.model.ConfigurationException;
import io.progtools.model.PrognosticsModel;
import io.progtools.uncertain.KeySchema;
import io.progtools.uncertain.LabeledVector;
import io.progtools.uncertain.RandomGenerators;
import io.progtools.uncertain.UncertainData;
import io.progtools.uncertain.UnweightedSamples;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Map;

/// Sequential importance resampling filter.
///
/// ## Cycle
///
/// ```
///  particles ──propagate(u, dt)──► particles'      (per sub-step, with process noise)
///      │
///      ▼  correct(z)
///  log w[i] = Σ_k log N(z_k; h(x_i)_k, σ_k)
///  w = exp(log w - max log w) / Σ
///  particles = resample(particles, w)
/// ```
///
/// The belief is the unweighted particle set after resampling. The weights that
/// produced it stay readable through [#getWeights()].
///
/// Measurement noise `σ` comes from the configuration when set, otherwise from
/// [PrognosticsModel#measurementNoise()]; every output needs a positive value.
public class ParticleFilter extends StateEstimator {

    private static final Logger logger = LogManager.getLogger(ParticleFilter.class);

    public static final double DEFAULT_T0 = -1e-99;
    public static final double DEFAULT_DT = Double.POSITIVE_INFINITY;
    public static final int DEFAULT_NUM_PARTICLES = 100;

    private final ParticlePropagator propagator;
    private final ResamplingStrategy resampling;
    private final NormalDistribution[] likelihoods;
    private final UniformRandomProvider rng;

    private double[][] particles;
    private double[] weights;

    public ParticleFilter(PrognosticsModel model, UncertainData x0) {
        this(model, x0, null);
    }

    /// @throws ConfigurationException if a measurement noise is missing or not positive,
    ///         or the particle count is not positive
    public ParticleFilter(PrognosticsModel model, UncertainData x0, EstimatorConfig config) {
        super(model, x0, config, DEFAULT_T0, DEFAULT_DT);
        this.propagator = ParticlePropagator.forModel(model);
        this.resampling = this.config.getResampling() == null ? ResamplingStrategy.RESIDUAL : this.config.getResampling();
        this.rng = RandomGenerators.create(this.config.getSeed());
        this.likelihoods = measurementLikelihoods(model, this.config.getMeasurementNoise());
        this.particles = initialParticles(model.states(), x0, this.config.getNumParticles(), rng);
        this.weights = new double[particles.length];
        Arrays.fill(weights, 1.0 / particles.length);
        logger.debug("Particle filter with {} particles, {} resampling, {}", particles.length, resampling,
            propagator.getClass().getSimpleName());
    }

    private static NormalDistribution[] measurementLikelihoods(PrognosticsModel model, Map<String, Double> configured) {
        KeySchema outputs = model.outputs();
        LabeledVector modelNoise = model.measurementNoise().reorder(outputs);
        NormalDistribution[] result = new NormalDistribution[outputs.size()];
        for (int k = 0; k < result.length; k++) {
            String key = outputs.key(k);
            double std = configured != null && configured.containsKey(key) ? configured.get(key) : modelNoise.get(k);
            if (!(std > 0.0)) {
                throw new ConfigurationException("measurement_noise", "Measurement noise for output '" + key
                    + "' must be positive to weight particles, was " + std);
            }
            result[k] = new NormalDistribution(null, 0.0, std);
        }
        return result;
    }

    private static double[][] initialParticles(KeySchema states, UncertainData x0, Integer numParticles,
                                               UniformRandomProvider rng) {
        if (numParticles != null && numParticles <= 0) {
            throw new ConfigurationException("num_particles", "num_particles must be positive, was " + numParticles);
        }
        UnweightedSamples samples;
        if (x0 instanceof UnweightedSamples given && (numParticles == null || numParticles == given.size())) {
            samples = given;
        } else {
            samples = x0.sample(numParticles == null ? DEFAULT_NUM_PARTICLES : numParticles, rng);
        }
        double[][] result = new double[samples.size()][];
        for (int i = 0; i < result.length; i++) {
            LabeledVector particle = samples.get(i);
            if (particle == null) {
                throw new ConfigurationException("x0", "Initial particle " + i + " is absent");
            }
            result[i] = particle.reorder(states).toArray();
        }
        return result;
    }

    @Override
    protected void predict(LabeledVector u, double dt) {
        particles = propagator.propagate(particles, u, dt, rng);
    }

    @Override
    protected void correct(LabeledVector z) {
        double[][] outputs = propagator.outputs(particles);
        double[] measured = z.toArray();
        int n = particles.length;
        double[] logWeights = new double[n];
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            double sum = 0.0;
            for (int k = 0; k < measured.length; k++) {
                sum += likelihoods[k].logDensity(measured[k] - outputs[i][k]);
            }
            logWeights[i] = Double.isNaN(sum) ? Double.NEGATIVE_INFINITY : sum;
            max = Math.max(max, logWeights[i]);
        }
        double[] w = new double[n];
        if (Double.isInfinite(max)) {
            logger.warn("Every particle has zero likelihood for measurement {}; keeping uniform weights", z);
            Arrays.fill(w, 1.0 / n);
        } else {
            double total = 0.0;
            for (int i = 0; i < n; i++) {
                w[i] = Math.exp(logWeights[i] - max);
                total += w[i];
            }
            for (int i = 0; i < n; i++) {
                w[i] /= total;
            }
        }
        weights = w;
        int[] indexes = resampling.resample(w, rng);
        double[][] resampled = new double[n][];
        for (int i = 0; i < n; i++) {
            resampled[i] = particles[indexes[i]].clone();
        }
        particles = resampled;
    }

    @Override
    public UnweightedSamples getState() {
        UnweightedSamples samples = new UnweightedSamples(model.states());
        for (double[] particle : particles) {
            samples.add(LabeledVector.of(model.states(), particle.clone()));
        }
        return samples;
    }

    /// @return the normalized weights of the last correction, uniform before the first
    public double[] getWeights() {
        return weights.clone();
    }

    public int getNumParticles() {
        return particles.length;
    }

    public ResamplingStrategy getResampling() {
        return resampling;
    }

    ParticlePropagator getPropagator() {
        return propagator;
    }
}
