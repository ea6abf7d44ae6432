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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Tuning parameters for a state estimator, in a JSON-friendly form.
 *
 * <p>Every field is optional. A null field means the estimator's own default
 * applies, which differs per filter (for example the Kalman filter steps with
 * {@code dt = 1} and the unscented filter with an unbounded step).
 *
 * <h2>JSON Format</h2>
 * <pre>{@code
 * {
 *   "t0": 0.0,
 *   "dt": 0.1,
 *   "Q": [[0.001, 0.0], [0.0, 0.001]],
 *   "R": [[0.001]],
 *   "num_particles": 1000,
 *   "measurement_noise": {"x": 0.5},
 *   "resampling": "RESIDUAL",
 *   "seed": 42
 * }
 * }</pre>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EstimatorConfig config = EstimatorConfig.loadFromFile(Path.of("ukf.json"));
 * StateEstimator filter = new UnscentedKalmanFilter(model, x0, config);
 * }</pre>
 */
public class EstimatorConfig {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .serializeSpecialFloatingPointValues()
        .create();

    @SerializedName("t0")
    private Double t0;

    @SerializedName("dt")
    private Double dt;

    @SerializedName("Q")
    private double[][] q;

    @SerializedName("R")
    private double[][] r;

    @SerializedName("alpha")
    private Double alpha;

    @SerializedName("beta")
    private Double beta;

    @SerializedName("kappa")
    private Double kappa;

    @SerializedName("num_particles")
    private Integer numParticles;

    @SerializedName("measurement_noise")
    private Map<String, Double> measurementNoise;

    @SerializedName("resampling")
    private ResamplingStrategy resampling;

    @SerializedName("seed")
    private Long seed;

    public EstimatorConfig() {
    }

    public Double getT0() {
        return t0;
    }

    public EstimatorConfig setT0(double t0) {
        this.t0 = t0;
        return this;
    }

    public Double getDt() {
        return dt;
    }

    /// Maximum integration sub-step between two estimates.
    public EstimatorConfig setDt(double dt) {
        this.dt = dt;
        return this;
    }

    public double[][] getQ() {
        return q;
    }

    /// Process noise covariance, states × states in model state order.
    public EstimatorConfig setQ(double[][] q) {
        this.q = q;
        return this;
    }

    public double[][] getR() {
        return r;
    }

    /// Measurement noise covariance, outputs × outputs in model output order.
    public EstimatorConfig setR(double[][] r) {
        this.r = r;
        return this;
    }

    public Double getAlpha() {
        return alpha;
    }

    public EstimatorConfig setAlpha(double alpha) {
        this.alpha = alpha;
        return this;
    }

    public Double getBeta() {
        return beta;
    }

    public EstimatorConfig setBeta(double beta) {
        this.beta = beta;
        return this;
    }

    public Double getKappa() {
        return kappa;
    }

    public EstimatorConfig setKappa(double kappa) {
        this.kappa = kappa;
        return this;
    }

    public Integer getNumParticles() {
        return numParticles;
    }

    public EstimatorConfig setNumParticles(int numParticles) {
        this.numParticles = numParticles;
        return this;
    }

    public Map<String, Double> getMeasurementNoise() {
        return measurementNoise;
    }

    /// Per-output standard deviation used to weight particles.
    public EstimatorConfig setMeasurementNoise(Map<String, Double> measurementNoise) {
        this.measurementNoise = measurementNoise;
        return this;
    }

    public ResamplingStrategy getResampling() {
        return resampling;
    }

    public EstimatorConfig setResampling(ResamplingStrategy resampling) {
        this.resampling = resampling;
        return this;
    }

    public Long getSeed() {
        return seed;
    }

    public EstimatorConfig setSeed(long seed) {
        this.seed = seed;
        return this;
    }

    double t0Or(double fallback) {
        return t0 == null ? fallback : t0;
    }

    double dtOr(double fallback) {
        return dt == null ? fallback : dt;
    }

    public static EstimatorConfig fromJson(String json) {
        return GSON.fromJson(json, EstimatorConfig.class);
    }

    public static EstimatorConfig fromJson(Reader reader) {
        return GSON.fromJson(reader, EstimatorConfig.class);
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    /**
     * Loads a configuration from a JSON file.
     *
     * @param path the file path
     * @return the configuration
     * @throws IOException if the file cannot be read
     */
    public static EstimatorConfig loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        }
    }

    /**
     * Saves this configuration to a JSON file.
     *
     * @param path the file path
     * @throws IOException if the file cannot be written
     */
    public void saveToFile(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            GSON.toJson(this, writer);
        }
    }
}
