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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.annotations.SerializedName;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Prediction parameters, in a JSON-friendly form.
 *
 * <p>Every field is optional. A predictor holds one configuration as its
 * defaults, and each {@code predict} call may pass another whose non-null
 * fields override them for that call only (see {@link #merge(PredictorConfig)}).
 *
 * <h2>JSON Format</h2>
 * <pre>{@code
 * {
 *   "n_samples": 500,
 *   "dt": 0.01,
 *   "horizon": 20.0,
 *   "save_freq": 1.0,
 *   "events": ["impact"],
 *   "event_strategy": "all",
 *   "seed": 7
 * }
 * }</pre>
 */
public class PredictorConfig {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .serializeSpecialFloatingPointValues()
        .registerTypeAdapter(EventStrategy.class, new EventStrategyAdapter())
        .create();

    @SerializedName("n_samples")
    private Integer nSamples;

    @SerializedName("t0")
    private Double t0;

    @SerializedName("dt")
    private Double dt;

    @SerializedName("horizon")
    private Double horizon;

    @SerializedName("save_freq")
    private Double saveFreq;

    @SerializedName("save_pts")
    private List<Double> savePts;

    @SerializedName("events")
    private List<String> events;

    @SerializedName("event_strategy")
    private EventStrategy eventStrategy;

    @SerializedName("constant_noise")
    private Boolean constantNoise;

    @SerializedName("alpha")
    private Double alpha;

    @SerializedName("beta")
    private Double beta;

    @SerializedName("kappa")
    private Double kappa;

    @SerializedName("Q")
    private double[][] q;

    @SerializedName("seed")
    private Long seed;

    public PredictorConfig() {
    }

    /// Returns a copy of this configuration with every non-null field of `overrides` applied.
    ///
    /// @param overrides per-call values, may be null
    /// @return the merged configuration
    public PredictorConfig merge(PredictorConfig overrides) {
        PredictorConfig merged = copy();
        if (overrides == null) {
            return merged;
        }
        if (overrides.nSamples != null) merged.nSamples = overrides.nSamples;
        if (overrides.t0 != null) merged.t0 = overrides.t0;
        if (overrides.dt != null) merged.dt = overrides.dt;
        if (overrides.horizon != null) merged.horizon = overrides.horizon;
        if (overrides.saveFreq != null) merged.saveFreq = overrides.saveFreq;
        if (overrides.savePts != null) merged.savePts = new ArrayList<>(overrides.savePts);
        if (overrides.events != null) merged.events = new ArrayList<>(overrides.events);
        if (overrides.eventStrategy != null) merged.eventStrategy = overrides.eventStrategy;
        if (overrides.constantNoise != null) merged.constantNoise = overrides.constantNoise;
        if (overrides.alpha != null) merged.alpha = overrides.alpha;
        if (overrides.beta != null) merged.beta = overrides.beta;
        if (overrides.kappa != null) merged.kappa = overrides.kappa;
        if (overrides.q != null) merged.q = overrides.q;
        if (overrides.seed != null) merged.seed = overrides.seed;
        return merged;
    }

    public PredictorConfig copy() {
        PredictorConfig c = new PredictorConfig();
        c.nSamples = nSamples;
        c.t0 = t0;
        c.dt = dt;
        c.horizon = horizon;
        c.saveFreq = saveFreq;
        c.savePts = savePts == null ? null : new ArrayList<>(savePts);
        c.events = events == null ? null : new ArrayList<>(events);
        c.eventStrategy = eventStrategy;
        c.constantNoise = constantNoise;
        c.alpha = alpha;
        c.beta = beta;
        c.kappa = kappa;
        c.q = q;
        c.seed = seed;
        return c;
    }

    public Integer getNSamples() {
        return nSamples;
    }

    public PredictorConfig setNSamples(Integer nSamples) {
        this.nSamples = nSamples;
        return this;
    }

    public Double getT0() {
        return t0;
    }

    public PredictorConfig setT0(Double t0) {
        this.t0 = t0;
        return this;
    }

    public Double getDt() {
        return dt;
    }

    public PredictorConfig setDt(Double dt) {
        this.dt = dt;
        return this;
    }

    public Double getHorizon() {
        return horizon;
    }

    /// Prediction horizon, measured from `t0`.
    public PredictorConfig setHorizon(Double horizon) {
        this.horizon = horizon;
        return this;
    }

    public Double getSaveFreq() {
        return saveFreq;
    }

    public PredictorConfig setSaveFreq(Double saveFreq) {
        this.saveFreq = saveFreq;
        return this;
    }

    public List<Double> getSavePts() {
        return savePts;
    }

    public PredictorConfig setSavePts(List<Double> savePts) {
        this.savePts = savePts == null ? null : new ArrayList<>(savePts);
        return this;
    }

    public List<String> getEvents() {
        return events;
    }

    public PredictorConfig setEvents(List<String> events) {
        this.events = events == null ? null : new ArrayList<>(events);
        return this;
    }

    public EventStrategy getEventStrategy() {
        return eventStrategy;
    }

    public PredictorConfig setEventStrategy(EventStrategy eventStrategy) {
        this.eventStrategy = eventStrategy;
        return this;
    }

    /// @throws io.progtools.model.ConfigurationException for an unknown strategy name
    public PredictorConfig setEventStrategy(String name) {
        this.eventStrategy = EventStrategy.fromName(name);
        return this;
    }

    public Boolean getConstantNoise() {
        return constantNoise;
    }

    /// When true, each realization draws one process noise vector and applies it at every step.
    public PredictorConfig setConstantNoise(Boolean constantNoise) {
        this.constantNoise = constantNoise;
        return this;
    }

    public Double getAlpha() {
        return alpha;
    }

    public PredictorConfig setAlpha(Double alpha) {
        this.alpha = alpha;
        return this;
    }

    public Double getBeta() {
        return beta;
    }

    public PredictorConfig setBeta(Double beta) {
        this.beta = beta;
        return this;
    }

    public Double getKappa() {
        return kappa;
    }

    public PredictorConfig setKappa(Double kappa) {
        this.kappa = kappa;
        return this;
    }

    public double[][] getQ() {
        return q;
    }

    public PredictorConfig setQ(double[][] q) {
        this.q = q;
        return this;
    }

    public Long getSeed() {
        return seed;
    }

    public PredictorConfig setSeed(Long seed) {
        this.seed = seed;
        return this;
    }

    public static PredictorConfig fromJson(String json) {
        return GSON.fromJson(json, PredictorConfig.class);
    }

    public static PredictorConfig fromJson(Reader reader) {
        return GSON.fromJson(reader, PredictorConfig.class);
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public static PredictorConfig loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        }
    }

    public void saveToFile(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            GSON.toJson(this, writer);
        }
    }

    /// Reads `event_strategy` through [EventStrategy#fromName] so unknown names fail
    /// with a [io.progtools.model.ConfigurationException] instead of becoming null.
    private static final class EventStrategyAdapter extends TypeAdapter<EventStrategy> {

        @Override
        public void write(JsonWriter out, EventStrategy value) throws IOException {
            if (value == null) {
                out.nullValue();
            } else {
                out.value(value.name().toLowerCase(Locale.ROOT));
            }
        }

        @Override
        public EventStrategy read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            return EventStrategy.fromName(in.nextString());
        }
    }
}
