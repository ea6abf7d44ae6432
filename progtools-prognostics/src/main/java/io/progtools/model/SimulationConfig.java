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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.List;

/// Parameters of one threshold simulation.
///
/// ```json
/// {
///   "t0": 0.0,
///   "dt": 0.01,
///   "horizon": 20.0,
///   "save_freq": 1.0,
///   "save_pts": [2.5, 7.5],
///   "events": ["impact"]
/// }
/// ```
///
/// The horizon is measured from `t0`, and the `save_freq` grid from `save_origin`
/// when set, otherwise from `t0`. `events` left null means every model
/// event. A non-null `constant_process_noise` replaces random process noise
/// for the whole run with `x + dt · noise`.
public class SimulationConfig {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .serializeSpecialFloatingPointValues()
        .create();

    @SerializedName("t0")
    private double t0 = 0.0;

    @SerializedName("dt")
    private double dt = 1.0;

    @SerializedName("horizon")
    private double horizon = Double.POSITIVE_INFINITY;

    @SerializedName("save_freq")
    private double saveFreq = Double.POSITIVE_INFINITY;

    @SerializedName("save_origin")
    private Double saveOrigin;

    @SerializedName("save_pts")
    private List<Double> savePts = new ArrayList<>();

    @SerializedName("events")
    private List<String> events;

    @SerializedName("constant_process_noise")
    private double[] constantProcessNoise;

    public SimulationConfig() {
    }

    public SimulationConfig copy() {
        SimulationConfig c = new SimulationConfig();
        c.t0 = t0;
        c.dt = dt;
        c.horizon = horizon;
        c.saveFreq = saveFreq;
        c.saveOrigin = saveOrigin;
        c.savePts = new ArrayList<>(savePts);
        c.events = events == null ? null : new ArrayList<>(events);
        c.constantProcessNoise = constantProcessNoise == null ? null : constantProcessNoise.clone();
        return c;
    }

    public double getT0() {
        return t0;
    }

    public SimulationConfig setT0(double t0) {
        this.t0 = t0;
        return this;
    }

    public double getDt() {
        return dt;
    }

    public SimulationConfig setDt(double dt) {
        this.dt = dt;
        return this;
    }

    public double getHorizon() {
        return horizon;
    }

    public SimulationConfig setHorizon(double horizon) {
        this.horizon = horizon;
        return this;
    }

    public double getSaveFreq() {
        return saveFreq;
    }

    public SimulationConfig setSaveFreq(double saveFreq) {
        this.saveFreq = saveFreq;
        return this;
    }

    public Double getSaveOrigin() {
        return saveOrigin;
    }

    /// Anchors the `save_freq` grid at `origin` instead of `t0`, so that a run
    /// resumed part way through keeps saving on the original grid.
    public SimulationConfig setSaveOrigin(Double origin) {
        this.saveOrigin = origin;
        return this;
    }

    public List<Double> getSavePts() {
        return savePts;
    }

    public SimulationConfig setSavePts(List<Double> savePts) {
        this.savePts = new ArrayList<>(savePts);
        return this;
    }

    public List<String> getEvents() {
        return events;
    }

    public SimulationConfig setEvents(List<String> events) {
        this.events = events == null ? null : new ArrayList<>(events);
        return this;
    }

    public double[] getConstantProcessNoise() {
        return constantProcessNoise;
    }

    /// @param noise per-state noise in state order, or null for random process noise
    public SimulationConfig setConstantProcessNoise(double[] noise) {
        this.constantProcessNoise = noise == null ? null : noise.clone();
        return this;
    }

    public static SimulationConfig fromJson(String json) {
        return GSON.fromJson(json, SimulationConfig.class);
    }

    public String toJson() {
        return GSON.toJson(this);
    }
}
