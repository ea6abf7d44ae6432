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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Centralized Gson configuration for distributions and the objects that carry them.
///
/// | Feature | Setting |
/// |---------|---------|
/// | Pretty printing | Enabled |
/// | HTML escaping | Disabled |
/// | NaN / Infinity | Serialized |
/// | UncertainData adapter | Registered |
///
/// ```java
/// String json = UncertainGsonConfig.gson().toJson(toe, UncertainData.class);
/// UncertainData restored = UncertainGsonConfig.gson().fromJson(json, UncertainData.class);
/// ```
///
/// The [Gson] instance is thread-safe and shared.
public final class UncertainGsonConfig {

    private static final Gson INSTANCE = builder().create();

    private UncertainGsonConfig() {
    }

    /// @return the shared Gson instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// Creates a new GsonBuilder with the distribution adapters registered, for
    /// callers that need further customization.
    ///
    /// @return a new GsonBuilder
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapterFactory(UncertainDataTypeAdapterFactory.create());
    }

    /// Creates a compact (single-line) Gson instance.
    ///
    /// @return a compact Gson instance
    public static Gson compactGson() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapterFactory(UncertainDataTypeAdapterFactory.create())
            .create();
    }
}
