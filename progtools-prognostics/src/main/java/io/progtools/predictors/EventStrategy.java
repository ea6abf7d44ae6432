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

import io.progtools.model.ConfigurationException;

import java.util.Locale;

/// When a realization stops simulating.
public enum EventStrategy {

    /// Stop at the first requested event; the others stay unresolved.
    FIRST,

    /// Keep going until every requested event is resolved or the horizon elapses.
    ALL;

    /// Parses `first`, `any` or `all`, ignoring case.
    ///
    /// @throws ConfigurationException for any other name
    public static EventStrategy fromName(String name) {
        return switch (name == null ? "" : name.toLowerCase(Locale.ROOT)) {
            case "first", "any" -> FIRST;
            case "all" -> ALL;
            default -> throw new ConfigurationException("event_strategy", "Invalid value for event_strategy: '"
                + name + "'. Should be either 'all' or 'first'");
        };
    }
}
