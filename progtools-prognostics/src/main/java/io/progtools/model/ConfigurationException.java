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

/// Thrown before any simulation or estimation starts when a parameter, event
/// name, strategy or initial belief is invalid.
///
/// The offending parameter name is carried separately so callers can report it
/// without parsing the message.
public class ConfigurationException extends RuntimeException {

    private final String parameter;

    public ConfigurationException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    /// @return the name of the invalid parameter, key or event
    public String getParameter() {
        return parameter;
    }
}
