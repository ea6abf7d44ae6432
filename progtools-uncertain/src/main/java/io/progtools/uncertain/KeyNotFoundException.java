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

import java.util.List;

/// Thrown when a key is requested that a schema, distribution or ground-truth
/// map does not declare.
public class KeyNotFoundException extends RuntimeException {

    private final String key;

    public KeyNotFoundException(String key, List<String> knownKeys) {
        super("Key '" + key + "' not found. Known keys: " + knownKeys);
        this.key = key;
    }

    /// @return the key that could not be resolved
    public String getKey() {
        return key;
    }
}
