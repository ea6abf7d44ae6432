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

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the serialization type name for an {@link UncertainData} implementation.
 *
 * <p>The annotated name appears as the "type" field in serialized JSON:
 *
 * <pre>{@code
 * {
 *   "type": "multivariate_normal",
 *   "keys": ["x", "v"],
 *   "mean": [1.83, 40.0],
 *   "covariance": [[0.01, 0.0], [0.0, 0.04]]
 * }
 * }</pre>
 *
 * @see UncertainDataTypeAdapterFactory
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface DistributionType {
    /**
     * The type name used in JSON serialization, lowercase with underscores.
     *
     * @return the type discriminator string
     */
    String value();
}
