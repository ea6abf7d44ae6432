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

/// Thrown when an estimate is requested for a time that is not strictly after
/// the estimator's current time.
public class TimeOrderingException extends RuntimeException {

    private final double currentTime;
    private final double requestedTime;

    public TimeOrderingException(double currentTime, double requestedTime) {
        super("New time must be greater than previous: requested t=" + requestedTime
            + " but the estimator is already at t=" + currentTime);
        this.currentTime = currentTime;
        this.requestedTime = requestedTime;
    }

    public double getCurrentTime() {
        return currentTime;
    }

    public double getRequestedTime() {
        return requestedTime;
    }
}
