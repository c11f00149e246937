/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.orchestration.exception;

/**
 * Exception raised when a call is refused because the endpoint's circuit is open.
 */
public class CircuitOpenException extends OrchestrationException {

    private final String endpoint;

    public CircuitOpenException(String endpoint) {
        super("Circuit is open for endpoint '" + endpoint + "'");
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
