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

package org.fireflyframework.orchestration.model;

/**
 * Represents the final status of a single operation in a run.
 */
public enum OperationStatus {

    /**
     * Operation completed and produced its output.
     */
    SUCCESS,

    /**
     * Operation was attempted and failed.
     */
    FAILURE,

    /**
     * Operation was not attempted because a dependency did not succeed.
     */
    SKIPPED,

    /**
     * Operation was not attempted because the run was cancelled.
     */
    CANCELLED;

    /**
     * Checks if the operation was actually attempted against its endpoint.
     *
     * @return true for SUCCESS and FAILURE
     */
    public boolean wasAttempted() {
        return this == SUCCESS || this == FAILURE;
    }

    /**
     * Checks if the operation succeeded.
     *
     * @return true only for SUCCESS
     */
    public boolean isSuccessful() {
        return this == SUCCESS;
    }
}
