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

package org.fireflyframework.orchestration.core;

/**
 * Kinds of problems that prevent an operation set from being resolved.
 */
public enum DependencyErrorType {

    /** Two operations share the same type. */
    DUPLICATE_OPERATION,

    /** An operation depends on a type that was not declared. */
    MISSING_OPERATION,

    /** The dependency edges form a cycle. */
    CIRCULAR_DEPENDENCY,

    /** A required operation depends, directly or transitively, on a non-required one. */
    REQUIRED_DEPENDS_ON_OPTIONAL
}
