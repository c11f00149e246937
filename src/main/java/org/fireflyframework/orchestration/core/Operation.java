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

import org.fireflyframework.orchestration.model.OperationDescriptor;

import java.util.Objects;

/**
 * An operation descriptor paired with its body.
 *
 * @param descriptor the operation metadata
 * @param handler the operation body
 * @param <T> the output type
 */
public record Operation<T>(OperationDescriptor descriptor, OperationHandler<T> handler) {

    public Operation {
        Objects.requireNonNull(descriptor, "descriptor cannot be null");
        Objects.requireNonNull(handler, "handler cannot be null");
    }

    public static <T> Operation<T> of(OperationDescriptor descriptor, OperationHandler<T> handler) {
        return new Operation<>(descriptor, handler);
    }

    public String type() {
        return descriptor.type();
    }
}
