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

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run-level cancel signal.
 * <p>
 * The executor checks the signal before starting each operation. Operations
 * already in flight finish normally; every operation not yet started is
 * reported CANCELLED.
 */
@Slf4j
public class RunCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static RunCancellation create() {
        return new RunCancellation();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("RUN_CANCELLATION_REQUESTED");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
