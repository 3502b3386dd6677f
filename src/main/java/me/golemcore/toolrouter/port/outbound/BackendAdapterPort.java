package me.golemcore.toolrouter.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.toolrouter.domain.exception.StepExecutionException;
import me.golemcore.toolrouter.domain.model.CancellationToken;
import me.golemcore.toolrouter.domain.model.EnrichedExecutionStep;
import me.golemcore.toolrouter.domain.model.StepResult;

/**
 * Port for protocol backends that execute enriched steps (local process,
 * remote shell, remote management, HTTP, database).
 *
 * <p>
 * Adapters are registered by {@link #getLocation()} at startup. They read only
 * the fields stamped on the step and the opaque {@code protocolMetadata} keys
 * they understand, and resolve credentials themselves from the step's
 * {@code CredentialHandle}.
 */
public interface BackendAdapterPort {

    /**
     * Execution location key this adapter serves (e.g. "local", "ssh").
     */
    String getLocation();

    /**
     * Executes one step. Blocking; the dispatcher calls it from its own worker
     * threads.
     *
     * <p>
     * Implementations register a callback on {@code cancellation} that closes the
     * underlying session, process, call or statement.
     *
     * @throws StepExecutionException
     *             if the step could not be executed; the dispatcher turns it into
     *             a failed step result
     */
    StepResult execute(EnrichedExecutionStep step, CancellationToken cancellation);
}
