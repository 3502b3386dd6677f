package me.golemcore.toolrouter.domain.model;

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

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared by a plan and its in-flight steps.
 *
 * <p>
 * Adapters register callbacks that close their underlying session (destroy a
 * process, cancel a call or statement). Cancelling a parent cancels every
 * child; cancelling a child leaves the parent untouched.
 */
@Slf4j
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers a callback; runs it immediately if already cancelled.
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            runQuietly(callback);
        }
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                runQuietly(callback);
            }
        }
    }

    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        onCancel(child::cancel);
        return child;
    }

    private static void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) { // NOSONAR - best-effort cancellation must reach every callback
            log.warn("[Cancel] Cancellation callback failed: {}", e.getMessage());
        }
    }
}
