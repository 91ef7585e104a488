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

package me.golemcore.continuity.infrastructure.lifecycle;

import lombok.extern.slf4j.Slf4j;

/**
 * Initialization retry policy shared by every continuity component.
 *
 * <p>
 * The guarded action runs until it succeeds once. Failed attempts are counted;
 * after {@code maxAttempts} failures the guard stops running the action and
 * keeps reporting the last error as non-retryable. Concurrent callers are
 * serialized, so at most one attempt is in flight per component.
 *
 * @since 1.0
 */
@Slf4j
public class InitializationGuard {

    private final String componentName;
    private final int maxAttempts;
    private final Object lock = new Object();

    private volatile boolean initialized = false;
    private int attempts = 0;
    private String lastError;

    public InitializationGuard(String componentName, int maxAttempts) {
        this.componentName = componentName;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    /**
     * Runs the action unless the component is already initialized or out of
     * attempts.
     */
    public InitializationResult ensureInitialized(InitializationAction action) {
        if (initialized) {
            return InitializationResult.alreadyInitialized(attempts);
        }
        synchronized (lock) {
            if (initialized) {
                return InitializationResult.alreadyInitialized(attempts);
            }
            if (attempts >= maxAttempts) {
                return InitializationResult.failed(lastError, false, attempts);
            }
            try {
                action.run();
                initialized = true;
                log.info("[Init] {} initialized", componentName);
                return InitializationResult.succeeded(attempts + 1);
            } catch (Exception e) {
                attempts++;
                lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.error("[Init] Failed to initialize {} (attempt {}/{}): {}",
                        componentName, attempts, maxAttempts, lastError, e);
                return InitializationResult.failed(lastError, attempts < maxAttempts, attempts);
            }
        }
    }

    public boolean isInitialized() {
        return initialized;
    }

    public int getAttempts() {
        synchronized (lock) {
            return attempts;
        }
    }

    public String getLastError() {
        synchronized (lock) {
            return lastError;
        }
    }

    /**
     * Initialization step that may fail with any exception.
     */
    @FunctionalInterface
    public interface InitializationAction {
        void run() throws Exception;
    }
}
