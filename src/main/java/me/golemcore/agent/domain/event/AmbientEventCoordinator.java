package me.golemcore.agent.domain.event;

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

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Task-scoped holder for the coordinator of the run that is executing on the
 * current thread. Function bodies use it to reach the human without any
 * parameter passing, however deeply they are nested.
 *
 * <p>
 * ThreadLocal values don't propagate to async work on their own: anything
 * handed to an executor must be wrapped with {@link #wrap}, {@link #wrapSupplier} or {@link #wrapCallable},
 * which capture the coordinator at submission time.
 */
public final class AmbientEventCoordinator {

    private static final ThreadLocal<EventCoordinator> CURRENT = new ThreadLocal<>();

    private AmbientEventCoordinator() {
    }

    public static Optional<EventCoordinator> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    /**
     * Makes a coordinator current until the returned scope is closed; closing
     * restores whatever was current before.
     */
    public static Scope open(EventCoordinator coordinator) {
        EventCoordinator previous = CURRENT.get();
        set(coordinator);
        return new Scope(previous);
    }

    public static Runnable wrap(Runnable task) {
        EventCoordinator captured = CURRENT.get();
        return () -> {
            try (Scope ignored = open(captured)) {
                task.run();
            }
        };
    }

    public static <T> Supplier<T> wrapSupplier(Supplier<T> task) {
        EventCoordinator captured = CURRENT.get();
        return () -> {
            try (Scope ignored = open(captured)) {
                return task.get();
            }
        };
    }

    public static <T> Callable<T> wrapCallable(Callable<T> task) {
        EventCoordinator captured = CURRENT.get();
        return () -> {
            try (Scope ignored = open(captured)) {
                return task.call();
            }
        };
    }

    private static void set(EventCoordinator coordinator) {
        if (coordinator == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(coordinator);
        }
    }

    /**
     * Restores the previous ambient coordinator on close.
     */
    public static final class Scope implements AutoCloseable {

        private final EventCoordinator previous;

        private Scope(EventCoordinator previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            set(previous);
        }
    }
}
