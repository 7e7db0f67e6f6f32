/*
 * Copyright 2020 Matthew Weis, Kansas State University
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

package org.sireum.conductor;

import org.jetbrains.annotations.NotNull;

/**
 * Carries a checked exception thrown by conducted code (a thread body, a finish block, or a frozen-clock block) back
 * to the caller of {@link Conductor#conductTest()}. The original exception is always the cause.
 * <br>
 * Unchecked failures ({@link Error}s such as {@link AssertionError}, and {@link RuntimeException}s) are never
 * wrapped: they reach the caller as the very same instance.
 */
public class ConductedThreadException extends RuntimeException {

    /**
     * Wraps a checked exception thrown by conducted code.
     *
     * @param cause the checked exception
     */
    ConductedThreadException(@NotNull Throwable cause) {
        super("conducted code threw " + cause, cause);
    }

    /**
     * Attached as a suppressed exception to a failure surfaced by {@link Conductor#conductTest()} so that reports name
     * the thread that failed and the beat at which the failure was observed. It has no stack trace of its own.
     */
    public static final class Origin extends RuntimeException {

        private final String threadName;
        private final int beat;

        Origin(@NotNull String threadName, int beat) {
            super("failure raised in conducted thread \"" + threadName + "\" at beat " + beat, null, false, false);
            this.threadName = threadName;
            this.beat = beat;
        }

        @NotNull
        public String threadName() {
            return threadName;
        }

        public int beat() {
            return beat;
        }
    }
}
