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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown by {@link Conductor#conductTest()} when conducting exceeds {@link ConductorConfig#timeLimit()} without every
 * thread terminating or any thread failing. This usually means a suspected deadlock, or a clock that was never
 * unfrozen. The message and {@link #threadStates()} list every registered thread with its last observed state.
 */
public class ConductorTimeoutException extends RuntimeException {

    private final Map<String, ThreadState> threadStates;

    /**
     * @param headline first line of the message
     * @param beat the beat the clock had reached
     * @param threadStates last observed state of each thread, in registration order
     */
    ConductorTimeoutException(@NotNull String headline, int beat, @NotNull Map<String, ThreadState> threadStates) {
        super(createErrorMessage(headline, beat, threadStates));
        this.threadStates = Collections.unmodifiableMap(new LinkedHashMap<>(threadStates));
    }

    /**
     * @return the last observed state of each registered thread, keyed by name in registration order
     */
    @NotNull
    public Map<String, ThreadState> threadStates() {
        return threadStates;
    }

    private static String createErrorMessage(String headline, int beat, Map<String, ThreadState> threadStates) {
        final StringBuilder message = new StringBuilder(headline)
                .append("\n===== Begin conducted thread dump (beat ").append(beat).append(") =====");
        threadStates.forEach((name, state) -> message.append("\n  ").append(name).append(": ").append(state));
        return message.append("\n===== End conducted thread dump =====").toString();
    }
}
