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

import java.util.Map;

/**
 * A {@link ConductorTimeoutException} raised early because every live thread sat in an untimed wait on something
 * other than a beat for {@link ConductorConfig#deadlockDetections()} consecutive samples. Nothing the clock can do
 * will wake such threads, so there is no point in waiting for the full time limit.
 */
public class ConductorDeadlockException extends ConductorTimeoutException {

    ConductorDeadlockException(@NotNull String headline, int beat, @NotNull Map<String, ThreadState> threadStates) {
        super(headline, beat, threadStates);
    }
}
