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

/**
 * Thrown when a thread is interrupted while the conductor has it waiting: a conducted thread inside
 * {@link Conductor#waitForBeat(int)}, or the test's own thread inside {@link Conductor#conductTest()}. The thread's
 * interrupt status is restored before this exception is thrown.
 */
public class ConductorInterruptedException extends RuntimeException {

    /**
     * @param message what the thread was waiting for
     * @param cause the interruption
     */
    ConductorInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
