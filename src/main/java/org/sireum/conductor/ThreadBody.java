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
 * The code run by a conducted thread, a finish block, or a frozen-clock block. Unlike {@link Runnable} it may throw
 * checked exceptions, which the {@link Conductor} carries back to the test's thread.
 *
 * @see Conductor#thread(String, ThreadBody)
 * @see Conductor#whenFinished(ThreadBody)
 * @see Conductor#withClockFrozen(ThreadBody)
 */
@FunctionalInterface
public interface ThreadBody {

    void run() throws Exception;

}
