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
 * Lifecycle state of a thread registered with a {@link Conductor}, as last observed by its coordinator.
 *
 * <pre>
 *   UNSTARTED -&gt; RUNNING &lt;-&gt; BLOCKED_ON_BEAT -&gt; TERMINATED
 *                  RUNNING &lt;-&gt; BLOCKED_OTHER
 * </pre>
 */
public enum ThreadState {

    /**
     * Registered, but conducting has not begun (or the thread has not yet been given the green light).
     */
    UNSTARTED,

    /**
     * Executing its body.
     */
    RUNNING,

    /**
     * Inside {@link Conductor#waitForBeat(int)} for a beat the clock may not have reached yet.
     */
    BLOCKED_ON_BEAT,

    /**
     * Waiting, timed-waiting, or blocked on anything other than the conductor's clock (a lock, a queue, a latch...).
     * This state is never recorded by the thread itself, it is inferred from {@link Thread#getState()}.
     */
    BLOCKED_OTHER,

    /**
     * The body returned or threw.
     */
    TERMINATED
}
