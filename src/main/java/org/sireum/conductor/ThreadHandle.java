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

import java.util.Optional;

/**
 * Returned by {@link Conductor#thread(String, ThreadBody)} so a test can refer to a conducted thread later, typically to
 * {@link #interrupt()} it from another conducted thread or to assert on its state inside a finish block.
 */
public final class ThreadHandle {

    private final ThreadEntry entry;

    ThreadHandle(@NotNull ThreadEntry entry) {
        this.entry = entry;
    }

    @NotNull
    public String name() {
        return entry.name();
    }

    /**
     * @return the thread's state as the coordinator would observe it right now
     */
    @NotNull
    public ThreadState state() {
        return entry.observe();
    }

    public boolean isAlive() {
        return entry.isAlive();
    }

    /**
     * @return whatever the thread's body threw, if it has terminated abruptly
     */
    @NotNull
    public Optional<Throwable> failure() {
        return Optional.ofNullable(entry.failure());
    }

    /**
     * Interrupts the conducted thread, simulating an external interrupt for the code under test. Has no effect before
     * conducting has begun.
     */
    public void interrupt() {
        entry.thread().interrupt();
    }

    /**
     * @return the underlying {@link Thread}, for assertions on its {@link Thread.State} or thread group
     */
    @NotNull
    public Thread thread() {
        return entry.thread();
    }

    @Override
    public String toString() {
        return "ThreadHandle{" + name() + ", " + state() + '}';
    }
}
