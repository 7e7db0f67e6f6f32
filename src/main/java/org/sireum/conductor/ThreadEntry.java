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
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Bookkeeping for one thread registered with a {@link Conductor}: its name, registration index, underlying
 * {@link Thread}, recorded {@link ThreadState}, and captured failure.
 * <br>
 * {@link #state}, {@link #awaitedBeat} and {@link #failure} are written only by the entry's own thread and read by the
 * coordinator. Each is volatile, and the failure is always published before the {@link ThreadState#TERMINATED} state.
 */
final class ThreadEntry {

    private static final Logger log = LoggerFactory.getLogger(ThreadEntry.class);

    private final String name;
    private final int index;
    private final Thread thread;
    private final Clock clock;

    private volatile ThreadState state = ThreadState.UNSTARTED;

    // only meaningful while state == BLOCKED_ON_BEAT
    private volatile int awaitedBeat = -1;

    @Nullable
    private volatile Throwable failure;

    private volatile int failureBeat = -1;

    ThreadEntry(@NotNull String name,
                int index,
                @NotNull ThreadBody body,
                @NotNull Clock clock,
                @NotNull CountDownLatch greenLight,
                @NotNull ThreadLocal<ThreadEntry> currentEntry) {
        this.name = name;
        this.index = index;
        this.clock = clock;
        this.thread = new Thread(() -> conduct(body, greenLight, currentEntry), name);
        this.thread.setDaemon(true);
    }

    private void conduct(ThreadBody body, CountDownLatch greenLight, ThreadLocal<ThreadEntry> currentEntry) {
        currentEntry.set(this);
        try {
            // no body runs before every conducted thread has been started
            greenLight.await();
            state = ThreadState.RUNNING;
            log.debug("conducted thread {} running at beat {}", name, clock.currentBeat());
            body.run();
        } catch (Throwable t) {
            failureBeat = clock.currentBeat();
            failure = t;
            log.debug("conducted thread {} failed at beat {}", name, failureBeat, t);
        } finally {
            state = ThreadState.TERMINATED;
            currentEntry.remove();
        }
    }

    /**
     * Blocks this entry's thread until the clock reaches the given beat, recording {@link ThreadState#BLOCKED_ON_BEAT}
     * for the coordinator while it waits. Must be called from this entry's own thread.
     */
    void waitForBeat(int beat) {
        awaitedBeat = beat;
        state = ThreadState.BLOCKED_ON_BEAT;
        try {
            clock.waitForBeat(beat);
        } finally {
            state = ThreadState.RUNNING;
        }
    }

    void start() {
        log.debug("starting conducted thread {}", name);
        thread.start();
    }

    /**
     * Interrupts this entry's thread on behalf of the coordinator, which is giving up on it.
     */
    void interruptForCleanup() {
        log.debug("interrupting conducted thread {} in state {}", name, observe());
        thread.interrupt();
    }

    /**
     * Samples the entry. A {@link ThreadState#RUNNING} entry whose thread is parked, sleeping, or blocked on a
     * monitor is reported as {@link ThreadState#BLOCKED_OTHER}.
     */
    @NotNull
    ThreadState observe() {
        final ThreadState recorded = state;
        if (recorded == ThreadState.RUNNING) {
            switch (thread.getState()) {
                case WAITING:
                case TIMED_WAITING:
                case BLOCKED:
                    return ThreadState.BLOCKED_OTHER;
                default:
                    return ThreadState.RUNNING;
            }
        }
        return recorded;
    }

    /**
     * @return true iff the thread is in {@link Thread.State#TIMED_WAITING}, meaning it will wake up on its own
     */
    boolean isTimedWaiting() {
        return thread.getState() == Thread.State.TIMED_WAITING;
    }

    boolean isAlive() {
        return thread.isAlive();
    }

    /**
     * Waits at most the given number of milliseconds for the thread to die.
     */
    void join(long millis) throws InterruptedException {
        thread.join(millis);
    }

    @NotNull
    String name() {
        return name;
    }

    @NotNull
    Thread thread() {
        return thread;
    }

    int awaitedBeat() {
        return awaitedBeat;
    }

    @Nullable
    Throwable failure() {
        return failure;
    }

    int failureBeat() {
        return failureBeat;
    }

    @Override
    public String toString() {
        return "ThreadEntry{#" + index + " " + name + ", " + observe() + '}';
    }
}
