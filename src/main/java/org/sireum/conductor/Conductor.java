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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import static org.sireum.conductor.PackageUtils.DEFAULT_THREAD_NAME_PREFIX;
import static org.sireum.conductor.PackageUtils.call;
import static org.sireum.conductor.PackageUtils.run;

/**
 * Conducts a multi-threaded test so that its interleaving is pinned to a shared logical clock.
 * <br>
 * A test registers thread bodies with {@link #thread(String, ThreadBody)}, optionally registers a finish block with
 * {@link #whenFinished(ThreadBody)}, and then calls {@link #conductTest()}. Nothing runs before that call. The
 * calling thread then starts every registered thread and coordinates them: whenever every live thread is blocked,
 * either in {@link #waitForBeat(int)} or (for a grace period) on anything else, the clock advances by one beat and
 * releases the threads waiting for it.
 * <pre>{@code
 * final Conductor conductor = new Conductor();
 * final ArrayBlockingQueue<Integer> buf = new ArrayBlockingQueue<>(1);
 *
 * conductor.thread("producer", () -> {
 *     buf.put(42);
 *     buf.put(17);              // blocks until the consumer takes 42
 *     assertEquals(conductor.beat(), 1);
 * });
 *
 * conductor.thread("consumer", () -> {
 *     conductor.waitForBeat(1); // released once the producer is blocked
 *     assertEquals(buf.take(), 42);
 *     assertEquals(buf.take(), 17);
 * });
 *
 * conductor.whenFinished(() -> assertTrue(buf.isEmpty()));
 * conductor.conductTest();
 * }</pre>
 * If any thread fails, {@link #conductTest()} stops advancing the clock, cleans up the remaining threads, and throws
 * the failure of the earliest-registered failing thread. Only beat-granularity ordering is promised: threads
 * released by the same beat run in whatever order the scheduler picks.
 * <br>
 * Every Conductor owns its own clock, so several may be used side by side. A Conductor is single-use.
 *
 * @see ConductorMethods
 * @see ConductorFixture
 */
public final class Conductor {

    private static final Logger log = LoggerFactory.getLogger(Conductor.class);

    private enum Phase { SETUP, CONDUCTING, FINISHED }

    private final Clock clock = new Clock();

    private final ConductorConfig config;

    // the thread that created this conductor, the only one allowed to register a finish block
    private final Thread creator = Thread.currentThread();

    // released by the coordinator once every registered thread has been started
    private final CountDownLatch greenLight = new CountDownLatch(1);

    private final ThreadLocal<ThreadEntry> currentEntry = new ThreadLocal<>();

    // guards entries, threadNames, phase transitions and finishBlock registration
    private final Object lock = new Object();

    private final List<ThreadEntry> entries = new ArrayList<>();

    private final Set<String> threadNames = new HashSet<>();

    private volatile Phase phase = Phase.SETUP;

    @Nullable
    private volatile ThreadBody finishBlock;

    /**
     * Creates a Conductor tuned by {@link ConductorConfig#defaults()}.
     */
    public Conductor() {
        this(ConductorConfig.defaults());
    }

    public Conductor(@NotNull ConductorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /////////////////////// registration ///////////////////////

    /**
     * Registers a thread named {@code "Conductor-Thread-" + n}, where n is the number of threads registered before it.
     *
     * @param body the code the thread will run once {@link #conductTest()} is called
     * @return a handle on the registered thread
     * @throws IllegalStateException if {@link #conductTest()} has already been called
     */
    @NotNull
    public ThreadHandle thread(@NotNull ThreadBody body) {
        return register(null, body);
    }

    /**
     * Registers a named thread. Names must be unique within one Conductor.
     *
     * @param name the name of the thread, also used for its underlying {@link Thread}
     * @param body the code the thread will run once {@link #conductTest()} is called
     * @return a handle on the registered thread
     * @throws IllegalStateException if {@link #conductTest()} has already been called
     * @throws IllegalArgumentException if a thread with the same name is already registered
     */
    @NotNull
    public ThreadHandle thread(@NotNull String name, @NotNull ThreadBody body) {
        return register(Objects.requireNonNull(name, "name"), body);
    }

    /**
     * Registers {@code count} threads that all run the same body, each with a default name.
     *
     * @see #thread(ThreadBody)
     */
    @NotNull
    public List<ThreadHandle> threads(int count, @NotNull ThreadBody body) {
        requireCount(count);
        final List<ThreadHandle> handles = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            handles.add(register(null, body));
        }
        return Collections.unmodifiableList(handles);
    }

    /**
     * Registers {@code count} threads that all run the same body, named {@code namePrefix + "(1)"},
     * {@code namePrefix + "(2)"}, and so on.
     *
     * @see #thread(String, ThreadBody)
     */
    @NotNull
    public List<ThreadHandle> threads(int count, @NotNull String namePrefix, @NotNull ThreadBody body) {
        requireCount(count);
        Objects.requireNonNull(namePrefix, "namePrefix");
        final List<ThreadHandle> handles = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            handles.add(register(namePrefix + "(" + i + ")", body));
        }
        return Collections.unmodifiableList(handles);
    }

    private static void requireCount(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive but was " + count);
        }
    }

    private ThreadHandle register(@Nullable String requestedName, @NotNull ThreadBody body) {
        Objects.requireNonNull(body, "body");
        synchronized (lock) {
            final String name = requestedName != null ? requestedName : DEFAULT_THREAD_NAME_PREFIX + entries.size();
            if (phase != Phase.SETUP) {
                throw new IllegalStateException("Cannot register thread " + name + " after conductTest has been called.");
            }
            if (!threadNames.add(name)) {
                throw new IllegalArgumentException(
                        "Cannot register two threads with the same name. Duplicate name: " + name + ".");
            }
            final ThreadEntry entry = new ThreadEntry(name, entries.size(), body, clock, greenLight, currentEntry);
            entries.add(entry);
            return new ThreadHandle(entry);
        }
    }

    /////////////////////// clock ///////////////////////

    /**
     * Blocks the calling conducted thread until the clock reaches the given beat. Returns immediately if it already
     * has. The clock starts at beat 0.
     *
     * @param beat the beat to wait for
     * @throws IllegalStateException if the caller is not a thread conducted by this Conductor
     * @throws IllegalArgumentException if beat is negative
     * @throws ConductorInterruptedException if the thread is interrupted while waiting
     */
    public void waitForBeat(int beat) {
        final ThreadEntry entry = currentEntry.get();
        if (entry == null) {
            throw new IllegalStateException("waitForBeat can only be called from a thread conducted by this Conductor.");
        }
        entry.waitForBeat(beat);
    }

    /**
     * @return the beat the clock has reached
     */
    public int beat() {
        return clock.currentBeat();
    }

    /**
     * Runs the block with the clock frozen: the conductor will not advance the clock while it runs, even if every
     * thread is blocked. This makes it possible to assert that a timed blocking call really times out, rather than
     * being released by an advance. The clock is unfrozen however the block exits.
     *
     * @param block the code to run with the clock frozen
     */
    public void withClockFrozen(@NotNull ThreadBody block) {
        Objects.requireNonNull(block, "block");
        clock.freeze();
        try {
            run(block);
        } finally {
            clock.unfreeze();
        }
    }

    /**
     * Like {@link #withClockFrozen(ThreadBody)}, returning the block's result.
     */
    public <T> T withClockFrozen(@NotNull Callable<T> block) {
        Objects.requireNonNull(block, "block");
        clock.freeze();
        try {
            return call(block);
        } finally {
            clock.unfreeze();
        }
    }

    public boolean isClockFrozen() {
        return clock.isFrozen();
    }

    /////////////////////// conducting ///////////////////////

    /**
     * Registers the block to run on the calling thread after every conducted thread has terminated successfully.
     * The block runs with the clock frozen and its failure becomes the outcome of {@link #conductTest()}.
     *
     * @param block the finish block
     * @throws IllegalStateException if called by a thread other than the one that created this Conductor, more than
     *                               once, or after {@link #conductTest()} has been called
     */
    public void whenFinished(@NotNull ThreadBody block) {
        Objects.requireNonNull(block, "block");
        if (Thread.currentThread() != creator) {
            throw new IllegalStateException("whenFinished can only be called by thread that created Conductor.");
        }
        synchronized (lock) {
            if (phase != Phase.SETUP) {
                throw new IllegalStateException("Cannot invoke whenFinished after conductTest has been called.");
            }
            if (finishBlock != null) {
                throw new IllegalStateException("whenFinished can only be called once per Conductor.");
            }
            finishBlock = block;
        }
    }

    /**
     * Starts every registered thread and coordinates them on the calling thread until all have terminated, then runs
     * the finish block, if any.
     *
     * @throws IllegalStateException if called more than once
     * @throws ConductorTimeoutException if the threads did not finish within {@link ConductorConfig#timeLimit()}
     * @throws ConductorDeadlockException if every live thread appears stuck on something other than a beat
     * @throws ConductorInterruptedException if the calling thread is interrupted while conducting
     * @throws ConductedThreadException wrapping a checked exception thrown by a thread or the finish block
     * @throws RuntimeException or {@link Error}: the unchecked failure thrown by the earliest-registered failing
     *                          thread, or by the finish block, as the very same instance
     */
    public void conductTest() {
        final List<ThreadEntry> conducted;
        synchronized (lock) {
            if (phase != Phase.SETUP) {
                throw new IllegalStateException("A Conductor's conductTest method can only be invoked once.");
            }
            phase = Phase.CONDUCTING;
            conducted = Collections.unmodifiableList(new ArrayList<>(entries));
        }
        log.debug("conducting {} threads with {}", conducted.size(), config);
        try {
            new Coordinator(conducted, clock, config, greenLight).conduct();
            final ThreadBody finish = finishBlock;
            if (finish != null) {
                log.debug("running finish block at beat {}", clock.currentBeat());
                withClockFrozen(finish);
            }
        } finally {
            phase = Phase.FINISHED;
        }
    }

    /**
     * @return true iff {@link #conductTest()} has been called
     */
    public boolean conductingHasBegun() {
        return phase != Phase.SETUP;
    }

    /**
     * @return true iff {@link #conductTest()} has returned or thrown
     */
    public boolean conductingHasFinished() {
        return phase == Phase.FINISHED;
    }

    @NotNull
    public ConductorConfig config() {
        return config;
    }
}
