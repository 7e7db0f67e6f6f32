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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.sireum.conductor.PackageUtils.propagate;

/**
 * The polling loop behind {@link Conductor#conductTest()}. It runs on the caller's thread, starts every registered
 * thread, and then repeatedly samples them, advancing the {@link Clock} whenever every live thread is blocked.
 * <br>
 * Whether a thread blocked on something other than a beat is stuck or merely slow cannot be proven, so such a thread
 * only counts as blocked after it has stayed so for {@link ConductorConfig#blockedGracePeriod()}. Sampling is a
 * bounded sleep-poll for the same reason: the opaque blocking inside user code sends no notification.
 */
final class Coordinator {

    private static final Logger log = LoggerFactory.getLogger(Coordinator.class);

    private static final long NOT_BLOCKED = Long.MIN_VALUE;

    private final List<ThreadEntry> entries;
    private final Clock clock;
    private final ConductorConfig config;
    private final CountDownLatch greenLight;

    // indexed like entries, written only by the coordinating thread
    private final ThreadState[] observed;
    private final long[] blockedOtherSince;

    Coordinator(@NotNull List<ThreadEntry> entries,
                @NotNull Clock clock,
                @NotNull ConductorConfig config,
                @NotNull CountDownLatch greenLight) {
        this.entries = entries;
        this.clock = clock;
        this.config = config;
        this.greenLight = greenLight;
        this.observed = new ThreadState[entries.size()];
        this.blockedOtherSince = new long[entries.size()];
        for (int i = 0; i < entries.size(); i++) {
            observed[i] = ThreadState.UNSTARTED;
            blockedOtherSince[i] = NOT_BLOCKED;
        }
    }

    /**
     * Starts every thread and coordinates them until all have terminated.
     *
     * @throws ConductorTimeoutException if the time limit is exceeded or the threads appear deadlocked
     * @throws ConductorInterruptedException if the coordinating thread is interrupted
     * @throws RuntimeException the first-registered thread failure (unchecked failures are rethrown as-is)
     */
    void conduct() {
        final long startNanos = System.nanoTime();
        final long timeLimitNanos = config.timeLimit().toNanos();
        final long graceNanos = config.blockedGracePeriod().toNanos();

        for (ThreadEntry entry : entries) {
            entry.start();
        }
        greenLight.countDown();

        int deadlockCount = 0;

        while (true) {
            final long now = System.nanoTime();
            final int beat = clock.currentBeat();

            boolean anyFailed = false;
            boolean allTerminated = true;
            boolean safeToAdvance = true;
            boolean allInUntimedWait = true;

            for (int i = 0; i < entries.size(); i++) {
                final ThreadEntry entry = entries.get(i);
                final ThreadState state = entry.observe();
                observed[i] = state;

                if (entry.failure() != null) {
                    anyFailed = true;
                }
                if (state == ThreadState.TERMINATED) {
                    blockedOtherSince[i] = NOT_BLOCKED;
                    continue;
                }
                allTerminated = false;

                if (state == ThreadState.BLOCKED_OTHER) {
                    if (blockedOtherSince[i] == NOT_BLOCKED) {
                        blockedOtherSince[i] = now;
                    }
                    if (now - blockedOtherSince[i] < graceNanos) {
                        safeToAdvance = false;
                    }
                    if (entry.isTimedWaiting()) {
                        allInUntimedWait = false;
                    }
                } else {
                    blockedOtherSince[i] = NOT_BLOCKED;
                    allInUntimedWait = false;
                    // a thread waiting for a beat the clock already reached is about to run
                    if (state != ThreadState.BLOCKED_ON_BEAT || entry.awaitedBeat() <= beat) {
                        safeToAdvance = false;
                    }
                }
            }

            if (anyFailed) {
                throw surfaceFailure();
            }
            if (allTerminated) {
                log.debug("every conducted thread terminated at beat {} after {} ms", beat, elapsedMillis(startNanos));
                return;
            }
            if (now - startNanos > timeLimitNanos) {
                throw timedOut(new ConductorTimeoutException(timeoutHeadline(), beat, snapshot()));
            }

            if (allInUntimedWait && !clock.isAnyThreadWaitingForABeat()) {
                if (++deadlockCount >= config.deadlockDetections()) {
                    throw timedOut(new ConductorDeadlockException(deadlockHeadline(), beat, snapshot()));
                }
            } else {
                deadlockCount = 0;
            }

            if (safeToAdvance) {
                clock.advanceIfNotFrozen();
            }

            sleep(config.clockPeriod());
        }
    }

    /**
     * Stops advancing, gives live threads a bounded chance to finish on their own, interrupts the rest, and returns
     * the failure of the lowest-registered failing thread. Failures caused by that cleanup interrupt are never
     * chosen, because the choice is made before interrupting. Other failures are dropped.
     */
    private RuntimeException surfaceFailure() {
        awaitSelfTermination();

        ThreadEntry failed = null;
        for (ThreadEntry entry : entries) {
            if (entry.failure() != null) {
                failed = entry;
                break;
            }
        }
        if (failed == null) {
            throw new IllegalStateException("a conducted thread failed but no failure is recorded");
        }

        int suppressedCount = 0;
        for (ThreadEntry entry : entries) {
            if (entry != failed && entry.failure() != null) {
                suppressedCount++;
                log.debug("dropping failure of conducted thread {} in favor of {}", entry.name(), failed.name(),
                        entry.failure());
            }
        }
        log.debug("conducted thread {} failed at beat {} ({} other failures dropped)",
                failed.name(), failed.failureBeat(), suppressedCount);

        interruptAndJoinLiveEntries();

        final Throwable failure = failed.failure();
        failure.addSuppressed(new ConductedThreadException.Origin(failed.name(), failed.failureBeat()));
        return propagate(failure);
    }

    /**
     * Waits up to {@link ConductorConfig#failureGracePeriod()} for live threads to terminate. Returns early once every
     * live thread is waiting for a beat not yet reached, since the clock will not move again.
     */
    private void awaitSelfTermination() {
        final long deadline = System.nanoTime() + config.failureGracePeriod().toNanos();
        while (System.nanoTime() < deadline) {
            final int beat = clock.currentBeat();
            boolean anyMayProgress = false;
            for (ThreadEntry entry : entries) {
                final ThreadState state = entry.observe();
                final boolean parked = state == ThreadState.BLOCKED_ON_BEAT && entry.awaitedBeat() > beat;
                if (state != ThreadState.TERMINATED && !parked) {
                    anyMayProgress = true;
                    break;
                }
            }
            if (!anyMayProgress) {
                return;
            }
            sleep(config.clockPeriod());
        }
    }

    private ConductorTimeoutException timedOut(ConductorTimeoutException exception) {
        log.debug("giving up on conducted threads: {}", exception.threadStates());
        interruptAndJoinLiveEntries();
        return exception;
    }

    /**
     * Interrupts every live thread, then joins them within {@link ConductorConfig#failureGracePeriod()} so that none
     * outlives {@link Conductor#conductTest()}. Threads that ignore the interrupt are reported and abandoned (they are
     * daemons).
     */
    private void interruptAndJoinLiveEntries() {
        for (ThreadEntry entry : entries) {
            if (entry.isAlive()) {
                entry.interruptForCleanup();
            }
        }
        final long deadline = System.nanoTime() + config.failureGracePeriod().toNanos();
        for (ThreadEntry entry : entries) {
            final long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMillis > 0 && entry.isAlive()) {
                try {
                    entry.join(remainingMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        for (ThreadEntry entry : entries) {
            if (entry.isAlive()) {
                log.warn("conducted thread {} is still alive after being interrupted, abandoning it in state {}",
                        entry.name(), entry.observe());
            }
        }
    }

    private void sleep(Duration period) {
        try {
            TimeUnit.NANOSECONDS.sleep(period.toNanos());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            final int beat = clock.currentBeat();
            final Map<String, ThreadState> states = snapshot();
            interruptAndJoinLiveEntries();
            throw new ConductorInterruptedException(
                    "conducting was interrupted at beat " + beat + " with threads " + states, e);
        }
    }

    private String timeoutHeadline() {
        return "Timeout! Test ran longer than " + config.timeLimit().toMillis() + " ms" +
                (clock.isFrozen() ? " and the clock is still frozen." : ".") +
                " Highest beat awaited: " + clock.highestBeatAwaited() + ".";
    }

    private String deadlockHeadline() {
        final long periods = config.deadlockDetections();
        return "Apparent deadlock! Every live conducted thread has been waiting on something other than a beat for " +
                periods + " clock periods (" + periods * config.clockPeriod().toMillis() + " ms).";
    }

    /**
     * @return the last observed state of every entry, keyed by name in registration order
     */
    @NotNull
    private Map<String, ThreadState> snapshot() {
        final Map<String, ThreadState> states = new LinkedHashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            states.put(entries.get(i).name(), observed[i]);
        }
        return states;
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
