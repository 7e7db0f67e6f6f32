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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The beat counter shared by every thread of one {@link Conductor}, plus its frozen flag.
 * <br>
 * The clock starts at beat 0 and only moves forward, one beat per {@link #advance()}. Threads block in
 * {@link #waitForBeat(int)} on the clock's monitor (never spinning) and are all released together, under that monitor,
 * by the advance that reaches their beat. Which of them then runs first is up to the scheduler.
 * <br>
 * Freezing is counted rather than toggled so that several threads may each hold the clock frozen at once. The clock
 * is frozen while the count is positive.
 */
final class Clock {

    private static final Logger log = LoggerFactory.getLogger(Clock.class);

    // guards every field below
    private final Object lock = new Object();

    private int currentBeat = 0;

    private int highestBeatAwaited = 0;

    private int freezeCount = 0;

    int currentBeat() {
        synchronized (lock) {
            return currentBeat;
        }
    }

    /**
     * Blocks the calling thread until the clock reaches the given beat. Returns immediately if it already has.
     *
     * @param beat the beat to wait for
     * @throws IllegalArgumentException if beat is negative
     * @throws ConductorInterruptedException if the thread is interrupted while waiting (its interrupt status is kept)
     */
    void waitForBeat(int beat) {
        if (beat < 0) {
            throw new IllegalArgumentException("beat must not be negative but was " + beat);
        }
        synchronized (lock) {
            if (beat > highestBeatAwaited) {
                highestBeatAwaited = beat;
            }
            // the check and the wait happen under the same monitor as advance(), so no notify can be missed
            while (currentBeat < beat) {
                try {
                    lock.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ConductorInterruptedException(
                            Thread.currentThread().getName() + " was interrupted while waiting for beat " + beat, e);
                }
            }
        }
    }

    /**
     * Moves the clock forward by exactly one beat and wakes every waiter.
     *
     * @return the new beat
     * @throws IllegalStateException if the clock is frozen
     */
    int advance() {
        synchronized (lock) {
            if (freezeCount > 0) {
                throw new IllegalStateException("the clock cannot advance while it is frozen");
            }
            return advanceLocked();
        }
    }

    /**
     * Advances the clock unless it is frozen, deciding both under the clock's monitor so that a concurrent
     * {@link #freeze()} can never be overtaken by an advance.
     *
     * @return true iff the clock advanced
     */
    boolean advanceIfNotFrozen() {
        synchronized (lock) {
            if (freezeCount > 0) {
                return false;
            }
            advanceLocked();
            return true;
        }
    }

    private int advanceLocked() {
        log.debug("clock advancing from beat {} to beat {}", currentBeat, currentBeat + 1);
        currentBeat++;
        lock.notifyAll();
        return currentBeat;
    }

    void freeze() {
        synchronized (lock) {
            freezeCount++;
        }
    }

    /**
     * @throws IllegalStateException if there is no matching {@link #freeze()}
     */
    void unfreeze() {
        synchronized (lock) {
            if (freezeCount == 0) {
                throw new IllegalStateException("the clock is not frozen");
            }
            freezeCount--;
        }
    }

    boolean isFrozen() {
        synchronized (lock) {
            return freezeCount > 0;
        }
    }

    /**
     * @return the highest beat any thread has waited for so far
     */
    int highestBeatAwaited() {
        synchronized (lock) {
            return highestBeatAwaited;
        }
    }

    /**
     * @return true iff some thread has asked for a beat the clock has not reached yet
     */
    boolean isAnyThreadWaitingForABeat() {
        synchronized (lock) {
            return highestBeatAwaited > currentBeat;
        }
    }
}
