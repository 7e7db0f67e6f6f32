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

import org.testng.annotations.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.sireum.conductor.TestUtils.DEFAULT_TEST_TIMEOUT;
import static org.testng.Assert.*;

public class ClockTest {

    @Test
    void startsAtBeatZero() {
        final Clock clock = new Clock();
        assertEquals(clock.currentBeat(), 0);
        assertFalse(clock.isFrozen());
        assertFalse(clock.isAnyThreadWaitingForABeat());
    }

    @Test
    void advanceIsAUnitStep() {
        final Clock clock = new Clock();
        for (int expected = 1; expected <= 5; expected++) {
            final int before = clock.currentBeat();
            assertEquals(clock.advance(), before + 1);
            assertEquals(clock.currentBeat(), expected);
        }
    }

    @Test
    void waitForReachedBeatReturnsImmediately() {
        final Clock clock = new Clock();
        clock.waitForBeat(0);
        clock.advance();
        clock.advance();
        clock.waitForBeat(1);
        clock.waitForBeat(2);
        assertEquals(clock.currentBeat(), 2);
    }

    @Test
    void negativeBeatIsRejected() {
        final Clock clock = new Clock();
        expectThrows(IllegalArgumentException.class, () -> clock.waitForBeat(-1));
    }

    @Test(timeOut = DEFAULT_TEST_TIMEOUT)
    void waiterIsNotReleasedBeforeItsBeat() throws InterruptedException {
        final Clock clock = new Clock();
        final AtomicInteger beatSeenOnRelease = new AtomicInteger(-1);
        final Thread waiter = new Thread(() -> {
            clock.waitForBeat(3);
            beatSeenOnRelease.set(clock.currentBeat());
        });
        waiter.start();

        while (!clock.isAnyThreadWaitingForABeat()) {
            Thread.sleep(1);
        }
        clock.advance();
        clock.advance();
        waiter.join(100);
        assertTrue(waiter.isAlive());
        assertEquals(beatSeenOnRelease.get(), -1);

        clock.advance();
        waiter.join();
        assertEquals(beatSeenOnRelease.get(), 3);
        assertEquals(clock.highestBeatAwaited(), 3);
    }

    @Test(timeOut = DEFAULT_TEST_TIMEOUT)
    void oneAdvanceReleasesEveryWaiterOfThatBeat() throws InterruptedException {
        final Clock clock = new Clock();
        final CountDownLatch released = new CountDownLatch(3);
        for (int i = 0; i < 3; i++) {
            final Thread waiter = new Thread(() -> {
                clock.waitForBeat(1);
                released.countDown();
            });
            waiter.setDaemon(true);
            waiter.start();
        }
        Thread.sleep(50);
        assertEquals(released.getCount(), 3L);

        clock.advance();
        assertTrue(released.await(5, TimeUnit.SECONDS));
    }

    @Test
    void frozenClockDoesNotAdvance() {
        final Clock clock = new Clock();
        clock.freeze();
        assertTrue(clock.isFrozen());
        assertFalse(clock.advanceIfNotFrozen());
        expectThrows(IllegalStateException.class, clock::advance);
        assertEquals(clock.currentBeat(), 0);

        clock.unfreeze();
        assertFalse(clock.isFrozen());
        assertTrue(clock.advanceIfNotFrozen());
        assertEquals(clock.currentBeat(), 1);
    }

    @Test
    void freezeIsCountedPerHolder() {
        final Clock clock = new Clock();
        clock.freeze();
        clock.freeze();
        clock.unfreeze();
        assertTrue(clock.isFrozen());
        clock.unfreeze();
        assertFalse(clock.isFrozen());
    }

    @Test
    void unfreezeWithoutFreezeIsRejected() {
        final Clock clock = new Clock();
        expectThrows(IllegalStateException.class, clock::unfreeze);
    }

    @Test(timeOut = DEFAULT_TEST_TIMEOUT)
    void interruptedWaiterKeepsItsInterruptStatus() throws InterruptedException {
        final Clock clock = new Clock();
        final AtomicReference<Throwable> thrown = new AtomicReference<>();
        final AtomicBoolean interruptStatus = new AtomicBoolean(false);
        final Thread waiter = new Thread(() -> {
            try {
                clock.waitForBeat(1);
            } catch (Throwable t) {
                thrown.set(t);
                interruptStatus.set(Thread.currentThread().isInterrupted());
            }
        });
        waiter.start();
        while (waiter.getState() != Thread.State.WAITING) {
            Thread.sleep(1);
        }
        waiter.interrupt();
        waiter.join();

        assertTrue(thrown.get() instanceof ConductorInterruptedException);
        assertTrue(thrown.get().getCause() instanceof InterruptedException);
        assertTrue(thrown.get().getMessage().contains("beat 1"));
        assertTrue(interruptStatus.get());
        assertEquals(clock.currentBeat(), 0);
    }
}
