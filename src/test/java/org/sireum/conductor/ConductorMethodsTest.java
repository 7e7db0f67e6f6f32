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

import org.testng.annotations.AfterMethod;
import org.testng.annotations.Test;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.sireum.conductor.TestUtils.DEFAULT_TEST_TIMEOUT;
import static org.testng.Assert.*;

public class ConductorMethodsTest extends ConductorMethods {

    @AfterMethod
    public void everyConductorIsConductedByTheEndOfItsTest() {
        assertTrue(conductor().conductingHasFinished());
    }

    @Test(timeOut = DEFAULT_TEST_TIMEOUT)
    void callToPutOnFullQueueBlocks() {
        final ArrayBlockingQueue<Integer> buf = new ArrayBlockingQueue<>(1);

        thread("producer", () -> {
            buf.put(42);
            buf.put(17);
            assertEquals(beat(), 1);
        });
        thread("consumer", () -> {
            waitForBeat(1);
            assertEquals(buf.take(), Integer.valueOf(42));
            assertEquals(buf.take(), Integer.valueOf(17));
        });
        whenFinished(() -> assertTrue(buf.isEmpty()));
    }

    @Test(timeOut = DEFAULT_TEST_TIMEOUT)
    void compareAndSetWaitsForTheOtherThread() {
        final AtomicInteger ai = new AtomicInteger(1);

        thread(() -> {
            while (!ai.compareAndSet(2, 3)) {
                Thread.yield();
            }
        });
        thread(() -> assertTrue(ai.compareAndSet(1, 2)));
        whenFinished(() -> assertEquals(ai.get(), 3));
    }

    @Test(timeOut = DEFAULT_TEST_TIMEOUT)
    void interruptedAcquireThrowsInterruptedException() {
        final Semaphore s = new Semaphore(0);

        final ThreadHandle nice = thread("nice", () -> {
            expectThrows(InterruptedException.class, s::acquire);
            assertEquals(beat(), 1);
        });
        thread("rude", () -> {
            waitForBeat(1);
            nice.interrupt();
        });
    }

    @Test(timeOut = DEFAULT_TEST_TIMEOUT)
    void threadOrderingFollowsTheBeats() {
        final AtomicInteger ai = new AtomicInteger(0);

        thread(() -> {
            waitForBeat(3);
            assertTrue(ai.compareAndSet(2, 3));
        });
        thread(() -> {
            waitForBeat(1);
            assertTrue(ai.compareAndSet(0, 1));
        });
        thread(() -> {
            waitForBeat(2);
            assertTrue(ai.compareAndSet(1, 2));
        });
        whenFinished(() -> assertEquals(ai.get(), 3));
    }

    @Test(timeOut = DEFAULT_TEST_TIMEOUT)
    void timedOfferIsInterrupted() {
        final ArrayBlockingQueue<String> q = new ArrayBlockingQueue<>(2);

        final ThreadHandle producer = thread("producer", () -> {
            q.put("w");
            q.put("x");

            withClockFrozen(() -> assertFalse(q.offer("y", 25, TimeUnit.MILLISECONDS)));

            expectThrows(InterruptedException.class, () -> q.offer("z", 2500, TimeUnit.MILLISECONDS));
            assertEquals(beat(), 1);
        });
        thread("consumer", () -> {
            waitForBeat(1);
            producer.interrupt();
        });
    }

    @Test(timeOut = DEFAULT_TEST_TIMEOUT)
    void metronomeOfThreeThreads() {
        final StringBuffer s = new StringBuffer();

        thread(() -> {
            waitForBeat(1);
            s.append("A");
            waitForBeat(3);
            s.append("C");
            waitForBeat(6);
            s.append("F");
        });
        thread(() -> {
            waitForBeat(2);
            s.append("B");
            waitForBeat(5);
            s.append("E");
            waitForBeat(8);
            s.append("H");
        });
        thread(() -> {
            waitForBeat(4);
            s.append("D");
            waitForBeat(7);
            s.append("G");
            waitForBeat(9);
            s.append("I");
        });
        whenFinished(() -> assertEquals(s.toString(), "ABCDEFGHI"));
    }

    @Test(timeOut = DEFAULT_TEST_TIMEOUT)
    void whenFinishedFromAConductedThreadIsRejected() {
        thread(() -> expectThrows(IllegalStateException.class, () -> whenFinished(() -> { })));
    }

    @Test(timeOut = DEFAULT_TEST_TIMEOUT)
    void explicitConductTestIsNotRepeated() {
        final AtomicInteger runs = new AtomicInteger();
        thread(runs::incrementAndGet);

        conductTest();

        assertTrue(conductingHasBegun());
        assertEquals(runs.get(), 1);
    }

    @Test(timeOut = DEFAULT_TEST_TIMEOUT)
    void explicitConductTestSurfacesFailures() {
        final AssertionError failure = new AssertionError("worker");
        thread("worker", () -> {
            waitForBeat(1);
            throw failure;
        });

        assertSame(expectThrows(AssertionError.class, this::conductTest), failure);
    }

    @Test
    void eachTestMethodGetsItsOwnConductor() {
        assertFalse(conductingHasBegun());
        assertEquals(beat(), 0);
        assertFalse(isClockFrozen());
    }
}
