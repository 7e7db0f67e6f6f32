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
import org.testng.IHookCallBack;
import org.testng.IHookable;
import org.testng.ITestResult;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;

/**
 * TestNG base class giving every test method a fresh {@link Conductor} behind protected delegate methods, so a test
 * reads as a plain list of {@code thread(...)} registrations:
 * <pre>{@code
 * public class ArrayBlockingQueueTest extends ConductorMethods {
 *
 *     @Test
 *     public void putOnFullQueueBlocks() {
 *         final ArrayBlockingQueue<Integer> buf = new ArrayBlockingQueue<>(1);
 *         thread("producer", () -> { buf.put(42); buf.put(17); assertEquals(beat(), 1); });
 *         thread("consumer", () -> { waitForBeat(1); buf.take(); buf.take(); });
 *         whenFinished(() -> assertTrue(buf.isEmpty()));
 *     }
 * }
 * }</pre>
 * When a test method returns normally without having called {@link #conductTest()}, it is called for it, and whatever
 * {@link Conductor#conductTest()} throws fails the test. A test method that already failed is not conducted.
 * <br>
 * The current Conductor is shared by the test instance, so subclasses must not run their methods in parallel.
 *
 * @see ConductorFixture
 */
public abstract class ConductorMethods implements IHookable {

    private final AtomicReference<Conductor> conductor = new AtomicReference<>();

    @Override
    public void run(IHookCallBack callBack, ITestResult testResult) {
        final Conductor fresh = newConductor();
        conductor.set(fresh);
        callBack.runTestMethod(testResult);
        if (testResult.getThrowable() == null && !fresh.conductingHasBegun()) {
            fresh.conductTest();
        }
    }

    /**
     * Creates the Conductor of each test method. Override to supply a tuned {@link ConductorConfig}.
     */
    @NotNull
    protected Conductor newConductor() {
        return new Conductor();
    }

    /**
     * @return the Conductor of the test method currently running
     */
    @NotNull
    protected Conductor conductor() {
        final Conductor current = conductor.get();
        if (current == null) {
            throw new IllegalStateException("no Conductor outside of a test method");
        }
        return current;
    }

    @NotNull
    protected ThreadHandle thread(@NotNull ThreadBody body) {
        return conductor().thread(body);
    }

    @NotNull
    protected ThreadHandle thread(@NotNull String name, @NotNull ThreadBody body) {
        return conductor().thread(name, body);
    }

    @NotNull
    protected List<ThreadHandle> threads(int count, @NotNull ThreadBody body) {
        return conductor().threads(count, body);
    }

    @NotNull
    protected List<ThreadHandle> threads(int count, @NotNull String namePrefix, @NotNull ThreadBody body) {
        return conductor().threads(count, namePrefix, body);
    }

    protected void waitForBeat(int beat) {
        conductor().waitForBeat(beat);
    }

    protected int beat() {
        return conductor().beat();
    }

    protected void withClockFrozen(@NotNull ThreadBody block) {
        conductor().withClockFrozen(block);
    }

    protected <T> T withClockFrozen(@NotNull Callable<T> block) {
        return conductor().withClockFrozen(block);
    }

    protected boolean isClockFrozen() {
        return conductor().isClockFrozen();
    }

    protected void whenFinished(@NotNull ThreadBody block) {
        conductor().whenFinished(block);
    }

    protected void conductTest() {
        conductor().conductTest();
    }

    protected boolean conductingHasBegun() {
        return conductor().conductingHasBegun();
    }
}
