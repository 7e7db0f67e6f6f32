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
import org.testng.annotations.DataProvider;

/**
 * TestNG base class that hands each test invocation a fresh {@link Conductor} as a parameter:
 * <pre>{@code
 * public class SemaphoreTest extends ConductorFixture {
 *
 *     @Test(dataProvider = CONDUCTOR)
 *     public void interruptedAcquire(Conductor conductor) {
 *         final Semaphore s = new Semaphore(0);
 *         final ThreadHandle nice = conductor.thread("nice", () ->
 *                 expectThrows(InterruptedException.class, s::acquire));
 *         conductor.thread("rude", () -> { conductor.waitForBeat(1); nice.interrupt(); });
 *     }
 * }
 * }</pre>
 * When the test method returns normally, every Conductor parameter whose {@link Conductor#conductTest()} was not
 * called is conducted, and whatever that throws fails the test.
 *
 * @see ConductorMethods
 */
public abstract class ConductorFixture implements IHookable {

    /**
     * Name of the data provider supplying a fresh {@link Conductor}.
     */
    public static final String CONDUCTOR = "conductor";

    /**
     * Supplies one Conductor per invocation. It is only a placeholder: {@link #run(IHookCallBack, ITestResult)} swaps
     * it for a Conductor created on the thread that runs the test method, so that {@link Conductor#whenFinished} works
     * when TestNG runs the method on its own thread (for example with {@code timeOut}).
     */
    @DataProvider(name = CONDUCTOR)
    public Object[][] conductors() {
        return new Object[][] { { newConductor() } };
    }

    /**
     * Creates the Conductor of each test invocation. Override to supply a tuned {@link ConductorConfig}.
     */
    @NotNull
    protected Conductor newConductor() {
        return new Conductor();
    }

    @Override
    public void run(IHookCallBack callBack, ITestResult testResult) {
        final Object[] parameters = callBack.getParameters();
        if (parameters != null) {
            for (int i = 0; i < parameters.length; i++) {
                if (parameters[i] instanceof Conductor) {
                    parameters[i] = newConductor();
                }
            }
        }
        callBack.runTestMethod(testResult);
        if (testResult.getThrowable() != null || parameters == null) {
            return;
        }
        for (Object parameter : parameters) {
            if (parameter instanceof Conductor && !((Conductor) parameter).conductingHasBegun()) {
                ((Conductor) parameter).conductTest();
            }
        }
    }
}
