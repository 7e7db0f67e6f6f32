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

import java.time.Duration;

import static org.testng.Assert.*;

public class ConductorConfigTest {

    @Test
    void defaultsMatchDocumentedValues() {
        final ConductorConfig config = ConductorConfig.defaults();
        assertEquals(config.clockPeriod(), Duration.ofMillis(10));
        assertEquals(config.timeLimit(), Duration.ofSeconds(10));
        assertEquals(config.blockedGracePeriod(), Duration.ofMillis(50));
        assertEquals(config.failureGracePeriod(), Duration.ofSeconds(1));
        assertEquals(config.deadlockDetections(), 100);
    }

    @Test
    void withersCopyAndLeaveTheOriginalUntouched() {
        final ConductorConfig defaults = ConductorConfig.defaults();
        final ConductorConfig tuned = defaults
                .withClockPeriod(Duration.ofMillis(1))
                .withTimeLimit(Duration.ofMillis(2))
                .withBlockedGracePeriod(Duration.ofMillis(3))
                .withFailureGracePeriod(Duration.ofMillis(4))
                .withDeadlockDetections(5);

        assertEquals(tuned.clockPeriod(), Duration.ofMillis(1));
        assertEquals(tuned.timeLimit(), Duration.ofMillis(2));
        assertEquals(tuned.blockedGracePeriod(), Duration.ofMillis(3));
        assertEquals(tuned.failureGracePeriod(), Duration.ofMillis(4));
        assertEquals(tuned.deadlockDetections(), 5);
        assertEquals(defaults.clockPeriod(), Duration.ofMillis(10));
        assertNotEquals(tuned, defaults);
    }

    @Test
    void equalConfigsShareHashCode() {
        final ConductorConfig a = ConductorConfig.defaults().withTimeLimit(Duration.ofSeconds(3));
        final ConductorConfig b = ConductorConfig.defaults().withTimeLimit(Duration.ofMillis(3000));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertTrue(a.toString().contains("timeLimit=PT3S"), a.toString());
    }

    @Test
    void nonPositiveValuesAreRejected() {
        final ConductorConfig config = ConductorConfig.defaults();
        expectThrows(IllegalArgumentException.class, () -> config.withClockPeriod(Duration.ZERO));
        expectThrows(IllegalArgumentException.class, () -> config.withTimeLimit(Duration.ofMillis(-1)));
        expectThrows(IllegalArgumentException.class, () -> config.withBlockedGracePeriod(Duration.ZERO));
        expectThrows(IllegalArgumentException.class, () -> config.withFailureGracePeriod(Duration.ZERO));
        expectThrows(IllegalArgumentException.class, () -> config.withDeadlockDetections(0));
    }

    @Test
    void conductorKeepsItsConfig() {
        final ConductorConfig config = ConductorConfig.defaults().withClockPeriod(Duration.ofMillis(2));
        assertSame(new Conductor(config).config(), config);
        assertSame(new Conductor().config(), ConductorConfig.defaults());
    }
}
