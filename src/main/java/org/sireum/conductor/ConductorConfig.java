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

import java.time.Duration;
import java.util.Objects;

import static org.sireum.conductor.PackageUtils.durationProperty;
import static org.sireum.conductor.PackageUtils.intProperty;
import static org.sireum.conductor.PackageUtils.requirePositive;

/**
 * Immutable tuning parameters of a {@link Conductor}'s coordinator loop. Each {@code with*} method returns a copy.
 * <br>
 * Default values are read once from system properties (all prefixed with {@code org.sireum.conductor.}):
 * <ul>
 *     <li>{@code clock-period-ms} (10): how long the coordinator sleeps between two samples of the threads</li>
 *     <li>{@code time-limit-ms} (10000): total wall-clock budget of one conducted test</li>
 *     <li>{@code blocked-grace-ms} (50): how long a thread must stay blocked on something other than a beat before
 *     the clock may advance past it</li>
 *     <li>{@code failure-grace-ms} (1000): how long live threads may finish on their own once a failure was seen,
 *     before they are interrupted</li>
 *     <li>{@code deadlock-detections} (100): consecutive samples in which every live thread sits in an untimed wait
 *     before the test is reported as deadlocked</li>
 * </ul>
 * None of these values is a correctness contract. On a heavily loaded host a too-short grace period may advance the
 * clock past a thread that was merely slow.
 */
public final class ConductorConfig {

    private static final ConductorConfig DEFAULTS = new ConductorConfig(
            durationProperty("clock-period-ms", 10L),
            durationProperty("time-limit-ms", 10_000L),
            durationProperty("blocked-grace-ms", 50L),
            durationProperty("failure-grace-ms", 1_000L),
            intProperty("deadlock-detections", 100));

    private final Duration clockPeriod;
    private final Duration timeLimit;
    private final Duration blockedGracePeriod;
    private final Duration failureGracePeriod;
    private final int deadlockDetections;

    private ConductorConfig(Duration clockPeriod,
                            Duration timeLimit,
                            Duration blockedGracePeriod,
                            Duration failureGracePeriod,
                            int deadlockDetections) {
        this.clockPeriod = requirePositive(clockPeriod, "clockPeriod");
        this.timeLimit = requirePositive(timeLimit, "timeLimit");
        this.blockedGracePeriod = requirePositive(blockedGracePeriod, "blockedGracePeriod");
        this.failureGracePeriod = requirePositive(failureGracePeriod, "failureGracePeriod");
        if (deadlockDetections < 1) {
            throw new IllegalArgumentException("deadlockDetections must be positive but was " + deadlockDetections);
        }
        this.deadlockDetections = deadlockDetections;
    }

    /**
     * @return the configuration built from system properties (or their built-in defaults)
     */
    @NotNull
    public static ConductorConfig defaults() {
        return DEFAULTS;
    }

    @NotNull
    public Duration clockPeriod() {
        return clockPeriod;
    }

    @NotNull
    public Duration timeLimit() {
        return timeLimit;
    }

    @NotNull
    public Duration blockedGracePeriod() {
        return blockedGracePeriod;
    }

    @NotNull
    public Duration failureGracePeriod() {
        return failureGracePeriod;
    }

    public int deadlockDetections() {
        return deadlockDetections;
    }

    @NotNull
    public ConductorConfig withClockPeriod(@NotNull Duration clockPeriod) {
        return new ConductorConfig(clockPeriod, timeLimit, blockedGracePeriod, failureGracePeriod, deadlockDetections);
    }

    @NotNull
    public ConductorConfig withTimeLimit(@NotNull Duration timeLimit) {
        return new ConductorConfig(clockPeriod, timeLimit, blockedGracePeriod, failureGracePeriod, deadlockDetections);
    }

    @NotNull
    public ConductorConfig withBlockedGracePeriod(@NotNull Duration blockedGracePeriod) {
        return new ConductorConfig(clockPeriod, timeLimit, blockedGracePeriod, failureGracePeriod, deadlockDetections);
    }

    @NotNull
    public ConductorConfig withFailureGracePeriod(@NotNull Duration failureGracePeriod) {
        return new ConductorConfig(clockPeriod, timeLimit, blockedGracePeriod, failureGracePeriod, deadlockDetections);
    }

    @NotNull
    public ConductorConfig withDeadlockDetections(int deadlockDetections) {
        return new ConductorConfig(clockPeriod, timeLimit, blockedGracePeriod, failureGracePeriod, deadlockDetections);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConductorConfig)) {
            return false;
        }
        final ConductorConfig that = (ConductorConfig) o;
        return deadlockDetections == that.deadlockDetections
                && clockPeriod.equals(that.clockPeriod)
                && timeLimit.equals(that.timeLimit)
                && blockedGracePeriod.equals(that.blockedGracePeriod)
                && failureGracePeriod.equals(that.failureGracePeriod);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clockPeriod, timeLimit, blockedGracePeriod, failureGracePeriod, deadlockDetections);
    }

    @Override
    public String toString() {
        return "ConductorConfig{" +
                "clockPeriod=" + clockPeriod +
                ", timeLimit=" + timeLimit +
                ", blockedGracePeriod=" + blockedGracePeriod +
                ", failureGracePeriod=" + failureGracePeriod +
                ", deadlockDetections=" + deadlockDetections +
                '}';
    }
}
