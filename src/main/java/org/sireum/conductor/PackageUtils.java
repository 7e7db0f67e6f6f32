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
import java.util.concurrent.Callable;

/**
 * This utility class exclusively contains static methods and fields for internal use.
 */
final class PackageUtils {

    /**
     * Prefix shared by every system property that tunes a {@link ConductorConfig}.
     */
    static final String PROPERTY_PREFIX = "org.sireum.conductor.";

    /**
     * Prefix of the name given to threads registered without an explicit name. The registration index is appended.
     */
    static final String DEFAULT_THREAD_NAME_PREFIX = "Conductor-Thread-";

    /**
     * This is a utility class and cannot be instantiated.
     */
    private PackageUtils() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * Reads a millisecond {@link Duration} from the system property {@code PROPERTY_PREFIX + key}.
     *
     * @param key the property name without {@link PackageUtils#PROPERTY_PREFIX}
     * @param defaultMillis value used when the property is absent or unparsable
     * @return the configured duration
     */
    @NotNull
    static Duration durationProperty(@NotNull String key, long defaultMillis) {
        return Duration.ofMillis(Long.getLong(PROPERTY_PREFIX + key, defaultMillis));
    }

    /**
     * Reads an int from the system property {@code PROPERTY_PREFIX + key}.
     *
     * @param key the property name without {@link PackageUtils#PROPERTY_PREFIX}
     * @param defaultValue value used when the property is absent or unparsable
     * @return the configured value
     */
    static int intProperty(@NotNull String key, int defaultValue) {
        return Integer.getInteger(PROPERTY_PREFIX + key, defaultValue);
    }

    /**
     * Rethrows an unchecked throwable as-is so its identity and stack trace survive the trip to the test's thread.
     * Checked exceptions are wrapped once in a {@link ConductedThreadException}.
     *
     * @param throwable the failure to rethrow
     * @return never returns normally, declared so callers can write {@code throw propagate(t)}
     */
    @NotNull
    static RuntimeException propagate(@NotNull Throwable throwable) {
        if (throwable instanceof Error) {
            throw (Error) throwable;
        }
        if (throwable instanceof RuntimeException) {
            throw (RuntimeException) throwable;
        }
        throw new ConductedThreadException(throwable);
    }

    /**
     * Evaluates a {@link Callable}, propagating any failure with {@link PackageUtils#propagate(Throwable)}.
     */
    static <T> T call(@NotNull Callable<T> callable) {
        try {
            return callable.call();
        } catch (Exception e) {
            throw propagate(e);
        }
    }

    /**
     * Runs a {@link ThreadBody}, propagating any failure with {@link PackageUtils#propagate(Throwable)}.
     */
    static void run(@NotNull ThreadBody body) {
        try {
            body.run();
        } catch (Exception e) {
            throw propagate(e);
        }
    }

    /**
     * Validates that a configured duration is strictly positive.
     *
     * @param duration the duration to validate
     * @param what a short description used in the error message
     * @return the same duration
     * @throws IllegalArgumentException if the duration is zero or negative
     */
    @NotNull
    static Duration requirePositive(@NotNull Duration duration, @NotNull String what) {
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(what + " must be positive but was " + duration);
        }
        return duration;
    }
}
