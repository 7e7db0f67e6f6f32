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

/**
 * Provides a conductor that pins the interleaving of a multi-threaded test to a shared logical clock of "beats", so
 * that tests of racy or blocking code produce reproducible orderings.
 * <br>
 * {@link org.sireum.conductor.Conductor} is the core API. {@link org.sireum.conductor.ConductorMethods} and
 * {@link org.sireum.conductor.ConductorFixture} integrate it with TestNG, and
 * {@link org.sireum.conductor.ConductorConfig} tunes its coordinator. All other public classes are handles, states,
 * or exceptions.
 */
package org.sireum.conductor;
