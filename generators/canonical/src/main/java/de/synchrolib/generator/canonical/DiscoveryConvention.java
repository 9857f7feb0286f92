/* Copyright (C) 2024-2026 SynchroLib contributors
 * This file is part of SynchroLib.
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
package de.synchrolib.generator.canonical;

/**
 * Determines how many states count as discovered once the sink row of state {@code 0} has been fixed.
 */
public enum DiscoveryConvention {

    /**
     * Only the sink is discovered. State {@code 1} must be introduced by a transition like every other state, so
     * that every accepted automaton references all of its states.
     */
    STRICT(1),

    /**
     * The sink and state {@code 1} are discovered. This is the numbering used for corpora generated with the mortality
     * threshold for {@code n - 1} states: the requested state count includes the sink, and state {@code 1} may remain
     * unreferenced. With this convention a single-state request yields no automata.
     */
    LEGACY(2);

    private final int seenAfterSink;

    DiscoveryConvention(int seenAfterSink) {
        this.seenAfterSink = seenAfterSink;
    }

    /**
     * Returns the discovery counter at the start of the search of state {@code 1}.
     *
     * @return the number of states considered discovered after the sink row
     */
    public int getSeenAfterSink() {
        return seenAfterSink;
    }
}
