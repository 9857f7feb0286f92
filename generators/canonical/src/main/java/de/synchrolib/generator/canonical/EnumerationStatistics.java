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

import java.time.Duration;

/**
 * Counters collected during a single run of the {@link CanonicalEnumerator}.
 */
public final class EnumerationStatistics {

    private final int states;
    private final int alphabetSize;
    private final long accepted;
    private final long leaves;
    private final Duration elapsed;

    EnumerationStatistics(int states, int alphabetSize, long accepted, long leaves, Duration elapsed) {
        this.states = states;
        this.alphabetSize = alphabetSize;
        this.accepted = accepted;
        this.leaves = leaves;
        this.elapsed = elapsed;
    }

    public int getStates() {
        return states;
    }

    public int getAlphabetSize() {
        return alphabetSize;
    }

    /**
     * Returns the number of automata that have been handed to the consumer.
     *
     * @return the number of accepted automata
     */
    public long getAccepted() {
        return accepted;
    }

    /**
     * Returns the number of complete assignments the search has reached, accepted or not.
     *
     * @return the number of visited leaves
     */
    public long getLeaves() {
        return leaves;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        return "EnumerationStatistics{n=" + states + ", k=" + alphabetSize + ", accepted=" + accepted + ", leaves=" +
               leaves + ", elapsed=" + elapsed + '}';
    }
}
