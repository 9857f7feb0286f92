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
package de.synchrolib.api;

/**
 * An algorithm that contributes information about the shortest synchronizing word of an automaton.
 * <p>
 * Implementations must only tighten the given result, i.e. they may mark the automaton as non-synchronizing, raise
 * the lower bound, lower the upper bound or supply a synchronizing word that is no longer than the upper bound they
 * establish.
 */
public interface SynchroAlgorithm {

    /**
     * Returns the name under which runs of this algorithm are reported.
     *
     * @return the name of the algorithm
     */
    String getName();

    /**
     * Returns whether this algorithm can process the given automaton, e.g. with respect to size limits.
     *
     * @param automaton
     *         the automaton to analyze
     *
     * @return {@code true} if {@link #run(EncodedAutomaton, AlgoResult)} may be invoked on the automaton
     */
    default boolean isApplicable(EncodedAutomaton automaton) {
        return true;
    }

    /**
     * Analyzes the given automaton and tightens the given result accordingly.
     *
     * @param automaton
     *         the automaton to analyze
     * @param result
     *         the result to refine
     */
    void run(EncodedAutomaton automaton, AlgoResult result);
}
