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

import java.util.Arrays;

import de.synchrolib.api.EncodedAutomaton;

/**
 * The working transition table of a single enumeration. Cells that have not been decided yet hold {@link #UNSET}.
 */
final class SearchState {

    static final int UNSET = -1;

    private final int states;
    private final int alphabetSize;
    private final int[][] transitions;

    SearchState(int states, int alphabetSize) {
        this.states = states;
        this.alphabetSize = alphabetSize;
        this.transitions = new int[states][alphabetSize];
        for (int[] row : transitions) {
            Arrays.fill(row, UNSET);
        }
    }

    int getStates() {
        return states;
    }

    int getAlphabetSize() {
        return alphabetSize;
    }

    void assign(int state, int symbol, int target) {
        transitions[state][symbol] = target;
    }

    void unset(int state, int symbol) {
        transitions[state][symbol] = UNSET;
    }

    /**
     * Routes every symbol of state {@code 0} back to itself.
     */
    void fixSink() {
        Arrays.fill(transitions[0], 0);
    }

    /**
     * Checks whether one of the first {@code symbols} transitions of {@code state} leads to a smaller state.
     */
    boolean hasDownwardTransition(int state, int symbols) {
        for (int a = 0; a < symbols; a++) {
            final int target = transitions[state][a];
            if (target != UNSET && target < state) {
                return true;
            }
        }
        return false;
    }

    EncodedAutomaton snapshot() {
        final int[] flat = new int[states * alphabetSize];
        for (int s = 0; s < states; s++) {
            System.arraycopy(transitions[s], 0, flat, s * alphabetSize, alphabetSize);
        }
        return EncodedAutomaton.of(states, alphabetSize, flat);
    }
}
