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
package de.synchrolib.exception;

// Thrown when automata are requested for a non-positive number of states or alphabet size.
public class InvalidArityException extends IllegalArgumentException {

    private final int states;
    private final int alphabetSize;

    /**
     * Constructor.
     *
     * @param states
     *         the requested number of states
     * @param alphabetSize
     *         the requested alphabet size
     */
    public InvalidArityException(int states, int alphabetSize) {
        super("Number of states and alphabet size must be > 0, got n=" + states + ", k=" + alphabetSize);
        this.states = states;
        this.alphabetSize = alphabetSize;
    }

    public int getStates() {
        return states;
    }

    public int getAlphabetSize() {
        return alphabetSize;
    }

}
