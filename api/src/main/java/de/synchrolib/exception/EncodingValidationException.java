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

/**
 * Thrown when the textual form of an encoded automaton does not describe a complete transition table.
 * <p>
 * The exception records the dimensions of the expected table as well as the position of the offending token, both as
 * a flat token index and as the {@code (state, symbol)} cell it would occupy.
 */
public class EncodingValidationException extends RuntimeException {

    /**
     * The ways in which an encoding can be malformed.
     */
    public enum Kind {
        /**
         * The encoding does not consist of exactly {@code n * k} integers.
         */
        MALFORMED_COUNT,
        /**
         * A transition target lies outside of {@code [0, n - 1]}.
         */
        OUT_OF_RANGE
    }

    private final Kind kind;
    private final int states;
    private final int alphabetSize;
    private final int tokenIndex;

    public EncodingValidationException(Kind kind, int states, int alphabetSize, int tokenIndex, String message) {
        super(message);
        this.kind = kind;
        this.states = states;
        this.alphabetSize = alphabetSize;
        this.tokenIndex = tokenIndex;
    }

    public Kind getKind() {
        return kind;
    }

    public int getStates() {
        return states;
    }

    public int getAlphabetSize() {
        return alphabetSize;
    }

    /**
     * Returns the index of the first offending token. For {@link Kind#MALFORMED_COUNT} this is the number of valid
     * integers that were found.
     *
     * @return the token index
     */
    public int getTokenIndex() {
        return tokenIndex;
    }

    /**
     * Returns the state whose row contains the offending token.
     *
     * @return the state index, may be {@code >= n} if the encoding had too many tokens
     */
    public int getState() {
        return tokenIndex / alphabetSize;
    }

    /**
     * Returns the symbol column of the offending token.
     *
     * @return the symbol index
     */
    public int getSymbol() {
        return tokenIndex % alphabetSize;
    }

}
