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

import java.util.Arrays;

import com.google.common.base.Preconditions;
import de.synchrolib.exception.EncodingValidationException;
import de.synchrolib.exception.EncodingValidationException.Kind;
import de.synchrolib.exception.InvalidArityException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable, complete DFA over the states {@code 0, ..., n - 1} and the symbols {@code 0, ..., k - 1}, stored as a
 * flattened transition table.
 * <p>
 * Entries are laid out state-major, symbol-minor: the successor of state {@code s} under symbol {@code a} is stored at
 * index {@code s * k + a}. The serialized form lists these entries as decimal integers separated by single spaces.
 *
 * @see #serialize()
 * @see #parse(int, int, String)
 */
public final class EncodedAutomaton {

    private final int states;
    private final int alphabetSize;
    private final int[] transitions;
    private final String text;

    private EncodedAutomaton(int states, int alphabetSize, int[] transitions) {
        this.states = states;
        this.alphabetSize = alphabetSize;
        this.transitions = transitions;
        this.text = render(transitions);
    }

    /**
     * Creates an encoding from a flattened transition table and validates it by re-parsing its serialized form.
     *
     * @param states
     *         the number of states
     * @param alphabetSize
     *         the size of the input alphabet
     * @param transitions
     *         the flattened transition table (state-major, symbol-minor); the array is copied
     *
     * @return the validated encoding
     *
     * @throws InvalidArityException
     *         if {@code states} or {@code alphabetSize} is not positive
     * @throws EncodingValidationException
     *         if the table has the wrong size or contains a target outside of {@code [0, states - 1]}
     */
    public static EncodedAutomaton of(int states, int alphabetSize, int[] transitions) {
        checkArity(states, alphabetSize);
        EncodedAutomaton result = new EncodedAutomaton(states, alphabetSize, transitions.clone());
        result.validate();
        return result;
    }

    /**
     * Parses an encoding from its textual form. Tokens may be separated by arbitrary whitespace.
     *
     * @param states
     *         the number of states
     * @param alphabetSize
     *         the size of the input alphabet
     * @param text
     *         the encoded transition table
     *
     * @return the parsed encoding
     *
     * @throws InvalidArityException
     *         if {@code states} or {@code alphabetSize} is not positive
     * @throws EncodingValidationException
     *         if {@code text} does not hold exactly {@code states * alphabetSize} integers in range
     */
    public static EncodedAutomaton parse(int states, int alphabetSize, String text) {
        checkArity(states, alphabetSize);
        return new EncodedAutomaton(states, alphabetSize, tokenize(states, alphabetSize, text));
    }

    private static void checkArity(int states, int alphabetSize) {
        if (states <= 0 || alphabetSize <= 0) {
            throw new InvalidArityException(states, alphabetSize);
        }
    }

    private static int[] tokenize(int states, int alphabetSize, String text) {
        final int expected = states * alphabetSize;
        final String trimmed = text.trim();
        final String[] tokens = trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
        final int[] result = new int[expected];

        final int bound = Math.min(tokens.length, expected);
        for (int i = 0; i < bound; i++) {
            final int value;
            try {
                value = Integer.parseInt(tokens[i]);
            } catch (NumberFormatException nfe) {
                throw new EncodingValidationException(Kind.MALFORMED_COUNT, states, alphabetSize, i,
                                                      "Expected " + expected + " integers, found " + i + " (token '" +
                                                      tokens[i] + "' is not an integer)");
            }
            if (value < 0 || value >= states) {
                throw new EncodingValidationException(Kind.OUT_OF_RANGE, states, alphabetSize, i,
                                                      "Expected integer in range [0, " + (states - 1) + "], found " +
                                                      value + " at state " + (i / alphabetSize) + ", symbol " +
                                                      (i % alphabetSize));
            }
            result[i] = value;
        }

        if (tokens.length != expected) {
            throw new EncodingValidationException(Kind.MALFORMED_COUNT, states, alphabetSize, bound,
                                                  "Expected " + expected + " integers, found " + tokens.length);
        }

        return result;
    }

    private static String render(int[] transitions) {
        final StringBuilder sb = new StringBuilder(transitions.length * 2);
        for (int i = 0; i < transitions.length; i++) {
            if (i != 0) {
                sb.append(' ');
            }
            sb.append(transitions[i]);
        }
        return sb.toString();
    }

    /**
     * Re-tokenizes the serialized form of this encoding and checks it against the dimensions of the table.
     *
     * @throws EncodingValidationException
     *         if the serialized form is malformed
     */
    public void validate() {
        tokenize(states, alphabetSize, text);
    }

    /**
     * Returns the textual form of this encoding: all transition targets, state-major and symbol-minor, separated by
     * single spaces.
     *
     * @return the serialized transition table
     */
    public String serialize() {
        return text;
    }

    public int getStates() {
        return states;
    }

    public int getAlphabetSize() {
        return alphabetSize;
    }

    public int getSuccessor(int state, int symbol) {
        Preconditions.checkElementIndex(state, states, "state");
        Preconditions.checkElementIndex(symbol, alphabetSize, "symbol");
        return transitions[state * alphabetSize + symbol];
    }

    /**
     * Returns a copy of the flattened transition table.
     *
     * @return the transition targets, state-major and symbol-minor
     */
    public int[] toArray() {
        return transitions.clone();
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EncodedAutomaton)) {
            return false;
        }
        final EncodedAutomaton that = (EncodedAutomaton) o;
        return states == that.states && alphabetSize == that.alphabetSize &&
               Arrays.equals(transitions, that.transitions);
    }

    @Override
    public int hashCode() {
        int result = states;
        result = 31 * result + alphabetSize;
        result = 31 * result + Arrays.hashCode(transitions);
        return result;
    }

    @Override
    public String toString() {
        return text;
    }
}
