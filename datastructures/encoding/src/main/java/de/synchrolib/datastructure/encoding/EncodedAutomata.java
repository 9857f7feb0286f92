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
package de.synchrolib.datastructure.encoding;

import java.util.Collection;

import de.synchrolib.api.EncodedAutomaton;
import net.automatalib.automata.fsa.DFA;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.commons.util.mappings.Mapping;
import net.automatalib.words.Alphabet;
import net.automatalib.words.impl.Alphabets;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Conversions between {@link EncodedAutomaton encoded automata} and AutomataLib {@link DFA}s.
 * <p>
 * Encoded automata have no notion of acceptance or initial states. When converting to a {@link DFA}, state {@code 0}
 * (the distinguished sink of canonically enumerated automata) becomes the initial and only accepting state.
 */
public final class EncodedAutomata {

    private EncodedAutomata() {
        // prevent instantiation
    }

    /**
     * Returns the input alphabet {@code 0, ..., k - 1} of the given automaton.
     *
     * @param automaton
     *         the automaton
     *
     * @return the integer alphabet of the automaton
     */
    public static Alphabet<Integer> alphabetOf(EncodedAutomaton automaton) {
        return Alphabets.integers(0, automaton.getAlphabetSize() - 1);
    }

    /**
     * Builds a {@link CompactDFA} with the same transition structure as the given automaton. The state with index
     * {@code i} in the encoding is the {@code i}-th state of the returned DFA.
     *
     * @param automaton
     *         the automaton to convert
     *
     * @return a DFA over the alphabet {@link #alphabetOf(EncodedAutomaton)}
     */
    public static CompactDFA<Integer> toDFA(EncodedAutomaton automaton) {
        final int n = automaton.getStates();
        final int k = automaton.getAlphabetSize();
        final CompactDFA<Integer> dfa = new CompactDFA<>(alphabetOf(automaton));

        dfa.addInitialState(true);
        for (int s = 1; s < n; s++) {
            dfa.addState(false);
        }

        for (int s = 0; s < n; s++) {
            for (int a = 0; a < k; a++) {
                dfa.setTransition(s, a, automaton.getSuccessor(s, a));
            }
        }

        return dfa;
    }

    /**
     * Encodes a complete DFA. States are numbered by the given mapping, which must be a bijection onto
     * {@code 0, ..., dfa.size() - 1}.
     *
     * @param dfa
     *         the DFA to encode
     * @param alphabet
     *         the alphabet whose symbol indices become the encoded symbols
     * @param numbering
     *         the state numbering
     * @param <S>
     *         state type
     * @param <I>
     *         input symbol type
     *
     * @return the encoding of the DFA
     *
     * @throws IllegalArgumentException
     *         if the DFA is not complete with respect to the given alphabet
     */
    public static <S, I> EncodedAutomaton fromDFA(DFA<S, I> dfa,
                                                  Alphabet<I> alphabet,
                                                  Mapping<? super S, Integer> numbering) {
        final Collection<S> states = dfa.getStates();
        final int n = states.size();
        final int k = alphabet.size();
        final int[] table = new int[n * k];

        for (S state : states) {
            final int src = numbering.get(state);
            for (int a = 0; a < k; a++) {
                final I sym = alphabet.getSymbol(a);
                final @Nullable S succ = dfa.getSuccessor(state, sym);
                if (succ == null) {
                    throw new IllegalArgumentException("DFA is not complete: no transition for " + sym + " in state " +
                                                       state);
                }
                table[src * k + a] = numbering.get(succ);
            }
        }

        return EncodedAutomaton.of(n, k, table);
    }

    /**
     * Encodes a complete DFA, numbering its states by their {@link DFA#stateIDs() IDs}.
     *
     * @see #fromDFA(DFA, Alphabet, Mapping)
     */
    public static <S, I> EncodedAutomaton fromDFA(DFA<S, I> dfa, Alphabet<I> alphabet) {
        return fromDFA(dfa, alphabet, s -> dfa.stateIDs().getStateId(s));
    }
}
