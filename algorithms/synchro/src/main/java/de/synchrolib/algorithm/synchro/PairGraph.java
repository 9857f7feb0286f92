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
package de.synchrolib.algorithm.synchro;

import java.util.Arrays;

import de.synchrolib.api.EncodedAutomaton;
import net.automatalib.words.Word;
import net.automatalib.words.WordBuilder;

/**
 * Shortest merging words for all unordered pairs of states of an automaton.
 * <p>
 * A word merges a pair {@code {p, q}} if it leads both states to the same state. Distances are computed by a
 * breadth-first search over the inverted pair automaton, starting from the pairs that are merged by a single symbol.
 * For every mergeable pair, the first symbol of one of its shortest merging words is stored, so that the full word
 * can be reconstructed by following the transitions of the automaton.
 */
final class PairGraph {

    static final int UNREACHABLE = -1;

    private final EncodedAutomaton automaton;
    private final int[] distance;
    private final int[] firstSymbol;

    private PairGraph(EncodedAutomaton automaton, int[] distance, int[] firstSymbol) {
        this.automaton = automaton;
        this.distance = distance;
        this.firstSymbol = firstSymbol;
    }

    static PairGraph of(EncodedAutomaton automaton) {
        final int n = automaton.getStates();
        final int k = automaton.getAlphabetSize();
        final int pairs = n * (n - 1) / 2;

        final int[] distance = new int[pairs];
        final int[] firstSymbol = new int[pairs];
        Arrays.fill(distance, UNREACHABLE);

        // inverted edges in compressed form: for every pair, the pairs (and symbols) leading to it
        final int[] inDegree = new int[pairs + 1];
        final int[] queue = new int[pairs];
        int tail = 0;

        for (int q = 1; q < n; q++) {
            for (int p = 0; p < q; p++) {
                final int pair = index(p, q);
                for (int a = 0; a < k; a++) {
                    final int ps = automaton.getSuccessor(p, a);
                    final int qs = automaton.getSuccessor(q, a);
                    if (ps == qs) {
                        if (distance[pair] == UNREACHABLE) {
                            distance[pair] = 1;
                            firstSymbol[pair] = a;
                            queue[tail++] = pair;
                        }
                    } else {
                        inDegree[index(ps, qs) + 1]++;
                    }
                }
            }
        }

        for (int i = 0; i < pairs; i++) {
            inDegree[i + 1] += inDegree[i];
        }

        final int[] offsets = inDegree.clone();
        final int[] sources = new int[inDegree[pairs]];
        final int[] symbols = new int[inDegree[pairs]];

        for (int q = 1; q < n; q++) {
            for (int p = 0; p < q; p++) {
                for (int a = 0; a < k; a++) {
                    final int ps = automaton.getSuccessor(p, a);
                    final int qs = automaton.getSuccessor(q, a);
                    if (ps != qs) {
                        final int slot = offsets[index(ps, qs)]++;
                        sources[slot] = index(p, q);
                        symbols[slot] = a;
                    }
                }
            }
        }

        int head = 0;
        while (head < tail) {
            final int pair = queue[head++];
            for (int e = inDegree[pair]; e < inDegree[pair + 1]; e++) {
                final int source = sources[e];
                if (distance[source] == UNREACHABLE) {
                    distance[source] = distance[pair] + 1;
                    firstSymbol[source] = symbols[e];
                    queue[tail++] = source;
                }
            }
        }

        return new PairGraph(automaton, distance, firstSymbol);
    }

    private static int index(int p, int q) {
        if (p > q) {
            return q + p * (p - 1) / 2;
        }
        return p + q * (q - 1) / 2;
    }

    /**
     * Returns the length of a shortest word merging the given states.
     *
     * @return the distance, {@code 0} if {@code p == q}, or {@link #UNREACHABLE} if the states cannot be merged
     */
    int distance(int p, int q) {
        if (p == q) {
            return 0;
        }
        return distance[index(p, q)];
    }

    /**
     * Returns whether every pair of states can be merged, which is the case iff the automaton is synchronizing.
     */
    boolean isSynchronizing() {
        for (int d : distance) {
            if (d == UNREACHABLE) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the largest distance over all pairs. Any synchronizing word merges every pair, so this is a lower bound
     * on the length of a shortest synchronizing word.
     */
    int maxDistance() {
        int max = 0;
        for (int d : distance) {
            max = Math.max(max, d);
        }
        return max;
    }

    /**
     * Returns a shortest word merging the given states.
     *
     * @throws IllegalArgumentException
     *         if the states cannot be merged
     */
    Word<Integer> mergingWord(int p, int q) {
        if (distance(p, q) == UNREACHABLE) {
            throw new IllegalArgumentException("States " + p + " and " + q + " cannot be merged");
        }

        final WordBuilder<Integer> builder = new WordBuilder<>(distance(p, q));
        int s = p;
        int t = q;
        while (s != t) {
            final int a = firstSymbol[index(s, t)];
            builder.append(a);
            s = automaton.getSuccessor(s, a);
            t = automaton.getSuccessor(t, a);
        }
        return builder.toWord();
    }
}
