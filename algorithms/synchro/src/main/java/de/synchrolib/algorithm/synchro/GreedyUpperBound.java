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

import de.synchrolib.api.AlgoResult;
import de.synchrolib.api.EncodedAutomaton;
import de.synchrolib.api.SynchroAlgorithm;
import net.automatalib.words.Word;
import net.automatalib.words.WordBuilder;

/**
 * Eppstein's greedy algorithm: starting with the full set of states, repeatedly apply a shortest word that merges some
 * pair of the current set until a single state remains. The concatenation of these words synchronizes the automaton.
 */
public class GreedyUpperBound implements SynchroAlgorithm {

    public static final String NAME = "Greedy";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void run(EncodedAutomaton automaton, AlgoResult result) {
        final int n = automaton.getStates();
        final PairGraph graph = PairGraph.of(automaton);

        if (!graph.isSynchronizing()) {
            result.markNonSynchro();
            return;
        }

        final boolean[] current = new boolean[n];
        Arrays.fill(current, true);
        int size = n;

        final WordBuilder<Integer> builder = new WordBuilder<>();

        while (size > 1) {
            int bestP = -1;
            int bestQ = -1;
            int bestDistance = Integer.MAX_VALUE;
            for (int q = 1; q < n; q++) {
                if (!current[q]) {
                    continue;
                }
                for (int p = 0; p < q; p++) {
                    if (current[p] && graph.distance(p, q) < bestDistance) {
                        bestDistance = graph.distance(p, q);
                        bestP = p;
                        bestQ = q;
                    }
                }
            }

            final Word<Integer> merging = graph.mergingWord(bestP, bestQ);
            builder.append(merging);

            final boolean[] image = new boolean[n];
            size = 0;
            for (int s = 0; s < n; s++) {
                if (current[s]) {
                    final int target = apply(automaton, s, merging);
                    if (!image[target]) {
                        image[target] = true;
                        size++;
                    }
                }
            }
            System.arraycopy(image, 0, current, 0, n);
        }

        final Word<Integer> word = builder.toWord();
        result.updateUpperBound(word.length());
        final Word<Integer> known = result.getWord();
        if (known == null || known.length() > word.length()) {
            result.setWord(word);
        }
    }

    static int apply(EncodedAutomaton automaton, int state, Word<Integer> word) {
        int s = state;
        for (Integer a : word) {
            s = automaton.getSuccessor(s, a);
        }
        return s;
    }
}
