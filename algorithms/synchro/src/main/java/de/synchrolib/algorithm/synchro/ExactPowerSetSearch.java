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

import com.google.common.base.Preconditions;
import de.synchrolib.api.AlgoResult;
import de.synchrolib.api.EncodedAutomaton;
import de.synchrolib.api.SynchroAlgorithm;
import net.automatalib.words.Word;
import net.automatalib.words.WordBuilder;

/**
 * Computes a shortest synchronizing word by a breadth-first search over the power-set automaton, from the full set of
 * states to the first singleton.
 * <p>
 * Memory grows with {@code 2^n}, so the search only applies to automata with at most {@link #getMaxStates()} states.
 */
public class ExactPowerSetSearch implements SynchroAlgorithm {

    public static final String NAME = "Exact";

    /**
     * The largest state count for which the search can be configured.
     */
    public static final int HARD_LIMIT = 20;

    private final int maxStates;

    public ExactPowerSetSearch(int maxStates) {
        Preconditions.checkArgument(maxStates >= 1 && maxStates <= HARD_LIMIT,
                                    "maxStates must be in [1, %s], got %s",
                                    HARD_LIMIT,
                                    maxStates);
        this.maxStates = maxStates;
    }

    public int getMaxStates() {
        return maxStates;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isApplicable(EncodedAutomaton automaton) {
        return automaton.getStates() <= maxStates;
    }

    @Override
    public void run(EncodedAutomaton automaton, AlgoResult result) {
        Preconditions.checkArgument(isApplicable(automaton),
                                    "Automaton has %s states, limit is %s",
                                    automaton.getStates(),
                                    maxStates);

        final int n = automaton.getStates();
        final int k = automaton.getAlphabetSize();
        final int full = (1 << n) - 1;

        // image of every single state as a bit mask, per symbol
        final int[][] successorBits = new int[k][n];
        for (int a = 0; a < k; a++) {
            for (int s = 0; s < n; s++) {
                successorBits[a][s] = 1 << automaton.getSuccessor(s, a);
            }
        }

        final int[] parent = new int[full + 1];
        final int[] symbol = new int[full + 1];
        Arrays.fill(parent, -1);
        parent[full] = full;

        final int[] queue = new int[full + 1];
        int head = 0;
        int tail = 0;
        queue[tail++] = full;

        int singleton = -1;
        while (head < tail && singleton < 0) {
            final int set = queue[head++];
            if (Integer.bitCount(set) == 1) {
                singleton = set;
                break;
            }
            for (int a = 0; a < k; a++) {
                final int image = image(set, successorBits[a]);
                if (parent[image] < 0) {
                    parent[image] = set;
                    symbol[image] = a;
                    queue[tail++] = image;
                }
            }
        }

        if (singleton < 0) {
            result.markNonSynchro();
            return;
        }

        final WordBuilder<Integer> builder = new WordBuilder<>();
        for (int set = singleton; set != full; set = parent[set]) {
            builder.append(symbol[set]);
        }
        builder.reverse();

        final Word<Integer> word = builder.toWord();
        result.updateLowerBound(word.length());
        result.updateUpperBound(word.length());
        result.setWord(word);
    }

    private static int image(int set, int[] successorBits) {
        int result = 0;
        int rest = set;
        while (rest != 0) {
            final int s = Integer.numberOfTrailingZeros(rest);
            result |= successorBits[s];
            rest &= rest - 1;
        }
        return result;
    }
}
