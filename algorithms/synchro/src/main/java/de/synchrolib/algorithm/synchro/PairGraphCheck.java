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

import de.synchrolib.api.AlgoResult;
import de.synchrolib.api.EncodedAutomaton;
import de.synchrolib.api.SynchroAlgorithm;
import net.automatalib.words.Word;

/**
 * Decides synchronizability by checking that every pair of states can be merged.
 * <p>
 * For synchronizing automata, the longest shortest pair-merging word yields a lower bound and the cubic bound
 * {@code (n^3 - n) / 6} an upper bound on the length of a shortest synchronizing word.
 */
public class PairGraphCheck implements SynchroAlgorithm {

    public static final String NAME = "PairGraph";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void run(EncodedAutomaton automaton, AlgoResult result) {
        final int n = automaton.getStates();

        if (n == 1) {
            result.updateLowerBound(0);
            result.updateUpperBound(0);
            result.setWord(Word.epsilon());
            return;
        }

        final PairGraph graph = PairGraph.of(automaton);

        if (!graph.isSynchronizing()) {
            result.markNonSynchro();
            return;
        }

        result.updateLowerBound(graph.maxDistance());
        result.updateUpperBound(cubicBound(n));
    }

    static int cubicBound(int n) {
        final long bound = ((long) n * n * n - n) / 6;
        return (int) Math.min(bound, Integer.MAX_VALUE - 1);
    }
}
