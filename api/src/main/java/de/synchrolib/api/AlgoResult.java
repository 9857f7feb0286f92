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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import net.automatalib.commons.util.Pair;
import net.automatalib.words.Word;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The outcome of analyzing a single automaton: whether it synchronizes and, if it does, the best known bounds on the
 * length of its shortest synchronizing word.
 * <p>
 * Algorithms only ever tighten a result: the lower bound can only grow, the upper bound can only shrink. The bounds
 * are meaningless if {@link #isNonSynchro()} returns {@code true}.
 */
public final class AlgoResult {

    /**
     * Placeholder for an upper bound that no algorithm has established yet.
     */
    public static final int UNKNOWN_UPPER_BOUND = Integer.MAX_VALUE;

    private boolean nonSynchro;
    private int mlswLowerBound;
    private int mlswUpperBound = UNKNOWN_UPPER_BOUND;
    private @Nullable Word<Integer> word;
    private final List<Pair<String, Double>> algorithmsRun = new ArrayList<>();

    public static AlgoResult nonSynchronizing() {
        final AlgoResult result = new AlgoResult();
        result.markNonSynchro();
        return result;
    }

    public static AlgoResult bounded(int lowerBound, int upperBound) {
        final AlgoResult result = new AlgoResult();
        result.updateLowerBound(lowerBound);
        result.updateUpperBound(upperBound);
        return result;
    }

    public boolean isNonSynchro() {
        return nonSynchro;
    }

    public void markNonSynchro() {
        this.nonSynchro = true;
    }

    public int getMlswLowerBound() {
        return mlswLowerBound;
    }

    public int getMlswUpperBound() {
        return mlswUpperBound;
    }

    /**
     * Raises the lower bound to the given value, if it is larger than the current one.
     *
     * @param lowerBound
     *         a proven lower bound
     */
    public void updateLowerBound(int lowerBound) {
        this.mlswLowerBound = Math.max(this.mlswLowerBound, lowerBound);
    }

    /**
     * Lowers the upper bound to the given value, if it is smaller than the current one.
     *
     * @param upperBound
     *         a proven upper bound
     */
    public void updateUpperBound(int upperBound) {
        this.mlswUpperBound = Math.min(this.mlswUpperBound, upperBound);
    }

    /**
     * Returns whether both bounds coincide, i.e. the length of a shortest synchronizing word is known.
     *
     * @return {@code true} if the bounds are tight
     */
    public boolean isExact() {
        return !nonSynchro && mlswLowerBound == mlswUpperBound;
    }

    public @Nullable Word<Integer> getWord() {
        return word;
    }

    public void setWord(@Nullable Word<Integer> word) {
        this.word = word;
    }

    public List<Pair<String, Double>> getAlgorithmsRun() {
        return Collections.unmodifiableList(algorithmsRun);
    }

    /**
     * Records that an algorithm has been applied to the automaton.
     *
     * @param name
     *         the name of the algorithm
     * @param seconds
     *         the time spent in the algorithm
     */
    public void addAlgorithmRun(String name, double seconds) {
        algorithmsRun.add(Pair.of(name, seconds));
    }

    @Override
    public String toString() {
        if (nonSynchro) {
            return "NON SYNCHRO";
        }
        return "[" + mlswLowerBound + ", " + mlswUpperBound + "]";
    }
}
