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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Stopwatch;
import de.synchrolib.api.AlgoResult;
import de.synchrolib.api.EncodedAutomaton;
import de.synchrolib.api.SynchroAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a sequence of {@link SynchroAlgorithm}s on an automaton and collects their findings in a single
 * {@link AlgoResult}.
 * <p>
 * Algorithms are run in order. The pipeline stops as soon as the automaton is known to be non-synchronizing or the
 * bounds coincide (and, if words are kept, a witness has been found). Algorithms that are not applicable to an automaton are skipped and not reported as run.
 */
public class AlgorithmPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(AlgorithmPipeline.class);

    /**
     * Default state limit of the exact search.
     */
    public static final int DEFAULT_EXACT_MAX_STATES = 16;

    private final List<SynchroAlgorithm> algorithms;
    private final boolean keepWord;

    /**
     * Constructor.
     *
     * @param algorithms
     *         the algorithms to run, in order
     * @param keepWord
     *         whether synchronizing words found by the algorithms are kept in the results
     */
    public AlgorithmPipeline(List<? extends SynchroAlgorithm> algorithms, boolean keepWord) {
        this.algorithms = Collections.unmodifiableList(new ArrayList<>(algorithms));
        this.keepWord = keepWord;
    }

    /**
     * Creates the default pipeline: pair graph check, greedy upper bound and exact search.
     *
     * @param exactMaxStates
     *         the state limit of the exact search
     * @param keepWord
     *         whether synchronizing words are kept in the results
     *
     * @return the pipeline
     */
    public static AlgorithmPipeline defaults(int exactMaxStates, boolean keepWord) {
        return of(Arrays.asList(PairGraphCheck.NAME, GreedyUpperBound.NAME, ExactPowerSetSearch.NAME),
                  exactMaxStates,
                  keepWord);
    }

    /**
     * Creates a pipeline from algorithm names. The pair graph check always runs first, since the bounds of the other
     * algorithms are only meaningful for synchronizing automata.
     *
     * @param names
     *         the names of the algorithms, see the {@code NAME} constants of the implementations
     * @param exactMaxStates
     *         the state limit of the exact search
     * @param keepWord
     *         whether synchronizing words are kept in the results
     *
     * @return the pipeline
     *
     * @throws IllegalArgumentException
     *         if a name is unknown
     */
    public static AlgorithmPipeline of(List<String> names, int exactMaxStates, boolean keepWord) {
        final List<SynchroAlgorithm> algorithms = new ArrayList<>(names.size() + 1);
        algorithms.add(new PairGraphCheck());

        for (String name : names) {
            switch (name) {
                case PairGraphCheck.NAME:
                    break;
                case GreedyUpperBound.NAME:
                    algorithms.add(new GreedyUpperBound());
                    break;
                case ExactPowerSetSearch.NAME:
                    algorithms.add(new ExactPowerSetSearch(exactMaxStates));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown algorithm '" + name + "', expected one of " +
                                                       Arrays.asList(PairGraphCheck.NAME,
                                                               GreedyUpperBound.NAME,
                                                               ExactPowerSetSearch.NAME));
            }
        }

        return new AlgorithmPipeline(algorithms, keepWord);
    }

    public List<SynchroAlgorithm> getAlgorithms() {
        return algorithms;
    }

    public boolean isKeepWord() {
        return keepWord;
    }

    /**
     * Analyzes the given automaton.
     *
     * @param automaton
     *         the automaton to analyze
     *
     * @return the combined result of all algorithms that have been run
     */
    public AlgoResult analyze(EncodedAutomaton automaton) {
        final AlgoResult result = new AlgoResult();

        for (SynchroAlgorithm algorithm : algorithms) {
            if (!algorithm.isApplicable(automaton)) {
                LOGGER.debug("Skipping {} for automaton with {} states", algorithm.getName(), automaton.getStates());
                continue;
            }

            final Stopwatch stopwatch = Stopwatch.createStarted();
            algorithm.run(automaton, result);
            result.addAlgorithmRun(algorithm.getName(), stopwatch.elapsed(TimeUnit.NANOSECONDS) / 1e9);

            if (isSettled(result)) {
                break;
            }
        }

        if (!keepWord) {
            result.setWord(null);
        }

        LOGGER.debug("{}: {}", automaton, result);
        return result;
    }

    private boolean isSettled(AlgoResult result) {
        if (result.isNonSynchro()) {
            return true;
        }
        return result.isExact() && (!keepWord || result.getWord() != null);
    }
}
