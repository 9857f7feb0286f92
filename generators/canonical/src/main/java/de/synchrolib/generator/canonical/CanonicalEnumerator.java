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
package de.synchrolib.generator.canonical;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import com.google.common.base.Stopwatch;
import de.synchrolib.api.EncodedAutomaton;
import de.synchrolib.exception.EncodingValidationException;
import de.synchrolib.exception.InvalidArityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumerates all complete DFAs with {@code n} states over {@code k} symbols in BFS-canonical form, each exactly once.
 * <p>
 * The transition table is filled row by row (state-major, symbol-minor) by a depth-first search. States are numbered
 * in the order in which they are first referenced as a transition target: a cell may point to any state that has
 * already been discovered, or to the next undiscovered one, but never skip ahead. Since only this numbering can be
 * produced, no two enumerated tables describe the same automaton up to relabeling.
 * <p>
 * In addition, the search applies two domain-specific restrictions:
 * <ul>
 * <li>State {@code 0} is a sink: all of its transitions lead back to itself.</li>
 * <li>Every other state {@code s} has a transition to some state {@code < s}. If none of the first {@code k - 1}
 * symbols of {@code s} goes down, the targets of the last symbol are capped at {@code s - 1}.</li>
 * </ul>
 * A complete table is accepted only if all {@code n} states have been discovered.
 * <p>
 * Enumerators are stateless and may be shared, each call uses its own working table.
 */
public class CanonicalEnumerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(CanonicalEnumerator.class);

    private final DiscoveryConvention convention;

    public CanonicalEnumerator() {
        this(DiscoveryConvention.STRICT);
    }

    public CanonicalEnumerator(DiscoveryConvention convention) {
        this.convention = convention;
    }

    public DiscoveryConvention getConvention() {
        return convention;
    }

    /**
     * Collects all canonical automata with the given dimensions.
     *
     * @param states
     *         the number of states, including the sink
     * @param alphabetSize
     *         the size of the input alphabet
     *
     * @return the accepted automata in discovery order
     *
     * @throws InvalidArityException
     *         if {@code states} or {@code alphabetSize} is not positive
     */
    public List<EncodedAutomaton> enumerate(int states, int alphabetSize) {
        final List<EncodedAutomaton> result = new ArrayList<>();
        enumerate(states, alphabetSize, result::add);
        return result;
    }

    /**
     * Passes all canonical automata with the given dimensions to the given consumer, in discovery order.
     *
     * @param states
     *         the number of states, including the sink
     * @param alphabetSize
     *         the size of the input alphabet
     * @param consumer
     *         the receiver of the accepted automata
     *
     * @return the statistics of the run
     *
     * @throws InvalidArityException
     *         if {@code states} or {@code alphabetSize} is not positive
     */
    public EnumerationStatistics enumerate(int states,
                                           int alphabetSize,
                                           Consumer<? super EncodedAutomaton> consumer) {
        if (states <= 0 || alphabetSize <= 0) {
            throw new InvalidArityException(states, alphabetSize);
        }

        final Search search = new Search(new SearchState(states, alphabetSize), consumer);
        final Stopwatch stopwatch = Stopwatch.createStarted();
        search.run(convention.getSeenAfterSink());
        stopwatch.stop();

        final EnumerationStatistics statistics = new EnumerationStatistics(states,
                                                                           alphabetSize,
                                                                           search.accepted,
                                                                           search.leaves,
                                                                           stopwatch.elapsed());

        LOGGER.info("Generated {} automata with n={}, k={} ({} convention)",
                    statistics.getAccepted(),
                    states,
                    alphabetSize,
                    convention);
        LOGGER.info("Total enumerated (canonical under BFS): {} leaves", statistics.getLeaves());
        LOGGER.info("Total runtime: {} seconds",
                    String.format(Locale.ROOT, "%.6f", stopwatch.elapsed(TimeUnit.NANOSECONDS) / 1e9));

        return statistics;
    }

    private static final class Search {

        private final SearchState table;
        private final Consumer<? super EncodedAutomaton> consumer;
        private final int n;
        private final int k;

        private long accepted;
        private long leaves;

        Search(SearchState table, Consumer<? super EncodedAutomaton> consumer) {
            this.table = table;
            this.consumer = consumer;
            this.n = table.getStates();
            this.k = table.getAlphabetSize();
        }

        void run(int seenAfterSink) {
            table.fixSink();
            search(1, 0, seenAfterSink);
        }

        private void search(int stateIdx, int symIdx, int seen) {
            if (stateIdx == n) {
                leaves++;
                if (seen == n) {
                    accept();
                }
                return;
            }

            if (symIdx == k) {
                search(stateIdx + 1, 0, seen);
                return;
            }

            int maxTarget = Math.min(seen, n - 1);
            if (symIdx == k - 1 && !table.hasDownwardTransition(stateIdx, symIdx)) {
                maxTarget = Math.min(maxTarget, stateIdx - 1);
            }

            for (int target = 0; target <= maxTarget; target++) {
                final int introduced = (target == seen && seen < n) ? 1 : 0;
                table.assign(stateIdx, symIdx, target);
                search(stateIdx, symIdx + 1, seen + introduced);
            }

            table.unset(stateIdx, symIdx);
        }

        private void accept() {
            final EncodedAutomaton automaton;
            try {
                automaton = table.snapshot();
            } catch (EncodingValidationException e) {
                throw new IllegalStateException("Generated an invalid encoding for n=" + n + ", k=" + k +
                                                " at state " + e.getState() + ", symbol " + e.getSymbol(), e);
            }
            accepted++;
            consumer.accept(automaton);
        }
    }
}
