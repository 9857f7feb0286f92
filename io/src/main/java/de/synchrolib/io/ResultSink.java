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
package de.synchrolib.io;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;

import de.synchrolib.api.AlgoResult;
import net.automatalib.commons.util.Pair;
import net.automatalib.words.Word;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives the analysis results of a run, writes them to an {@link OutputDestination} and keeps the run-wide maxima
 * of the lower and upper bounds. The maxima only cover results written to a detailed destination; a summary-only sink
 * reports {@code [0, 0]}.
 * <p>
 * Detailed lines have the form {@code <index>: NON SYNCHRO} or
 * {@code <index>: [<lower>, <upper>] ((<algorithm>, <seconds>), ...) {<word>}}, where the word block is only present
 * if the result carries a synchronizing word.
 * <p>
 * This class is <b>not</b> thread-safe. Results of parallel analyses must be pushed one at a time.
 */
public class ResultSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResultSink.class);

    private OutputDestination output;
    private final PrintStream report;

    private int minMax;
    private int maxMax;

    public ResultSink() {
        this(OutputDestination.summaryOnly());
    }

    public ResultSink(OutputDestination output) {
        this(output, System.out);
    }

    /**
     * Constructor.
     *
     * @param output
     *         the destination of the detailed per-automaton lines
     * @param report
     *         the stream receiving the summary of the run
     */
    public ResultSink(OutputDestination output, PrintStream report) {
        this.output = output;
        this.report = report;
    }

    public OutputDestination getOutput() {
        return output;
    }

    public void setOutput(OutputDestination output) {
        this.output = output;
    }

    /**
     * Records the result for the automaton with the given index.
     *
     * @param result
     *         the analysis result
     * @param index
     *         the index of the automaton within the run
     *
     * @throws UncheckedIOException
     *         if the line cannot be written to the destination
     */
    public void pushResult(AlgoResult result, long index) {
        final @Nullable Word<Integer> word = result.getWord();

        if (!output.isDetailed()) {
            if (word != null) {
                LOGGER.info("Found synchronizing word of length {} (use the -o flag to save it)", word.length());
            }
            return;
        }

        if (!result.isNonSynchro()) {
            minMax = Math.max(minMax, result.getMlswLowerBound());
            maxMax = Math.max(maxMax, result.getMlswUpperBound());
        }

        if (word != null && !result.isNonSynchro()) {
            LOGGER.info("Saving synchronizing word of length {}", word.length());
        }

        try {
            output.writeLine(formatLine(result, index));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write result " + index, e);
        }
    }

    /**
     * Formats the detailed line for a result.
     *
     * @param result
     *         the analysis result
     * @param index
     *         the index of the automaton within the run
     *
     * @return the line, without a trailing line break
     */
    public static String formatLine(AlgoResult result, long index) {
        final StringBuilder sb = new StringBuilder();
        sb.append(index).append(": ");

        if (result.isNonSynchro()) {
            return sb.append("NON SYNCHRO").toString();
        }

        sb.append('[').append(result.getMlswLowerBound()).append(", ").append(result.getMlswUpperBound()).append(']');

        sb.append(" (");
        final List<Pair<String, Double>> runs = result.getAlgorithmsRun();
        for (int i = 0; i < runs.size(); i++) {
            if (i != 0) {
                sb.append(", ");
            }
            final Pair<String, Double> run = runs.get(i);
            sb.append('(').append(run.getFirst()).append(", ").append(formatSeconds(run.getSecond())).append(')');
        }
        sb.append(')');

        final @Nullable Word<Integer> word = result.getWord();
        if (word != null) {
            sb.append(" {");
            for (int i = 0; i < word.length(); i++) {
                if (i != 0) {
                    sb.append(' ');
                }
                sb.append(word.getSymbol(i));
            }
            sb.append('}');
        }

        return sb.toString();
    }

    private static String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.6f", seconds);
    }

    public int getMinMax() {
        return minMax;
    }

    public int getMaxMax() {
        return maxMax;
    }

    /**
     * Returns the run-wide maxima of the lower and upper bounds.
     *
     * @return the summary in the form {@code [<minMax>, <maxMax>]}
     */
    public String getSummary() {
        return "[" + minMax + ", " + maxMax + "]";
    }

    /**
     * Writes the {@link #getSummary() summary} of the run to the report stream.
     */
    public void printResult() {
        report.println(getSummary());
    }
}
