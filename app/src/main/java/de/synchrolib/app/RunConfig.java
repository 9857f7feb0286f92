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
package de.synchrolib.app;

import java.util.List;

import de.synchrolib.algorithm.synchro.AlgorithmPipeline;
import de.synchrolib.generator.canonical.DiscoveryConvention;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Settings of a single run. Instances are bound from a JSON document, keys are named after the properties of this
 * class. Command line options take precedence over the document.
 */
public class RunConfig {

    private @Nullable Integer states;
    private @Nullable Integer alphabetSize;
    private DiscoveryConvention convention = DiscoveryConvention.STRICT;
    private @Nullable String input;
    private @Nullable String output;
    private boolean word;
    private int exactMaxStates = AlgorithmPipeline.DEFAULT_EXACT_MAX_STATES;
    private @Nullable List<String> algorithms;

    public @Nullable Integer getStates() {
        return states;
    }

    public void setStates(@Nullable Integer states) {
        this.states = states;
    }

    public @Nullable Integer getAlphabetSize() {
        return alphabetSize;
    }

    public void setAlphabetSize(@Nullable Integer alphabetSize) {
        this.alphabetSize = alphabetSize;
    }

    public DiscoveryConvention getConvention() {
        return convention;
    }

    public void setConvention(DiscoveryConvention convention) {
        this.convention = convention;
    }

    /**
     * Returns the file to read automata from. If absent, the automata are enumerated.
     *
     * @return the input file, or {@code null}
     */
    public @Nullable String getInput() {
        return input;
    }

    public void setInput(@Nullable String input) {
        this.input = input;
    }

    /**
     * Returns the file receiving one line per automaton. If absent, only the summary is reported.
     *
     * @return the output file, or {@code null}
     */
    public @Nullable String getOutput() {
        return output;
    }

    public void setOutput(@Nullable String output) {
        this.output = output;
    }

    public boolean isWord() {
        return word;
    }

    public void setWord(boolean word) {
        this.word = word;
    }

    public int getExactMaxStates() {
        return exactMaxStates;
    }

    public void setExactMaxStates(int exactMaxStates) {
        this.exactMaxStates = exactMaxStates;
    }

    /**
     * Returns the names of the algorithms to run. If absent, all available algorithms are run.
     *
     * @return the algorithm names, or {@code null}
     */
    public @Nullable List<String> getAlgorithms() {
        return algorithms;
    }

    public void setAlgorithms(@Nullable List<String> algorithms) {
        this.algorithms = algorithms;
    }

    AlgorithmPipeline createPipeline() {
        final List<String> names = algorithms;
        if (names == null) {
            return AlgorithmPipeline.defaults(exactMaxStates, word);
        }
        return AlgorithmPipeline.of(names, exactMaxStates, word);
    }
}
