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

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import de.synchrolib.algorithm.synchro.AlgorithmPipeline;
import de.synchrolib.api.EncodedAutomaton;
import de.synchrolib.exception.ConfigParseException;
import de.synchrolib.exception.EncodingValidationException;
import de.synchrolib.exception.InvalidArityException;
import de.synchrolib.generator.canonical.CanonicalEnumerator;
import de.synchrolib.generator.canonical.DiscoveryConvention;
import de.synchrolib.io.EncodedAutomatonReader;
import de.synchrolib.io.OutputDestination;
import de.synchrolib.io.ResultSink;
import de.synchrolib.io.config.ConfigReader;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point. Enumerates the canonical automata of the requested dimensions, or reads them from a file,
 * analyzes each one and reports the maxima of the computed bounds.
 */
public final class SynchroRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(SynchroRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_CONFIG = 2;
    static final int EXIT_INVALID = 3;
    static final int EXIT_IO = 4;

    private static final String NAME = "synchrolib";

    private final PrintStream out;

    SynchroRunner(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new SynchroRunner(System.out).run(args));
    }

    static Options createOptions() {
        final Options options = new Options();

        options.addOption("c", "config", true, "JSON configuration file");
        options.addOption("n", "states", true, "number of states, including the sink");
        options.addOption("k", "alphabet", true, "size of the input alphabet");
        options.addOption("i", "input", true, "read automata from this file instead of enumerating them");
        options.addOption("o", "output", true, "write one line per automaton to this file");
        options.addOption("w", "word", false, "keep synchronizing words");
        options.addOption(Option.builder("l").longOpt("legacy").desc("use the legacy discovery convention").build());
        options.addOption("h", "help", false, "print this message");

        return options;
    }

    /**
     * Executes a run.
     *
     * @param args
     *         the command line arguments
     *
     * @return the exit status of the process
     */
    int run(String[] args) {
        final Options options = createOptions();
        final CommandLineParser parser = new DefaultParser();
        final CommandLine cmd;

        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            out.println(e.getMessage());
            printHelp(options);
            return EXIT_USAGE;
        }

        // show help menu
        if (cmd.hasOption("help")) {
            printHelp(options);
            return EXIT_OK;
        }

        final RunConfig config;
        try {
            if (cmd.hasOption("config")) {
                config = ConfigReader.read(Paths.get(cmd.getOptionValue("config")), RunConfig.class);
            } else {
                config = new RunConfig();
            }
        } catch (ConfigParseException e) {
            LOGGER.error(e.getMessage());
            return EXIT_CONFIG;
        }

        try {
            applyOverrides(cmd, config);
        } catch (NumberFormatException e) {
            out.println("Expected an integer: " + e.getMessage());
            printHelp(options);
            return EXIT_USAGE;
        }

        final Integer states = config.getStates();
        final Integer alphabetSize = config.getAlphabetSize();
        if (states == null || alphabetSize == null) {
            out.println("Both the number of states and the alphabet size are required");
            printHelp(options);
            return EXIT_USAGE;
        }

        final AlgorithmPipeline pipeline;
        try {
            pipeline = config.createPipeline();
        } catch (IllegalArgumentException e) {
            LOGGER.error("Invalid configuration: {}", e.getMessage());
            return EXIT_CONFIG;
        }

        try (OutputDestination destination = openOutput(config.getOutput())) {
            final ResultSink sink = new ResultSink(destination, out);
            execute(config, states, alphabetSize, pipeline, sink);
            sink.printResult();
        } catch (InvalidArityException | EncodingValidationException e) {
            LOGGER.error(e.getMessage());
            return EXIT_INVALID;
        } catch (IOException e) {
            LOGGER.error("I/O failure: {}", e.getMessage());
            return EXIT_IO;
        } catch (UncheckedIOException e) {
            LOGGER.error("I/O failure: {}", e.getCause().getMessage());
            return EXIT_IO;
        }

        return EXIT_OK;
    }

    private static void applyOverrides(CommandLine cmd, RunConfig config) {
        if (cmd.hasOption("states")) {
            config.setStates(Integer.parseInt(cmd.getOptionValue("states")));
        }
        if (cmd.hasOption("alphabet")) {
            config.setAlphabetSize(Integer.parseInt(cmd.getOptionValue("alphabet")));
        }
        if (cmd.hasOption("input")) {
            config.setInput(cmd.getOptionValue("input"));
        }
        if (cmd.hasOption("output")) {
            config.setOutput(cmd.getOptionValue("output"));
        }
        if (cmd.hasOption("word")) {
            config.setWord(true);
        }
        if (cmd.hasOption("legacy")) {
            config.setConvention(DiscoveryConvention.LEGACY);
        }
    }

    private static OutputDestination openOutput(@Nullable String output) throws IOException {
        if (output == null) {
            return OutputDestination.summaryOnly();
        }
        return OutputDestination.toFile(Paths.get(output));
    }

    private static void execute(RunConfig config,
                                int states,
                                int alphabetSize,
                                AlgorithmPipeline pipeline,
                                ResultSink sink) throws IOException {
        final String input = config.getInput();

        if (input != null) {
            final List<EncodedAutomaton> automata =
                    EncodedAutomatonReader.readAll(Paths.get(input), states, alphabetSize);
            for (int i = 0; i < automata.size(); i++) {
                sink.pushResult(pipeline.analyze(automata.get(i)), i);
            }
        } else {
            final AtomicLong index = new AtomicLong();
            new CanonicalEnumerator(config.getConvention()).enumerate(states,
                                                                      alphabetSize,
                                                                      a -> sink.pushResult(pipeline.analyze(a),
                                                                                           index.getAndIncrement()));
        }
    }

    private void printHelp(Options options) {
        final PrintWriter writer = new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        new HelpFormatter().printHelp(writer,
                                      HelpFormatter.DEFAULT_WIDTH,
                                      NAME,
                                      null,
                                      options,
                                      HelpFormatter.DEFAULT_LEFT_PAD,
                                      HelpFormatter.DEFAULT_DESC_PAD,
                                      null,
                                      true);
        writer.flush();
    }
}
