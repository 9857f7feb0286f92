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

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import de.synchrolib.api.EncodedAutomaton;
import de.synchrolib.exception.EncodingValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads files that hold one encoded automaton per line. Blank lines are ignored.
 */
public final class EncodedAutomatonReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(EncodedAutomatonReader.class);

    private EncodedAutomatonReader() {
        // prevent instantiation
    }

    /**
     * Reads all automata from the given file.
     *
     * @param path
     *         the input file
     * @param states
     *         the number of states of every automaton
     * @param alphabetSize
     *         the alphabet size of every automaton
     *
     * @return the automata in file order
     *
     * @throws IOException
     *         if the file cannot be read
     * @throws EncodingValidationException
     *         if a line is not a valid encoding, the message names the line
     */
    public static List<EncodedAutomaton> readAll(Path path, int states, int alphabetSize) throws IOException {
        final long expected;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            expected = Lines.countNonEmptyLines(reader);
        }

        LOGGER.info("Reading {} automata from {}", expected, path);

        final List<EncodedAutomaton> result = new ArrayList<>((int) Math.min(expected, Integer.MAX_VALUE));
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (!Lines.isNonEmpty(line)) {
                    continue;
                }
                try {
                    result.add(EncodedAutomaton.parse(states, alphabetSize, line));
                } catch (EncodingValidationException e) {
                    throw new EncodingValidationException(e.getKind(),
                                                          states,
                                                          alphabetSize,
                                                          e.getTokenIndex(),
                                                          path + ":" + lineNumber + ": " + e.getMessage());
                }
            }
        }

        LOGGER.info("Read {} automata", result.size());
        return result;
    }
}
