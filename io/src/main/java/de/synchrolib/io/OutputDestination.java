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

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Where a {@link ResultSink} writes its per-automaton lines.
 * <p>
 * There are two variants: {@link #summaryOnly()}, which discards detailed output, and writer-backed destinations,
 * which receive one line per result and are flushed after every line.
 */
public abstract class OutputDestination implements Closeable {

    private static final OutputDestination SUMMARY_ONLY = new SummaryOnly();

    OutputDestination() {
        // restrict subclasses to this package
    }

    /**
     * Returns the destination that keeps no detailed output.
     *
     * @return the summary-only destination
     */
    public static OutputDestination summaryOnly() {
        return SUMMARY_ONLY;
    }

    /**
     * Returns a destination that writes to the given writer. Closing the destination closes the writer.
     *
     * @param writer
     *         the writer receiving the lines
     *
     * @return the destination
     */
    public static OutputDestination of(Writer writer) {
        return new WriterDestination(writer);
    }

    /**
     * Returns a destination that writes to the given file, replacing its previous contents.
     *
     * @param path
     *         the output file
     *
     * @return the destination
     *
     * @throws IOException
     *         if the file cannot be opened for writing
     */
    public static OutputDestination toFile(Path path) throws IOException {
        return new WriterDestination(Files.newBufferedWriter(path, StandardCharsets.UTF_8));
    }

    /**
     * Returns whether this destination keeps detailed per-automaton output.
     *
     * @return {@code false} for the summary-only destination
     */
    public abstract boolean isDetailed();

    /**
     * Writes the given line followed by a line break and flushes the destination.
     */
    abstract void writeLine(String line) throws IOException;

    @Override
    public void close() throws IOException {
        // nothing to release by default
    }

    private static final class SummaryOnly extends OutputDestination {

        @Override
        public boolean isDetailed() {
            return false;
        }

        @Override
        void writeLine(String line) {
            throw new IllegalStateException("summary-only destination does not accept lines");
        }

        @Override
        public String toString() {
            return "summary-only";
        }
    }

    private static final class WriterDestination extends OutputDestination {

        private final Writer writer;

        WriterDestination(Writer writer) {
            this.writer = writer instanceof BufferedWriter ? writer : new BufferedWriter(writer);
        }

        @Override
        public boolean isDetailed() {
            return true;
        }

        @Override
        void writeLine(String line) throws IOException {
            writer.write(line);
            writer.write('\n');
            writer.flush();
        }

        @Override
        public void close() throws IOException {
            writer.close();
        }
    }
}
