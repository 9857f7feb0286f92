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

import com.google.common.base.CharMatcher;

public final class Lines {

    private Lines() {
        // prevent instantiation
    }

    /**
     * Returns whether the given line contains at least one non-whitespace character.
     */
    public static boolean isNonEmpty(String line) {
        return !CharMatcher.whitespace().matchesAllOf(line);
    }

    /**
     * Counts the remaining lines of the given reader that contain at least one non-whitespace character. The reader
     * is consumed but not closed.
     *
     * @param reader
     *         the source to read from
     *
     * @return the number of non-empty lines
     *
     * @throws IOException
     *         if reading fails
     */
    public static long countNonEmptyLines(BufferedReader reader) throws IOException {
        long count = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            if (isNonEmpty(line)) {
                count++;
            }
        }
        return count;
    }
}
