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
package de.synchrolib.exception;

// Thrown when a run configuration cannot be read or does not match the expected structure.
public class ConfigParseException extends RuntimeException {

    /**
     * Constructor.
     *
     * @see RuntimeException#RuntimeException(String)
     */
    public ConfigParseException(String message) {
        super(message);
    }

    /**
     * Constructor.
     *
     * @see RuntimeException#RuntimeException(String, Throwable)
     */
    public ConfigParseException(String message, Throwable cause) {
        super(message, cause);
    }

}
