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
package de.synchrolib.io.config;

import java.io.IOException;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.synchrolib.exception.ConfigParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads JSON configuration documents into configuration beans. Unknown keys are rejected.
 */
public final class ConfigReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigReader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ConfigReader() {
        // prevent instantiation
    }

    /**
     * Reads the configuration stored in the given file.
     *
     * @param path
     *         the configuration file
     * @param type
     *         the configuration bean class
     * @param <T>
     *         configuration type
     *
     * @return the configuration
     *
     * @throws ConfigParseException
     *         if the file cannot be read or does not hold a valid configuration
     */
    public static <T> T read(Path path, Class<T> type) {
        final T config;
        try {
            config = MAPPER.readValue(path.toFile(), type);
        } catch (JsonProcessingException e) {
            throw new ConfigParseException("Malformed configuration " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigParseException("Could not read configuration " + path + ": " + e.getMessage(), e);
        }

        if (config == null) {
            throw new ConfigParseException("Empty configuration " + path);
        }

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Config:\n{}", render(config));
        }

        return config;
    }

    static String render(Object config) {
        try {
            return MAPPER.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            return String.valueOf(config);
        }
    }
}
