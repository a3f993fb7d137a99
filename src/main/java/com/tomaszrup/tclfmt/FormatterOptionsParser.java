////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.tclfmt;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.tomaszrup.tclfmt.io.FileAccessException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Reads {@link FormatterOptions} from a JSON object such as
 * <pre>{@code
 * {
 *   "alignAssignments": true,
 *   "expandLists": true,
 *   "indentUnit": 4,
 *   "logLevel": "DEBUG"
 * }
 * }</pre>
 *
 * <p>Every key is optional; missing keys keep the value of the base options.
 * Values of the wrong type or out of range are ignored with a warning so a
 * partly wrong file still applies its valid settings.</p>
 */
public final class FormatterOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(FormatterOptionsParser.class);

    static final String ALIGN_ASSIGNMENTS_OPTION = "alignAssignments";
    static final String EXPAND_LISTS_OPTION = "expandLists";
    static final String STRICT_CONTINUATION_INDENT_OPTION = "strictContinuationIndent";
    static final String INDENT_UNIT_OPTION = "indentUnit";
    static final String LIST_EXPANSION_THRESHOLD_OPTION = "listExpansionThreshold";
    static final String LOG_LEVEL_OPTION = "logLevel";

    private static final Set<String> KNOWN_OPTIONS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            ALIGN_ASSIGNMENTS_OPTION, EXPAND_LISTS_OPTION, STRICT_CONTINUATION_INDENT_OPTION,
            INDENT_UNIT_OPTION, LIST_EXPANSION_THRESHOLD_OPTION, LOG_LEVEL_OPTION)));

    private FormatterOptionsParser() {
        // utility class
    }

    /**
     * Read and parse a JSON options file.
     *
     * @throws FileAccessException if the file cannot be read or is not a JSON object
     */
    public static FormatterOptions parseFile(Path configFile, FormatterOptions base) throws FileAccessException {
        String json;
        try {
            json = Files.readString(configFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FileAccessException("Cannot read configuration file " + configFile, configFile, e);
        }
        try {
            return parse(json, base);
        } catch (IllegalArgumentException e) {
            throw new FileAccessException("Invalid configuration file " + configFile + ": " + e.getMessage(),
                    configFile, e);
        }
    }

    /**
     * Parse a JSON document.
     *
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public static FormatterOptions parse(String json, FormatterOptions base) {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed JSON: " + e.getMessage(), e);
        }
        if (!root.isJsonObject()) {
            throw new IllegalArgumentException("Expected a JSON object but found " + root);
        }
        return parse(root.getAsJsonObject(), base);
    }

    /**
     * Apply the options found in {@code opts} on top of {@code base}. A
     * {@code logLevel} entry changes the Logback root level immediately.
     */
    public static FormatterOptions parse(JsonObject opts, FormatterOptions base) {
        warnUnknownOptions(opts);
        applyLogLevelOption(opts);

        FormatterOptions options = base;
        Boolean align = parseBooleanOption(opts, ALIGN_ASSIGNMENTS_OPTION);
        if (align != null) {
            options = options.withAlignAssignments(align);
        }
        Boolean expand = parseBooleanOption(opts, EXPAND_LISTS_OPTION);
        if (expand != null) {
            options = options.withExpandLists(expand);
        }
        Boolean strict = parseBooleanOption(opts, STRICT_CONTINUATION_INDENT_OPTION);
        if (strict != null) {
            options = options.withStrictContinuationIndent(strict);
        }
        Integer indentUnit = parseIntOption(opts, INDENT_UNIT_OPTION, 0);
        if (indentUnit != null) {
            options = options.withIndentUnit(indentUnit);
        }
        Integer threshold = parseIntOption(opts, LIST_EXPANSION_THRESHOLD_OPTION, 1);
        if (threshold != null) {
            options = options.withListExpansionThreshold(threshold);
        }
        logger.debug("Parsed options: {}", options);
        return options;
    }

    private static void warnUnknownOptions(JsonObject opts) {
        for (String key : opts.keySet()) {
            if (!KNOWN_OPTIONS.contains(key)) {
                logger.warn("Ignoring unknown option '{}'", key);
            }
        }
    }

    private static void applyLogLevelOption(JsonObject opts) {
        if (opts.has(LOG_LEVEL_OPTION) && opts.get(LOG_LEVEL_OPTION).isJsonPrimitive()) {
            applyLogLevel(opts.get(LOG_LEVEL_OPTION).getAsString());
        }
    }

    /**
     * Dynamically set the Logback root logger level from a string value.
     * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
     * Invalid values are ignored and a warning is logged.
     */
    static void applyLogLevel(String levelName) {
        try {
            ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
            if (level == null) {
                logger.warn("Unknown log level '{}', keeping current level", levelName);
                return;
            }
            ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
                    LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            ch.qos.logback.classic.Level previous = root.getLevel();
            root.setLevel(level);
            logger.debug("Log level changed from {} to {}", previous, level);
        } catch (ClassCastException e) {
            logger.warn("Failed to set log level to '{}': {}", levelName, e.getMessage());
        }
    }

    private static Boolean parseBooleanOption(JsonObject opts, String key) {
        if (!opts.has(key)) {
            return null;
        }
        JsonElement value = opts.get(key);
        if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isBoolean()) {
            return value.getAsBoolean();
        }
        logger.warn("Option '{}' expects true or false, ignoring {}", key, value);
        return null;
    }

    private static Integer parseIntOption(JsonObject opts, String key, int minimum) {
        if (!opts.has(key)) {
            return null;
        }
        JsonElement value = opts.get(key);
        if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isNumber()) {
            double number = value.getAsDouble();
            if (number == Math.rint(number) && number >= minimum && number <= Integer.MAX_VALUE) {
                return (int) number;
            }
        }
        logger.warn("Option '{}' expects an integer >= {}, ignoring {}", key, minimum, value);
        return null;
    }
}
