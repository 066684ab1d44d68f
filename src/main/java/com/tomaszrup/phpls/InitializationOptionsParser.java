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
package com.tomaszrup.phpls;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the {@code initializationOptions} JSON object sent by the client
 * during the LSP {@code initialize} request.
 */
class InitializationOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(InitializationOptionsParser.class);

    private static final String LOG_LEVEL_OPTION = "logLevel";
    private static final String FORMAT_ENABLED_OPTION = "formatEnabled";

    /** Immutable container for parsed initialization options. */
    static final class ParsedOptions {
        /** {@code null} when the client did not send the option. */
        final Boolean formatEnabled;

        ParsedOptions(Boolean formatEnabled) {
            this.formatEnabled = formatEnabled;
        }
    }

    private InitializationOptionsParser() {
    }

    /**
     * Parse initialization options and apply the log level right away so
     * that everything logged afterwards respects it.
     *
     * @return parsed options, or {@code null} if the input is not a
     *         {@link JsonObject}
     */
    static ParsedOptions parse(Object initOptions) {
        if (!(initOptions instanceof JsonObject)) {
            return null;
        }
        JsonObject opts = (JsonObject) initOptions;
        applyLogLevelOption(opts);

        Boolean formatEnabled = null;
        JsonElement format = opts.get(FORMAT_ENABLED_OPTION);
        if (format != null && format.isJsonPrimitive() && format.getAsJsonPrimitive().isBoolean()) {
            formatEnabled = format.getAsBoolean();
            logger.info("Formatting enabled: {}", formatEnabled);
        }
        return new ParsedOptions(formatEnabled);
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
     *
     * @return whether the level was changed
     */
    static boolean applyLogLevel(String levelName) {
        ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
        if (level == null) {
            logger.warn("Unknown log level '{}', keeping current level", levelName);
            return false;
        }
        org.slf4j.Logger rootLogger = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (!(rootLogger instanceof ch.qos.logback.classic.Logger)) {
            logger.warn("Root logger is not a Logback logger, cannot set level '{}'", levelName);
            return false;
        }
        ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger) rootLogger;
        ch.qos.logback.classic.Level previous = root.getLevel();
        root.setLevel(level);
        logger.info("Log level changed from {} to {}", previous, level);
        return true;
    }
}
