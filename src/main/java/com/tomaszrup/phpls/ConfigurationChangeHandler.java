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
 * Handles didChangeConfiguration processing, encapsulating the
 * {@link JsonObject} dependency so that {@link PhpServices} does not need
 * it directly.
 *
 * <p>Recognised settings:</p>
 * <pre>
 * { "php": { "format": { "enable": true } } }
 * </pre>
 */
final class ConfigurationChangeHandler {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationChangeHandler.class);

    private static final String KEY_PHP = "php";
    private static final String KEY_FORMAT = "format";
    private static final String KEY_ENABLE = "enable";

    private volatile boolean formattingEnabled = true;

    boolean isFormattingEnabled() {
        return formattingEnabled;
    }

    void setFormattingEnabled(boolean formattingEnabled) {
        this.formattingEnabled = formattingEnabled;
    }

    /**
     * Processes a didChangeConfiguration notification. Settings that are
     * missing or of the wrong JSON type leave the current values unchanged.
     *
     * @param rawSettings the raw settings object from the LSP params
     */
    void handleConfigurationChange(Object rawSettings) {
        if (!(rawSettings instanceof JsonObject)) {
            return;
        }
        JsonObject settings = (JsonObject) rawSettings;
        if (!settings.has(KEY_PHP) || !settings.get(KEY_PHP).isJsonObject()) {
            return;
        }
        JsonObject php = settings.get(KEY_PHP).getAsJsonObject();
        if (!php.has(KEY_FORMAT) || !php.get(KEY_FORMAT).isJsonObject()) {
            return;
        }
        JsonObject format = php.get(KEY_FORMAT).getAsJsonObject();
        JsonElement enable = format.get(KEY_ENABLE);
        if (enable != null && enable.isJsonPrimitive() && enable.getAsJsonPrimitive().isBoolean()) {
            formattingEnabled = enable.getAsBoolean();
            logger.info("Formatting {}", formattingEnabled ? "enabled" : "disabled");
        }
    }
}
