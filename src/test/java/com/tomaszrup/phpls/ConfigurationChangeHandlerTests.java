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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

class ConfigurationChangeHandlerTests {
    private ConfigurationChangeHandler handler;

    @BeforeEach
    void setup() {
        handler = new ConfigurationChangeHandler();
    }

    private static JsonObject settings(JsonObject format) {
        JsonObject php = new JsonObject();
        php.add("format", format);
        JsonObject settings = new JsonObject();
        settings.add("php", php);
        return settings;
    }

    @Test
    void testEnabledByDefault() {
        Assertions.assertTrue(handler.isFormattingEnabled());
    }

    @Test
    void testDisableAndEnable() {
        JsonObject format = new JsonObject();
        format.addProperty("enable", false);
        handler.handleConfigurationChange(settings(format));
        Assertions.assertFalse(handler.isFormattingEnabled());

        format.addProperty("enable", true);
        handler.handleConfigurationChange(settings(format));
        Assertions.assertTrue(handler.isFormattingEnabled());
    }

    @Test
    void testMissingSettingKeepsValue() {
        handler.setFormattingEnabled(false);
        handler.handleConfigurationChange(settings(new JsonObject()));
        handler.handleConfigurationChange(new JsonObject());
        handler.handleConfigurationChange(null);
        Assertions.assertFalse(handler.isFormattingEnabled());
    }

    @Test
    void testWrongTypesAreIgnored() {
        JsonObject format = new JsonObject();
        format.addProperty("enable", "no");
        handler.handleConfigurationChange(settings(format));

        JsonObject wrongFormat = new JsonObject();
        JsonObject php = new JsonObject();
        php.add("format", new JsonArray());
        wrongFormat.add("php", php);
        handler.handleConfigurationChange(wrongFormat);

        Assertions.assertTrue(handler.isFormattingEnabled());
    }
}
