/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ai.xkit.http.util;

import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/** Typed reads of configuration maps, as parsed from YAML or JSON. */
public class ConfigurationUtils {

    private ConfigurationUtils() {}

    public static long getLong(String key, long defaultValue, Map<String, Object> configuration) {
        Object value = configuration.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException error) {
            throw invalidValue(key, value, "an integer", error);
        }
    }

    public static double getDouble(
            String key, double defaultValue, Map<String, Object> configuration) {
        Object value = configuration.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException error) {
            throw invalidValue(key, value, "a number", error);
        }
    }

    public static boolean getBoolean(
            String key, boolean defaultValue, Map<String, Object> configuration) {
        Object value = configuration.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    /** Rejects keys that are not part of the known ones, to catch typos early. */
    public static void validateKeys(
            Map<String, Object> configuration, Set<String> knownKeys, Supplier<String> definition) {
        for (String key : configuration.keySet()) {
            if (!knownKeys.contains(key)) {
                throw new IllegalArgumentException(
                        "Unknown field '"
                                + key
                                + "' in "
                                + definition.get()
                                + ", only "
                                + knownKeys
                                + " are allowed");
            }
        }
    }

    private static IllegalArgumentException invalidValue(
            String key, Object value, String expected, Exception cause) {
        return new IllegalArgumentException(
                "Field '" + key + "' is " + value + ", but it must be " + expected, cause);
    }
}
