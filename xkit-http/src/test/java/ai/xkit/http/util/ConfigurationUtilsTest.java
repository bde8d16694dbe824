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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ConfigurationUtilsTest {

    @Test
    void testGetLong() {
        Map<String, Object> config = Map.of("a", 10, "b", " 20 ", "c", 1.9d);
        assertEquals(10, ConfigurationUtils.getLong("a", 0, config));
        assertEquals(20, ConfigurationUtils.getLong("b", 0, config));
        assertEquals(1, ConfigurationUtils.getLong("c", 0, config));
        assertEquals(7, ConfigurationUtils.getLong("missing", 7, config));
        assertThrows(
                IllegalArgumentException.class,
                () -> ConfigurationUtils.getLong("x", 0, Map.of("x", "1.5")));
    }

    @Test
    void testGetDouble() {
        Map<String, Object> config = Map.of("a", 2, "b", "0.25");
        assertEquals(2d, ConfigurationUtils.getDouble("a", 0, config));
        assertEquals(0.25d, ConfigurationUtils.getDouble("b", 0, config));
        assertEquals(1.5d, ConfigurationUtils.getDouble("missing", 1.5d, config));
        assertThrows(
                IllegalArgumentException.class,
                () -> ConfigurationUtils.getDouble("x", 0, Map.of("x", "half")));
    }

    @Test
    void testGetBoolean() {
        Map<String, Object> config = Map.of("a", true, "b", "TRUE", "c", "nope");
        assertTrue(ConfigurationUtils.getBoolean("a", false, config));
        assertTrue(ConfigurationUtils.getBoolean("b", false, config));
        assertFalse(ConfigurationUtils.getBoolean("c", true, config));
        assertTrue(ConfigurationUtils.getBoolean("missing", true, config));
    }

    @Test
    void testValidateKeys() {
        ConfigurationUtils.validateKeys(Map.of("a", 1), Set.of("a", "b"), () -> "test");
        IllegalArgumentException error =
                assertThrows(
                        IllegalArgumentException.class,
                        () ->
                                ConfigurationUtils.validateKeys(
                                        Map.of("c", 1), Set.of("a"), () -> "my config"));
        assertTrue(error.getMessage().contains("'c' in my config"), error.getMessage());
    }
}
