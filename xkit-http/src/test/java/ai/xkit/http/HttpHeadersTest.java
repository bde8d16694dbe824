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
package ai.xkit.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class HttpHeadersTest {

    @Test
    void testCaseInsensitiveLookup() {
        HttpHeaders headers = HttpHeaders.of("Content-Type", "text/plain", "accept", "a/b");

        assertEquals("text/plain", headers.get("content-type"));
        assertEquals("text/plain", headers.get("CONTENT-TYPE"));
        assertTrue(headers.contains("Accept"));
        assertNull(headers.get("Retry-After"));
        assertEquals(List.of(), headers.values("Retry-After"));
    }

    @Test
    void testKeepsFirstNameSeen() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("X-Trace", "1").add("x-trace", "2").set("X-TRACE", List.of("3", "4"));

        assertEquals(Set.of("X-Trace"), headers.names());
        assertEquals(List.of("3", "4"), headers.values("x-trace"));
        assertEquals(Map.of("X-Trace", List.of("3", "4")), headers.toMap());
    }

    @Test
    void testHeaderWithoutValues() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("Pragma", List.of());

        assertTrue(headers.contains("pragma"));
        assertNull(headers.get("pragma"));
        assertFalse(headers.isEmpty());
    }

    @Test
    void testRemove() {
        HttpHeaders headers = HttpHeaders.of("A", "1", "A", "2");

        assertEquals(List.of("1", "2"), headers.remove("a"));
        assertEquals(List.of(), headers.remove("a"));
        assertTrue(headers.isEmpty());
    }

    @Test
    void testCopyIsIndependent() {
        HttpHeaders headers = HttpHeaders.of("A", "1");
        HttpHeaders copy = headers.copy();
        assertEquals(headers, copy);
        assertEquals(headers.hashCode(), copy.hashCode());

        copy.add("A", "2");
        assertEquals(List.of("1"), headers.values("A"));
        assertNotEquals(headers, copy);
    }

    @Test
    void testEqualityIgnoresNameCase() {
        assertEquals(HttpHeaders.of("Accept", "x"), HttpHeaders.of("ACCEPT", "x"));
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> HttpHeaders.of("only-name"));
        assertThrows(NullPointerException.class, () -> new HttpHeaders().add("A", null));
        assertThrows(NullPointerException.class, () -> new HttpHeaders().get(null));
    }

    @Test
    void testValuesAreReadOnly() {
        HttpHeaders headers = HttpHeaders.of("A", "1");
        assertThrows(
                UnsupportedOperationException.class, () -> headers.values("A").add("2"));
    }
}
