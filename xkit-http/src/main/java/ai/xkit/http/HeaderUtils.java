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

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Helpers on top of {@link HttpHeaders}. All lookups are case insensitive. */
public final class HeaderUtils {

    private HeaderUtils() {}

    /** Returns whether the key exists in the headers, with or without values. */
    public static boolean exists(HttpHeaders headers, String key) {
        return headers != null && headers.contains(key);
    }

    /**
     * Returns all the values of the key. A value holding a comma-separated list is split into its
     * trimmed elements, so that repeated fields and list fields read the same. See
     * https://datatracker.ietf.org/doc/html/rfc9110#section-5.3
     *
     * @return the values, empty if the key is absent
     */
    public static List<String> values(HttpHeaders headers, String key) {
        if (headers == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (String value : headers.values(key)) {
            for (String field : value.split(",", -1)) {
                result.add(field.trim());
            }
        }
        return result;
    }

    /**
     * Returns the values of the key as a map, each {@code name=value} element giving an entry and
     * each bare {@code name} mapping to an empty string.
     *
     * @return the entries in header order, empty if the key is absent
     */
    public static Map<String, String> keyValues(HttpHeaders headers, String key) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String value : values(headers, key)) {
            String[] keyValue = value.split("=", -1);
            if (keyValue.length > 1) {
                result.put(keyValue[0], keyValue[1]);
            } else {
                result.put(value, "");
            }
        }
        return result;
    }

    /**
     * Parses the Date header. See https://datatracker.ietf.org/doc/html/rfc9110#section-6.6.1
     *
     * @throws IllegalArgumentException if there is no Date header
     * @throws java.time.format.DateTimeParseException if the header is not a valid HTTP date
     */
    public static Instant parseDate(HttpHeaders headers) {
        String date = headers == null ? null : headers.get(HttpHeaderNames.DATE);
        if (date == null || date.isEmpty()) {
            throw new IllegalArgumentException("no date header");
        }
        return HttpDates.parse(date);
    }

    /**
     * Sets the values of the key. Values already present are preserved under {@code prefix-key};
     * if that one is taken too, its values move to {@code prefix-1-key}, which moves to {@code
     * prefix-2-key}, and so on. See https://www.w3.org/TR/ct-guidelines/#sec-original-headers
     */
    public static void replaceHeader(
            HttpHeaders headers, String prefix, String key, String... values) {
        if (headers == null) {
            return;
        }
        final String canonicalPrefix = canonicalKey(prefix);
        final String canonicalKey = canonicalKey(key);
        final String prefixedKey = canonicalPrefix + "-" + canonicalKey;

        if (headers.contains(prefixedKey)) {
            List<String> shifted = List.copyOf(headers.values(prefixedKey));
            for (int i = 1; ; i++) {
                String numberedKey = canonicalPrefix + "-" + i + "-" + canonicalKey;
                boolean taken = headers.contains(numberedKey);
                List<String> previous = List.copyOf(headers.values(numberedKey));
                headers.set(numberedKey, shifted);
                if (!taken) {
                    break;
                }
                shifted = previous;
            }
        }

        if (headers.contains(canonicalKey)) {
            headers.set(prefixedKey, List.copyOf(headers.values(canonicalKey)));
        }

        headers.set(canonicalKey, values);
    }

    /**
     * Returns the canonical form of a header name: first letter and letters following a hyphen
     * upper-cased, the rest lower-cased. Names holding a space are returned unchanged.
     */
    public static String canonicalKey(String key) {
        if (key.indexOf(' ') >= 0) {
            return key;
        }
        StringBuilder builder = new StringBuilder(key.length());
        boolean upper = true;
        for (char c : key.toCharArray()) {
            builder.append(upper ? Character.toUpperCase(c) : Character.toLowerCase(c));
            upper = c == '-';
        }
        return builder.toString();
    }
}
