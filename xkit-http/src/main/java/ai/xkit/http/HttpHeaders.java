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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * A mutable, case-insensitive multi-map of HTTP header fields. Names keep the case they were
 * first added with; lookups ignore case. Iteration follows insertion order.
 *
 * <p>Not thread safe.
 */
public final class HttpHeaders {

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public HttpHeaders() {}

    /**
     * Builds headers from alternating names and values, e.g. {@code of("Accept", "text/plain")}.
     */
    public static HttpHeaders of(String... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("expecting name/value pairs");
        }
        HttpHeaders headers = new HttpHeaders();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            headers.add(namesAndValues[i], namesAndValues[i + 1]);
        }
        return headers;
    }

    public static HttpHeaders of(Map<String, List<String>> map) {
        HttpHeaders headers = new HttpHeaders();
        map.forEach(headers::set);
        return headers;
    }

    /** Returns the first value of the header, or null if there is none. */
    public String get(String name) {
        Entry entry = entries.get(key(name));
        if (entry == null || entry.values.isEmpty()) {
            return null;
        }
        return entry.values.get(0);
    }

    /** Returns all the values of the header, an empty list if the header is absent. */
    public List<String> values(String name) {
        Entry entry = entries.get(key(name));
        if (entry == null) {
            return List.of();
        }
        return Collections.unmodifiableList(entry.values);
    }

    /** Whether the header is present, even without any value. */
    public boolean contains(String name) {
        return entries.containsKey(key(name));
    }

    public HttpHeaders add(String name, String value) {
        Objects.requireNonNull(value, "header value cannot be null");
        entries.computeIfAbsent(key(name), k -> new Entry(name)).values.add(value);
        return this;
    }

    public HttpHeaders set(String name, String... values) {
        return set(name, List.of(values));
    }

    /** Replaces all the values of the header. An empty list keeps the header, without values. */
    public HttpHeaders set(String name, List<String> values) {
        String key = key(name);
        Entry previous = entries.get(key);
        Entry entry = new Entry(previous == null ? name : previous.name);
        if (values != null) {
            values.forEach(v -> entry.values.add(Objects.requireNonNull(v)));
        }
        entries.put(key, entry);
        return this;
    }

    public List<String> remove(String name) {
        Entry removed = entries.remove(key(name));
        return removed == null ? List.of() : removed.values;
    }

    public Set<String> names() {
        Set<String> names = new LinkedHashSet<>();
        entries.values().forEach(e -> names.add(e.name));
        return names;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public void forEach(BiConsumer<String, List<String>> action) {
        entries.values()
                .forEach(e -> action.accept(e.name, Collections.unmodifiableList(e.values)));
    }

    public Map<String, List<String>> toMap() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        forEach((name, values) -> map.put(name, List.copyOf(values)));
        return map;
    }

    public HttpHeaders copy() {
        HttpHeaders copy = new HttpHeaders();
        forEach(copy::set);
        return copy;
    }

    private static String key(String name) {
        Objects.requireNonNull(name, "header name cannot be null");
        return name.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HttpHeaders other)) {
            return false;
        }
        if (!entries.keySet().equals(other.entries.keySet())) {
            return false;
        }
        for (Map.Entry<String, Entry> e : entries.entrySet()) {
            if (!e.getValue().values.equals(other.entries.get(e.getKey()).values)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for (Map.Entry<String, Entry> e : entries.entrySet()) {
            hash += e.getKey().hashCode() ^ e.getValue().values.hashCode();
        }
        return hash;
    }

    @Override
    public String toString() {
        return toMap().toString();
    }

    private static final class Entry {
        private final String name;
        private final List<String> values = new ArrayList<>();

        private Entry(String name) {
            this.name = name;
        }
    }
}
