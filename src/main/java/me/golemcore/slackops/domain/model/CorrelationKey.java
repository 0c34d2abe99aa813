package me.golemcore.slackops.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Canonical, order-independent predicate over event fields.
 *
 * <p>
 * Field maps are sorted by key at every nesting level, so two keys built from
 * equivalent field sets are equal and hash alike regardless of insertion
 * order. Besides exact equality a key supports the directional
 * {@link #isCoveredBy(CorrelationKey)} match used for routing: a waiter
 * registered under {@code {user: U123}} is covered by the key of any event
 * whose {@code user} is {@code U123}, whatever other fields the event has.
 *
 * <p>
 * The empty key ({@link #wildcard()}) is covered by every key.
 */
public final class CorrelationKey {

    private static final CorrelationKey WILDCARD = new CorrelationKey(Collections.emptySortedMap());

    private final SortedMap<String, Object> schema;
    private final String canonical;

    private CorrelationKey(SortedMap<String, Object> schema) {
        this.schema = schema;
        this.canonical = render(schema);
    }

    public static CorrelationKey of(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields");
        if (fields.isEmpty()) {
            return WILDCARD;
        }
        return new CorrelationKey(canonicalize(fields));
    }

    public static CorrelationKey forEvent(ChatEvent event) {
        return of(event.getFields());
    }

    public static CorrelationKey wildcard() {
        return WILDCARD;
    }

    /**
     * Returns true iff every field of this key is present in {@code reference}
     * with an equal value. Extra fields in {@code reference} are ignored; a field
     * missing from {@code reference} is a non-match.
     */
    public boolean isCoveredBy(CorrelationKey reference) {
        Objects.requireNonNull(reference, "reference");
        for (Map.Entry<String, Object> entry : schema.entrySet()) {
            if (!reference.schema.containsKey(entry.getKey())) {
                return false;
            }
            if (!Objects.equals(entry.getValue(), reference.schema.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    public boolean isWildcard() {
        return schema.isEmpty();
    }

    public SortedMap<String, Object> getSchema() {
        return schema;
    }

    /**
     * Stable textual form, e.g. {@code [(channel, C1),(user, U1)]}.
     */
    public String canonicalForm() {
        return canonical;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CorrelationKey that)) {
            return false;
        }
        return schema.equals(that.schema);
    }

    @Override
    public int hashCode() {
        return schema.hashCode();
    }

    @Override
    public String toString() {
        return "CorrelationKey" + canonical;
    }

    private static SortedMap<String, Object> canonicalize(Map<?, ?> fields) {
        SortedMap<String, Object> sorted = new TreeMap<>();
        fields.forEach((key, value) -> sorted.put(String.valueOf(key), canonicalizeValue(value)));
        return Collections.unmodifiableSortedMap(sorted);
    }

    private static Object canonicalizeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return canonicalize(map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> elements = new ArrayList<>();
            for (Object element : collection) {
                elements.add(canonicalizeValue(element));
            }
            return Collections.unmodifiableList(elements);
        }
        return value;
    }

    private static String render(Object value) {
        if (value instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                    .map(entry -> "(" + entry.getKey() + ", " + render(entry.getValue()) + ")")
                    .collect(Collectors.joining(",", "[", "]"));
        }
        if (value instanceof List<?> list) {
            return list.stream()
                    .map(CorrelationKey::render)
                    .collect(Collectors.joining(",", "[", "]"));
        }
        return String.valueOf(value);
    }
}
