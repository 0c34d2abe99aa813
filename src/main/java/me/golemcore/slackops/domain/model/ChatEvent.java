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

import lombok.EqualsAndHashCode;
import me.golemcore.slackops.domain.exception.MalformedEventException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An event received from the chat platform's real-time stream.
 *
 * <p>
 * The field map is copied deeply on construction and exposed read-only, so the
 * correlation table and the dispatcher can both hold the same instance without
 * either observing a mutation made by the other. Every event carries a
 * {@code type}; text messages additionally carry {@code user}, {@code channel}
 * and {@code text}.
 */
@EqualsAndHashCode
public final class ChatEvent {

    public static final String FIELD_TYPE = "type";
    public static final String FIELD_USER = "user";
    public static final String FIELD_CHANNEL = "channel";
    public static final String FIELD_TEXT = "text";

    public static final String TYPE_MESSAGE = "message";
    public static final String TYPE_SHUTDOWN = "shutdown";

    private static final ChatEvent SHUTDOWN = new ChatEvent(Map.of(FIELD_TYPE, TYPE_SHUTDOWN));

    private final Map<String, Object> fields;

    private ChatEvent(Map<String, ?> fields) {
        this.fields = freezeMap(fields);
    }

    /**
     * Creates an event from a decoded frame.
     *
     * @throws MalformedEventException
     *             if the frame has no {@code type}
     */
    public static ChatEvent of(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields");
        if (!(fields.get(FIELD_TYPE) instanceof String)) {
            throw new MalformedEventException("Event has no type: " + fields);
        }
        return new ChatEvent(fields);
    }

    public static ChatEvent message(String user, String channel, String text) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(FIELD_TYPE, TYPE_MESSAGE);
        fields.put(FIELD_USER, user);
        fields.put(FIELD_CHANNEL, channel);
        fields.put(FIELD_TEXT, text);
        return new ChatEvent(fields);
    }

    /**
     * Sentinel pushed by the ingress bridge when the stream ends.
     */
    public static ChatEvent shutdown() {
        return SHUTDOWN;
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public String getType() {
        return (String) fields.get(FIELD_TYPE);
    }

    public String getUser() {
        return stringField(FIELD_USER);
    }

    public String getChannel() {
        return stringField(FIELD_CHANNEL);
    }

    public String getText() {
        return stringField(FIELD_TEXT);
    }

    public boolean isMessage() {
        return TYPE_MESSAGE.equals(getType());
    }

    public boolean isShutdown() {
        return TYPE_SHUTDOWN.equals(getType());
    }

    /**
     * Checks that a message carries everything the dispatcher reads.
     *
     * @throws MalformedEventException
     *             if {@code user}, {@code channel} or {@code text} is missing
     */
    public void requireMessageFields() {
        for (String field : List.of(FIELD_USER, FIELD_CHANNEL, FIELD_TEXT)) {
            if (stringField(field) == null) {
                throw new MalformedEventException("Message event without '" + field + "': " + fields);
            }
        }
    }

    private String stringField(String field) {
        Object value = fields.get(field);
        return value instanceof String text ? text : null;
    }

    @Override
    public String toString() {
        return "ChatEvent" + fields;
    }

    private static Map<String, Object> freezeMap(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, freeze(value)));
        return Collections.unmodifiableMap(copy);
    }

    @SuppressWarnings("unchecked")
    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap((Map<String, ?>) map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>();
            for (Object element : collection) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
