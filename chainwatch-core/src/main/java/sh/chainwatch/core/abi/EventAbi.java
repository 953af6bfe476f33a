// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core.abi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import sh.chainwatch.core.error.AbiException;

/**
 * The event declarations of a contract ABI, looked up by name.
 *
 * <p>Built either from human-readable declarations or from standard JSON ABI.
 * Functions, errors and constructors in a JSON ABI are ignored. When an event
 * name is overloaded, the first declaration wins.
 *
 * @since 0.1.0
 */
public final class EventAbi {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final EventAbi EMPTY = new EventAbi(Map.of());

    private final Map<String, EventSignature> byName;

    private EventAbi(final Map<String, EventSignature> byName) {
        this.byName = Collections.unmodifiableMap(byName);
    }

    public static EventAbi empty() {
        return EMPTY;
    }

    /**
     * @param declarations entries such as {@code event Approval(address indexed owner, address indexed spender, uint256 value)}
     */
    public static EventAbi of(final List<String> declarations) {
        Objects.requireNonNull(declarations, "declarations");
        final Map<String, EventSignature> events = new LinkedHashMap<>();
        for (String declaration : declarations) {
            final EventSignature event = EventSignature.parse(declaration);
            events.putIfAbsent(event.name(), event);
        }
        return new EventAbi(events);
    }

    public static EventAbi of(final String... declarations) {
        return of(List.of(declarations));
    }

    /**
     * Reads the {@code "type": "event"} entries of a JSON ABI array.
     *
     * @throws AbiException if the JSON is malformed or an event entry lacks a name
     */
    public static EventAbi fromJson(final String json) {
        Objects.requireNonNull(json, "json");
        final JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new AbiException("Invalid ABI JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isArray()) {
            throw new AbiException("ABI JSON must be an array");
        }
        final Map<String, EventSignature> events = new LinkedHashMap<>();
        for (JsonNode entry : root) {
            if (!"event".equals(entry.path("type").asText())) {
                continue;
            }
            final JsonNode name = entry.path("name");
            if (!name.isTextual()) {
                throw new AbiException("Event entry without a name: " + entry);
            }
            final EventSignature event = new EventSignature(
                    name.asText(),
                    parseInputs(entry.path("inputs")),
                    entry.path("anonymous").asBoolean(false));
            events.putIfAbsent(event.name(), event);
        }
        return new EventAbi(events);
    }

    public Optional<EventSignature> find(final String eventName) {
        return Optional.ofNullable(byName.get(eventName));
    }

    public List<EventSignature> events() {
        return List.copyOf(byName.values());
    }

    public boolean isEmpty() {
        return byName.isEmpty();
    }

    private static List<EventParameter> parseInputs(final JsonNode inputs) {
        if (!inputs.isArray()) {
            return List.of();
        }
        final List<EventParameter> params = new ArrayList<>(inputs.size());
        for (JsonNode input : inputs) {
            params.add(new EventParameter(
                    input.path("name").asText(""),
                    canonicalType(input),
                    input.path("indexed").asBoolean(false)));
        }
        return params;
    }

    private static String canonicalType(final JsonNode param) {
        final String type = param.path("type").asText("");
        if (type.isEmpty()) {
            throw new AbiException("Parameter without a type: " + param);
        }
        if (type.startsWith("tuple")) {
            final List<String> components = new ArrayList<>();
            for (JsonNode component : param.path("components")) {
                components.add(canonicalType(component));
            }
            return "(" + String.join(",", components) + ")" + type.substring("tuple".length());
        }
        return EventSignature.normalizeType(type);
    }

    @Override
    public String toString() {
        return "EventAbi" + byName.keySet();
    }
}
