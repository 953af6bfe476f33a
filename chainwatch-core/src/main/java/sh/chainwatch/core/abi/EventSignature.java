// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core.abi;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import sh.chainwatch.core.crypto.Keccak256;
import sh.chainwatch.core.error.AbiException;
import sh.chainwatch.core.types.Hash;

/**
 * An event declaration, enough of it to filter logs by selector.
 *
 * <p>Parses the human-readable form:
 * <pre>{@code
 * EventSignature transfer = EventSignature.parse(
 *         "event Transfer(address indexed from, address indexed to, uint256 value)");
 * transfer.canonical(); // Transfer(address,address,uint256)
 * transfer.topic();     // 0xddf252ad...
 * }</pre>
 *
 * @since 0.1.0
 */
public record EventSignature(String name, List<EventParameter> inputs, boolean anonymous) {

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_$][A-Za-z0-9_$]*$");

    public EventSignature {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(inputs, "inputs");
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new AbiException("Invalid event name: " + name);
        }
        inputs = List.copyOf(inputs);
    }

    /**
     * @return {@code Name(type1,type2,...)}, the preimage of the event selector
     */
    public String canonical() {
        return name + inputs.stream().map(EventParameter::type).collect(Collectors.joining(",", "(", ")"));
    }

    /**
     * @return the event selector, Keccak-256 of {@link #canonical()}
     */
    public Hash topic() {
        return Keccak256.hashUtf8(canonical());
    }

    /**
     * Signature with no inputs, used when a caller names an event without supplying its ABI.
     */
    public static EventSignature bare(final String name) {
        return new EventSignature(name, List.of(), false);
    }

    /**
     * Parses {@code event Name(type [indexed] [name], ...) [anonymous]}. The leading
     * {@code event} keyword is optional.
     *
     * @throws AbiException if the text is not a well-formed event declaration
     */
    public static EventSignature parse(final String declaration) {
        Objects.requireNonNull(declaration, "declaration");
        String text = declaration.trim();
        if (text.startsWith("event ")) {
            text = text.substring("event ".length()).trim();
        }
        final int open = text.indexOf('(');
        if (open <= 0) {
            throw new AbiException("Not an event declaration: " + declaration);
        }
        final int close = matchingParen(text, open, declaration);
        final String name = text.substring(0, open).trim();
        final String trailer = text.substring(close + 1).trim();
        final boolean anonymous;
        if (trailer.isEmpty()) {
            anonymous = false;
        } else if ("anonymous".equals(trailer)) {
            anonymous = true;
        } else {
            throw new AbiException("Unexpected text after event parameters: " + declaration);
        }

        final List<EventParameter> inputs = new ArrayList<>();
        for (String part : splitTopLevel(text.substring(open + 1, close), declaration)) {
            inputs.add(parseParameter(part, declaration));
        }
        return new EventSignature(name, inputs, anonymous);
    }

    private static EventParameter parseParameter(final String part, final String declaration) {
        String rest = part.trim();
        final String type;
        if (rest.startsWith("(") || rest.startsWith("tuple(")) {
            final int open = rest.indexOf('(');
            final int close = matchingParen(rest, open, declaration);
            final List<String> components = new ArrayList<>();
            for (String component : splitTopLevel(rest.substring(open + 1, close), declaration)) {
                components.add(parseParameter(component, declaration).type());
            }
            int end = close + 1;
            while (end < rest.length() && !Character.isWhitespace(rest.charAt(end))) {
                end++;
            }
            type = "(" + String.join(",", components) + ")" + rest.substring(close + 1, end);
            rest = rest.substring(end).trim();
        } else {
            final String[] tokens = rest.split("\\s+", 2);
            type = normalizeType(tokens[0]);
            rest = tokens.length > 1 ? tokens[1].trim() : "";
        }

        boolean indexed = false;
        if (rest.equals("indexed") || rest.startsWith("indexed ")) {
            indexed = true;
            rest = rest.substring("indexed".length()).trim();
        }
        if (!rest.isEmpty() && !IDENTIFIER.matcher(rest).matches()) {
            throw new AbiException("Invalid parameter '" + part.trim() + "' in: " + declaration);
        }
        return new EventParameter(rest, type, indexed);
    }

    static String normalizeType(final String type) {
        final int bracket = type.indexOf('[');
        final String base = bracket < 0 ? type : type.substring(0, bracket);
        final String suffix = bracket < 0 ? "" : type.substring(bracket);
        switch (base) {
            case "uint":
                return "uint256" + suffix;
            case "int":
                return "int256" + suffix;
            default:
                return type;
        }
    }

    private static int matchingParen(final String text, final int open, final String declaration) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw new AbiException("Unbalanced parentheses in: " + declaration);
    }

    private static List<String> splitTopLevel(final String params, final String declaration) {
        final List<String> parts = new ArrayList<>();
        if (params.isBlank()) {
            return parts;
        }
        int depth = 0;
        int start = 0;
        for (int i = 0; i < params.length(); i++) {
            final char c = params.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(requireNonBlank(params.substring(start, i), declaration));
                start = i + 1;
            }
        }
        parts.add(requireNonBlank(params.substring(start), declaration));
        return parts;
    }

    private static String requireNonBlank(final String part, final String declaration) {
        if (part.isBlank()) {
            throw new AbiException("Empty parameter in: " + declaration);
        }
        return part;
    }
}
