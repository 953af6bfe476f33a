// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core;

import java.util.regex.Pattern;

/**
 * Removes credentials from debug log lines.
 *
 * <p>
 * RPC endpoints commonly embed an API key in the URL path or query string,
 * and request dumps may carry an {@code Authorization} header or a private key.
 * All of these are masked, then the line is truncated.
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;
    private static final String TRUNCATION_SUFFIX = "...(truncated)";
    private static final String MASK = "***[REDACTED]***";

    private static final Pattern PRIVATE_KEY = Pattern.compile("\"privateKey\"\\s*:\\s*\"0x[^\"]+\"");

    /** Infura and Alchemy style path keys: {@code /v3/<key>}, {@code /v2/<key>}. */
    private static final Pattern PATH_KEY = Pattern.compile("(/v[0-9]+/)[A-Za-z0-9_-]{16,}");

    private static final Pattern QUERY_KEY =
            Pattern.compile("([?&](?:api[_-]?key|apikey|key|token)=)[^&\\s\"]+", Pattern.CASE_INSENSITIVE);

    private static final Pattern AUTHORIZATION =
            Pattern.compile("(\"?Authorization\"?\\s*[:=]\\s*\"?)(?:Bearer\\s+|Basic\\s+)?[^\"\\s,}]+",
                    Pattern.CASE_INSENSITIVE);

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;
        if (sanitized.contains("\"privateKey\"")) {
            sanitized = PRIVATE_KEY.matcher(sanitized).replaceAll("\"privateKey\":\"0x" + MASK + "\"");
        }
        sanitized = PATH_KEY.matcher(sanitized).replaceAll("$1" + MASK);
        sanitized = QUERY_KEY.matcher(sanitized).replaceAll("$1" + MASK);
        sanitized = AUTHORIZATION.matcher(sanitized).replaceAll("$1" + MASK);

        if (sanitized.length() > MAX_LOG_LENGTH) {
            sanitized = sanitized.substring(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length()) + TRUNCATION_SUFFIX;
        }
        return sanitized;
    }
}
