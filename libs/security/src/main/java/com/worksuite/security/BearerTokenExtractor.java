package com.worksuite.security;

import java.util.Optional;

/**
 * Pulls the credential out of an {@code Authorization} header.
 */
public final class BearerTokenExtractor {

    private static final String SCHEME = "bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Returns the token of a {@code "Bearer <token>"} header value.
     * <p>
     * The scheme is matched case-insensitively and must be followed by whitespace.
     *
     * @param headerValue raw header value, may be null
     * @return the token, or empty for a missing, non-bearer or token-less header
     */
    public static Optional<String> extract(String headerValue) {
        if (headerValue == null) {
            return Optional.empty();
        }
        String value = headerValue.strip();
        if (value.length() <= SCHEME.length()
                || !value.regionMatches(true, 0, SCHEME, 0, SCHEME.length())
                || !Character.isWhitespace(value.charAt(SCHEME.length()))) {
            return Optional.empty();
        }
        String token = value.substring(SCHEME.length()).strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
