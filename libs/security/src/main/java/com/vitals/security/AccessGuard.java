package com.vitals.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * Checks the optional access token protecting the health and stats endpoints.
 * <p>
 * The token is read from {@value #ACCESS_TOKEN_HEADER} first and, when that header is absent or
 * empty, from a {@code Bearer} {@value #AUTHORIZATION_HEADER} header. The guard never writes a
 * response; callers answer a denial with 403.
 */
public final class AccessGuard {

    /** Custom header carrying the raw token. */
    public static final String ACCESS_TOKEN_HEADER = "X-Access-Token";

    /** Standard header carrying {@code Bearer <token>}. */
    public static final String AUTHORIZATION_HEADER = "Authorization";

    /**
     * Read access to the headers of an inbound request. Lookups are case-insensitive and return
     * {@code null} for absent headers, as servlet requests do.
     */
    @FunctionalInterface
    public interface HeaderSource {
        String header(String name);
    }

    private AccessGuard() {
        // utility class
    }

    /**
     * Decides whether a request may access the endpoints.
     *
     * @param headers         the request headers
     * @param configuredToken the configured access token; {@code null} or empty disables the check
     * @return true if no token is configured or the request presents exactly that token
     */
    public static boolean checkAccess(HeaderSource headers, String configuredToken) {
        if (configuredToken == null || configuredToken.isEmpty()) {
            return true;
        }
        return extractToken(headers)
                .map(token -> matches(token, configuredToken))
                .orElse(false);
    }

    /**
     * Returns the token presented by a request, if any.
     */
    public static Optional<String> extractToken(HeaderSource headers) {
        String token = headers.header(ACCESS_TOKEN_HEADER);
        if (token != null && !token.isEmpty()) {
            return Optional.of(token);
        }
        return BearerTokenExtractor.extract(headers.header(AUTHORIZATION_HEADER));
    }

    private static boolean matches(String presented, String expected) {
        // constant-time comparison
        return MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
    }
}
