package toolgate.core.model.identity;

import java.util.Map;
import java.util.Optional;

/**
 * Raw, unverified request attributes used for identity resolution.
 *
 * <p>All fields are optional. {@link #userAgent()} and {@link #clientIp()}
 * default to {@value #UNKNOWN} when absent.
 *
 * @param authorization the raw {@code Authorization} header value, may be null
 * @param authToken     a token already verified upstream, preferred over {@code authorization}
 * @param userAgent     the client's user agent
 * @param clientIp      the client's address
 */
public record RequestMetadata(String authorization, String authToken, String userAgent, String clientIp) {

    public static final String UNKNOWN = "unknown";

    public static final String AUTHORIZATION_KEY = "authorization";
    public static final String AUTH_TOKEN_KEY = "auth_token";
    public static final String USER_AGENT_KEY = "user-agent";
    public static final String CLIENT_IP_KEY = "client_ip";

    public RequestMetadata {
        authorization = blankToNull(authorization);
        authToken = blankToNull(authToken);
        userAgent = defaultIfBlank(userAgent);
        clientIp = defaultIfBlank(clientIp);
    }

    /**
     * Build metadata from a loosely typed map.
     *
     * <p>Recognized keys are {@code authorization}, {@code auth_token},
     * {@code user-agent} and {@code client_ip}; anything else is ignored.
     */
    public static RequestMetadata fromMap(Map<String, String> values) {
        if (values == null) {
            return empty();
        }
        return new RequestMetadata(
                values.get(AUTHORIZATION_KEY),
                values.get(AUTH_TOKEN_KEY),
                values.get(USER_AGENT_KEY),
                values.get(CLIENT_IP_KEY));
    }

    public static RequestMetadata empty() {
        return new RequestMetadata(null, null, null, null);
    }

    /**
     * The credential to resolve, preferring the upstream-verified token.
     */
    public Optional<String> credential() {
        return Optional.ofNullable(authToken != null ? authToken : authorization);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String defaultIfBlank(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value.trim();
    }
}
