package toolgate.core.service.discovery;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import toolgate.core.model.identity.RequestMetadata;

/**
 * Extracts session ids and request metadata from free-text diagnostic lines.
 *
 * <p>Patterns are tried in order; the first match wins.
 */
public class DiagnosticLineParser {

    private static final List<String> KEYWORDS = List.of("session", "mcp-session-id", "messages");

    private static final List<Pattern> SESSION_ID_PATTERNS = List.of(
            Pattern.compile("session_id=([a-f0-9]{32})"),
            Pattern.compile("session_id=([a-f0-9-]{36})"),
            Pattern.compile("\"session_id\":\\s*\"([a-f0-9]{32})\""),
            Pattern.compile("\"session_id\":\\s*\"([a-f0-9-]{36})\""),
            Pattern.compile("session_id:\\s*([a-f0-9]{32})"),
            Pattern.compile("Session-ID:\\s*([a-f0-9]{32})"),
            Pattern.compile("mcp-session-id:\\s*([a-f0-9]{32})"),
            Pattern.compile("/messages/\\?session_id=([a-f0-9]{32})"));

    private static final List<Pattern> BEARER_PATTERNS = List.of(
            Pattern.compile("authorization:\\s*bearer\\s+([a-zA-Z0-9._-]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\"authorization\":\\s*\"bearer\\s+([a-zA-Z0-9._-]+)\"", Pattern.CASE_INSENSITIVE));

    private static final Pattern API_KEY_PATTERN =
            Pattern.compile("apikey\\s+([a-zA-Z0-9._-]+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern IPV4_PATTERN = Pattern.compile("(\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3})");

    private static final Pattern USER_AGENT_PATTERN =
            Pattern.compile("user-agent['\"]?:\\s*['\"]([^'\"]+)['\"]", Pattern.CASE_INSENSITIVE);

    /**
     * Cheap pre-filter applied before any regular expression.
     */
    public boolean mentionsSession(String line) {
        if (line == null || line.isEmpty()) {
            return false;
        }
        String lower = line.toLowerCase(Locale.ROOT);
        return KEYWORDS.stream().anyMatch(lower::contains);
    }

    public Optional<String> extractSessionId(String line) {
        for (Pattern pattern : SESSION_ID_PATTERNS) {
            Matcher matcher = pattern.matcher(line);
            if (matcher.find()) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }

    /**
     * Build request metadata from whatever credential, address and user agent the line carries.
     */
    public RequestMetadata extractRequestMetadata(String line) {
        return new RequestMetadata(
                extractCredential(line).orElse(null),
                null,
                firstGroup(USER_AGENT_PATTERN, line).orElse(null),
                firstGroup(IPV4_PATTERN, line).orElse(null));
    }

    private Optional<String> extractCredential(String line) {
        for (Pattern pattern : BEARER_PATTERNS) {
            Optional<String> token = firstGroup(pattern, line);
            if (token.isPresent()) {
                return token.map(t -> "Bearer " + t);
            }
        }
        return firstGroup(API_KEY_PATTERN, line).map(key -> "ApiKey " + key);
    }

    private static Optional<String> firstGroup(Pattern pattern, String line) {
        Matcher matcher = pattern.matcher(line);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
