package toolgate.core.model.session;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import toolgate.core.model.identity.UserIdentity;
import toolgate.core.model.identity.UserType;

/**
 * Application-level session record.
 *
 * <p>Sessions created without an identity live in the {@value #SHARED_SCOPE}
 * scope. Sessions created for a caller live in the scope of that caller's
 * identity hash, and {@code userId}/{@code userType} are copied from the identity.
 *
 * @param sessionId    session identifier
 * @param scope        identity hash of the owner, or {@value #SHARED_SCOPE}
 * @param userId       owner's user id, null for shared sessions
 * @param userType     owner's user type, null for shared sessions
 * @param clientId     client identifier recorded at creation
 * @param createdAt    creation time
 * @param lastAccessed last successful access
 * @param payload      free-form session data
 * @param active       false once soft-deleted
 */
public record ApplicationSession(
        String sessionId,
        String scope,
        String userId,
        UserType userType,
        String clientId,
        Instant createdAt,
        Instant lastAccessed,
        Map<String, Object> payload,
        boolean active) {

    public static final String SHARED_SCOPE = "shared";

    public ApplicationSession {
        Objects.requireNonNull(sessionId, "sessionId cannot be null");
        Objects.requireNonNull(scope, "scope cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
        if (lastAccessed == null) {
            lastAccessed = createdAt;
        }
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }

    /**
     * Create a session that is not owned by any identity.
     */
    public static ApplicationSession shared(
            String sessionId, String clientId, Map<String, Object> payload, Instant now) {
        return new ApplicationSession(sessionId, SHARED_SCOPE, null, null, clientId, now, now, payload, true);
    }

    /**
     * Create a session owned by the given identity.
     */
    public static ApplicationSession owned(
            String sessionId, UserIdentity identity, String clientId, Map<String, Object> payload, Instant now) {
        return new ApplicationSession(
                sessionId,
                identity.identityHash(),
                identity.userId(),
                identity.userType(),
                clientId,
                now,
                now,
                payload,
                true);
    }

    /**
     * Record an access, merging the given entries into the payload.
     */
    public ApplicationSession withAccess(Instant now, Map<String, Object> updates) {
        Map<String, Object> merged = new LinkedHashMap<>(payload);
        if (updates != null) {
            merged.putAll(updates);
        }
        return new ApplicationSession(sessionId, scope, userId, userType, clientId, createdAt, now, merged, active);
    }

    public ApplicationSession deactivated(Instant now) {
        return new ApplicationSession(sessionId, scope, userId, userType, clientId, createdAt, now, payload, false);
    }
}
