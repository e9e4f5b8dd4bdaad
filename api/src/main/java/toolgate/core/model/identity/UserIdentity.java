package toolgate.core.model.identity;

import java.util.Map;
import java.util.Objects;

import toolgate.core.util.SecureHash;

/**
 * Caller identity derived from request metadata.
 *
 * <p>Identities are never persisted on their own. Sessions store the
 * {@link #identityHash()} together with the denormalized {@code userId} and
 * {@code userType}.
 *
 * @param userId     stable, privacy-preserving user identifier
 * @param userType   caller category
 * @param metadata   non-sensitive attributes gathered during resolution
 * @param authMethod how the identity was derived
 */
public record UserIdentity(String userId, UserType userType, Map<String, String> metadata, AuthMethod authMethod) {

    private static final int IDENTITY_HASH_HEX_CHARS = 32;

    public UserIdentity {
        Objects.requireNonNull(userId, "userId cannot be null");
        Objects.requireNonNull(userType, "userType cannot be null");
        Objects.requireNonNull(authMethod, "authMethod cannot be null");
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    /**
     * Partition key for this identity.
     *
     * <p>Equal {@code (userId, userType, authMethod)} triples always produce the
     * same hash, in any process.
     *
     * @return 32 lowercase hex characters
     */
    public String identityHash() {
        return SecureHash.truncatedSha256(
                userId + ":" + userType.wireName() + ":" + authMethod.wireName(), IDENTITY_HASH_HEX_CHARS);
    }

    public boolean isAnonymous() {
        return authMethod == AuthMethod.ANONYMOUS;
    }
}
