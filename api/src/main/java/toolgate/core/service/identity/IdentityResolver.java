package toolgate.core.service.identity;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;

import toolgate.core.model.identity.AuthMethod;
import toolgate.core.model.identity.RequestMetadata;
import toolgate.core.model.identity.UserIdentity;
import toolgate.core.model.identity.UserType;
import toolgate.core.util.SecureHash;

/**
 * Derives a {@link UserIdentity} from raw request metadata.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>{@code Bearer <token>}: the token's unverified {@code sub} (or {@code user_id})
 *       claim, else a synthetic id derived from a hash of the token</li>
 *   <li>{@code ApiKey <key>}: an id derived from a hash of the key</li>
 *   <li>Anything else: an anonymous id derived from client address and user agent</li>
 * </ol>
 *
 * <p>Claims are read for partitioning only. Token verification happens upstream;
 * nothing here is a trust decision. Resolution never fails: malformed input
 * degrades to an anonymous identity. Raw credentials are never logged or stored.
 */
@ApplicationScoped
public class IdentityResolver {

    private static final Logger LOG = Logger.getLogger(IdentityResolver.class);

    private static final String BEARER_SCHEME = "bearer";
    private static final String API_KEY_SCHEME = "apikey";
    private static final String SUBJECT_FALLBACK_CLAIM = "user_id";

    private static final int ID_HASH_CHARS = 12;
    private static final int KEY_FINGERPRINT_CHARS = 8;

    // Signature checks happen upstream; this consumer only decodes claims
    private static final JwtConsumer CLAIMS_READER = new JwtConsumerBuilder()
            .setSkipSignatureVerification()
            .setDisableRequireSignature()
            .setSkipAllValidators()
            .setRelaxVerificationKeyValidation()
            .build();

    /**
     * Resolve the identity for a request.
     */
    public UserIdentity resolve(RequestMetadata metadata) {
        RequestMetadata request = metadata != null ? metadata : RequestMetadata.empty();
        Optional<String> credential = request.credential();
        if (credential.isPresent()) {
            String[] parts = credential.get().split("\\s+", 2);
            if (parts.length == 2 && !parts[1].isBlank()) {
                String scheme = parts[0].toLowerCase(Locale.ROOT);
                if (BEARER_SCHEME.equals(scheme)) {
                    return fromBearerToken(parts[1].trim());
                }
                if (API_KEY_SCHEME.equals(scheme)) {
                    return fromApiKey(parts[1].trim());
                }
            }
            LOG.debug("Unrecognized credential scheme, resolving caller as anonymous");
        }
        return anonymous(request);
    }

    private UserIdentity fromBearerToken(String token) {
        // Whole token: JWTs sharing a header must not share a synthetic id
        String userId = readSubject(token)
                .orElseGet(() -> "jwt_user_" + SecureHash.truncatedSha256(token, ID_HASH_CHARS));
        return new UserIdentity(userId, UserType.AUTHENTICATED_USER, Map.of("token_type", "bearer"), AuthMethod.JWT);
    }

    private UserIdentity fromApiKey(String apiKey) {
        String keyHash = SecureHash.sha256Hex(apiKey);
        return new UserIdentity(
                "api_user_" + keyHash.substring(0, ID_HASH_CHARS),
                UserType.SERVICE_ACCOUNT,
                Map.of("api_key_hash", keyHash.substring(0, KEY_FINGERPRINT_CHARS)),
                AuthMethod.API_KEY);
    }

    private UserIdentity anonymous(RequestMetadata request) {
        String fingerprint = SecureHash.truncatedSha256(request.clientIp() + ":" + request.userAgent(), ID_HASH_CHARS);
        return new UserIdentity(
                "anonymous_" + fingerprint,
                UserType.ANONYMOUS,
                Map.of("client_ip", request.clientIp(), "user_agent", request.userAgent()),
                AuthMethod.ANONYMOUS);
    }

    private Optional<String> readSubject(String token) {
        try {
            JwtClaims claims = CLAIMS_READER.processToClaims(token);
            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                subject = claims.getStringClaimValue(SUBJECT_FALLBACK_CLAIM);
            }
            return Optional.ofNullable(subject).filter(s -> !s.isBlank());
        } catch (InvalidJwtException | MalformedClaimException e) {
            LOG.debugf("Bearer token claims unreadable, using synthetic user id: %s", e.getClass().getSimpleName());
            return Optional.empty();
        }
    }
}
