package toolgate.core.service.session;

import java.security.SecureRandom;
import java.util.HexFormat;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Generates session ids in the transport's format: 16 random bytes as 32
 * lowercase hex characters.
 */
@ApplicationScoped
public class SessionIdGenerator {

    private static final int SESSION_ID_BYTES = 16; // 128 bits
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    public String generate() {
        byte[] bytes = new byte[SESSION_ID_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
