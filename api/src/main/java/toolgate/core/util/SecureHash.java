package toolgate.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 digests for identifiers that must be stable but must not expose the
 * value they were derived from (API keys, tokens, client addresses).
 */
public final class SecureHash {

    private static final int MAX_HEX_CHARS = 64;

    private SecureHash() {}

    /**
     * Return the first {@code hexChars} characters of the SHA-256 hex digest of the input.
     *
     * @param input    the string to hash
     * @param hexChars number of hex characters to return (1-64)
     * @return lowercase truncated hex digest
     * @throws IllegalArgumentException if hexChars is outside 1-64
     */
    public static String truncatedSha256(String input, int hexChars) {
        if (hexChars < 1 || hexChars > MAX_HEX_CHARS) {
            throw new IllegalArgumentException("hexChars must be between 1 and " + MAX_HEX_CHARS + ", got " + hexChars);
        }
        return sha256Hex(input).substring(0, hexChars);
    }

    /**
     * Full 64-character SHA-256 hex digest.
     */
    public static String sha256Hex(String input) {
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 is required on every JDK", e);
        }
    }
}
