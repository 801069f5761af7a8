package warden.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 fingerprints of sensitive values.
 *
 * <p>Used to key cache entries by token without ever storing the token itself.
 */
public final class SecureHash {

    private SecureHash() {}

    /**
     * Return the full lowercase SHA-256 hex digest of the input string.
     *
     * @param input the string to hash
     * @return 64-character hex digest
     */
    public static String sha256Hex(String input) {
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            final var hashBytes = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashBytes);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 is required on every JVM", e);
        }
    }
}
