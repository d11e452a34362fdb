package turnstile.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers for token generation and log-safe token fingerprints.
 */
public final class SecureHash {

    private static final int FINGERPRINT_HEX_CHARS = 12;

    private SecureHash() {}

    /**
     * Return the lowercase hex SHA-256 digest over the concatenation of the given parts.
     *
     * @param parts byte arrays fed to the digest in order
     * @return 64-character hex digest
     */
    public static String sha256Hex(byte[]... parts) {
        final var digest = newDigest();
        for (byte[] part : parts) {
            digest.update(part);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Return a short digest of a token suitable for logs.
     *
     * <p>Tokens are bearer credentials and are never logged verbatim; the
     * fingerprint still lets operators correlate log lines for one token.
     *
     * @param token the token, may be null
     * @return the first 12 hex characters of the token's SHA-256 digest
     */
    public static String fingerprint(String token) {
        if (token == null) {
            return "null";
        }
        return sha256Hex(token.getBytes(StandardCharsets.UTF_8)).substring(0, FINGERPRINT_HEX_CHARS);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 is required on every Java platform", e);
        }
    }
}
