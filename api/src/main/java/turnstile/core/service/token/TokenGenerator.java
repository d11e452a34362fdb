package turnstile.core.service.token;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import turnstile.core.config.TokenConfig;
import turnstile.core.util.SecureHash;

/**
 * Generate unguessable session tokens.
 *
 * <p>A token is the hex-encoded SHA-256 digest of the server secret, 32 bytes
 * (256 bits) of secure random data and the issue time as a big-endian long.
 * The store remains the source of truth; the digest is only an identifier and
 * is never verified on its own.
 */
@ApplicationScoped
public class TokenGenerator {

    private static final int RANDOM_BYTES = 32; // 256 bits
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final byte[] secret;

    @Inject
    public TokenGenerator(TokenConfig config) {
        this(config.secret());
    }

    TokenGenerator(String secret) {
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Generate a new token.
     *
     * @param issuedAtEpochSeconds issue time mixed into the digest
     * @return a 64-character lowercase hex token
     */
    public String generate(long issuedAtEpochSeconds) {
        byte[] random = new byte[RANDOM_BYTES];
        SECURE_RANDOM.nextBytes(random);
        byte[] timestamp = ByteBuffer.allocate(Long.BYTES).putLong(issuedAtEpochSeconds).array();
        return SecureHash.sha256Hex(secret, random, timestamp);
    }
}
