package turnstile.core.model.token;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Persisted session state for one issued token.
 *
 * <p>The payload is opaque to the lifecycle manager and is stored and returned
 * verbatim. The only field the core ever reads is {@value #USER_ID_FIELD},
 * used for bulk revocation.
 *
 * @param token opaque unique identifier (hex-encoded digest)
 * @param payload caller-supplied claims, e.g. user identity
 * @param modifiedAt epoch seconds of creation or last renewal
 */
public record TokenRecord(String token, Map<String, Object> payload, long modifiedAt) {

    /**
     * Payload field carrying the owning user's identifier.
     */
    public static final String USER_ID_FIELD = "user_id";

    public TokenRecord {
        Objects.requireNonNull(token, "token must not be null");
        payload = payload == null ? Map.of() : payload;
    }

    /**
     * Creates a copy with an updated modification timestamp.
     */
    public TokenRecord withModifiedAt(long modifiedAt) {
        return new TokenRecord(token, payload, modifiedAt);
    }

    /**
     * Returns the user identifier carried in the payload, rendered as a string.
     *
     * <p>Numeric identifiers are rendered in plain decimal notation without a
     * trailing fractional zero, so a payload of {@code {"user_id": 42}} matches
     * a revocation for {@code "42"}; identifiers beyond the {@code long} range
     * keep every digit.
     */
    public Optional<String> userId() {
        return userIdOf(payload);
    }

    /**
     * Extracts the user identifier from a payload map.
     *
     * @param payload token payload, may be null
     * @return the identifier as a string, or empty if absent
     */
    public static Optional<String> userIdOf(Map<String, Object> payload) {
        if (payload == null) {
            return Optional.empty();
        }
        Object value = payload.get(USER_ID_FIELD);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number number) {
            return Optional.of(render(number));
        }
        return Optional.of(value.toString());
    }

    private static String render(Number number) {
        try {
            // 42.0 renders as 42, 1.0E20 keeps all 21 digits
            return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
        } catch (NumberFormatException e) {
            // NaN and infinities
            return number.toString();
        }
    }
}
