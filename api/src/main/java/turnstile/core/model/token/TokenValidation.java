package turnstile.core.model.token;

import java.util.Map;

/**
 * Result of a successful token validation.
 *
 * @param record the token record as it stands after validation
 * @param renewed true if this call extended the token's lifetime
 * @param expiresAt epoch seconds at which the adopted record expires
 */
public record TokenValidation(TokenRecord record, boolean renewed, long expiresAt) {

    /**
     * Returns the payload stored with the token.
     */
    public Map<String, Object> payload() {
        return record.payload();
    }
}
