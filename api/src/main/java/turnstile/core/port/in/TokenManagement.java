package turnstile.core.port.in;

import java.util.Map;

import io.smallrye.mutiny.Uni;

import turnstile.core.model.token.TokenIssue;
import turnstile.core.model.token.TokenPolicy;
import turnstile.core.model.token.TokenValidation;

/**
 * Inbound port for the session token lifecycle.
 *
 * <p>This is the contract the HTTP-facing layer calls: issue a token after a
 * successful login, validate it on every protected request, revoke it on
 * logout, and revoke every token of a user when the account is deleted.
 */
public interface TokenManagement {

    /**
     * Issues a new token for an authenticated caller.
     *
     * @param payload claims to store with the token, returned verbatim on validation
     * @return the token and its expiry
     * @throws TokenIssueException if no unique token could be stored
     */
    Uni<TokenIssue> issue(Map<String, Object> payload);

    /**
     * Validates a token, optionally renewing it.
     *
     * <p>The returned Uni fails with
     * {@link turnstile.core.model.token.TokenNotFoundException} or
     * {@link turnstile.core.model.token.TokenExpiredException} when
     * authentication must be denied, and with
     * {@link turnstile.core.port.out.TokenStoreException} when the store fails.
     *
     * @param token the token presented by the caller
     * @param renewIfNeeded extend the token's lifetime if it is past the renewal threshold
     * @return the validated record, whether it was renewed, and its expiry
     */
    Uni<TokenValidation> validate(String token, boolean renewIfNeeded);

    /**
     * Revokes a single token (logout).
     *
     * @param token the token
     * @return true if the token existed
     */
    Uni<Boolean> revoke(String token);

    /**
     * Revokes every token whose payload carries the given user identifier.
     *
     * @param userId user identifier
     * @return number of tokens revoked
     */
    Uni<Long> revokeAllForUser(String userId);

    /**
     * Returns the lifetime policy applied to every token.
     *
     * @return TTL and renewal threshold captured from configuration
     */
    TokenPolicy policy();

    /**
     * Deletes every token past its TTL.
     *
     * @return number of tokens removed
     */
    Uni<Long> sweep();

    /**
     * Exception thrown when token issuance fails.
     */
    class TokenIssueException extends RuntimeException {
        public TokenIssueException(String message) {
            super(message);
        }

        public TokenIssueException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
