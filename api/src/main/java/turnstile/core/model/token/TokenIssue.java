package turnstile.core.model.token;

/**
 * Result of a successful token issuance.
 *
 * @param token the newly issued token
 * @param expiresAt epoch seconds after which the token is no longer valid unless renewed
 */
public record TokenIssue(String token, long expiresAt) {}
