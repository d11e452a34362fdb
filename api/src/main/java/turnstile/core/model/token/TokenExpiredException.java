package turnstile.core.model.token;

/**
 * The token existed but had aged past its TTL when it was validated.
 */
public class TokenExpiredException extends TokenRejectedException {

    private final long expiredAt;

    public TokenExpiredException(long expiredAt) {
        super("Token expired at " + expiredAt);
        this.expiredAt = expiredAt;
    }

    /** Returns the epoch second at which the token expired. */
    public long getExpiredAt() {
        return expiredAt;
    }
}
