package turnstile.core.port.out;

/**
 * An insert collided with an existing token.
 */
public class TokenConflictException extends TokenStoreException {

    public TokenConflictException(String message) {
        super(message);
    }

    public TokenConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
