package turnstile.core.model.token;

/**
 * Base type for validation outcomes that deny authentication.
 *
 * <p>These are expected, frequent outcomes. Callers map them to an
 * authentication failure and never retry them.
 */
public abstract class TokenRejectedException extends RuntimeException {

    protected TokenRejectedException(String message) {
        super(message);
    }
}
