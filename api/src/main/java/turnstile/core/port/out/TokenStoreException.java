package turnstile.core.port.out;

/**
 * Failure of the underlying token persistence: connectivity, constraint
 * violation, serialization or timeout.
 *
 * <p>Propagated unchanged to callers, who should surface it as a server error.
 */
public class TokenStoreException extends RuntimeException {

    public TokenStoreException(String message) {
        super(message);
    }

    public TokenStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
