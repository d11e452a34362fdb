package turnstile.core.model.token;

/**
 * The token was never issued, has been revoked, or has already been swept.
 */
public class TokenNotFoundException extends TokenRejectedException {

    public TokenNotFoundException() {
        super("Token not found");
    }
}
