package turnstile.spi;

/**
 * Exception thrown when a token storage provider cannot be initialized,
 * e.g. because its datasource is missing or the schema script fails.
 */
public class StorageProviderException extends RuntimeException {

    private final String provider;

    public StorageProviderException(String provider, String message) {
        super("[" + provider + "] " + message);
        this.provider = provider;
    }

    public StorageProviderException(String provider, String message, Throwable cause) {
        super("[" + provider + "] " + message, cause);
        this.provider = provider;
    }

    /** Returns the name of the provider that failed. */
    public String getProvider() {
        return provider;
    }
}
