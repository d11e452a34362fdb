package turnstile.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import turnstile.core.port.out.TokenStore;

/**
 * SPI for token storage implementations.
 *
 * <p>Platform teams can implement this interface to back tokens with another
 * ACID store. Implementations must provide an atomic compare-and-set on
 * {@code modified_at}.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>jdbc (priority: 100) - relational storage through the default datasource</li>
 *   <li>memory (priority: 0) - in-memory storage (development only)</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider (turnstile.token.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 *   <li>Memory fallback (always available)</li>
 * </ol>
 */
public interface TokenStorageProvider {

    /**
     * Return the provider name for configuration selection.
     *
     * @return provider name (e.g., "jdbc", "memory")
     */
    String name();

    /**
     * Return the provider priority for automatic selection.
     *
     * @return priority value (higher = more preferred)
     */
    int priority();

    /**
     * Check if this provider is available and ready to use.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create the token store. Repeated calls return the same instance.
     *
     * @return token store instance
     * @throws StorageProviderException if the store cannot be initialized
     */
    TokenStore createStore();

    /**
     * Report the health of this storage backend.
     *
     * @return health check response, or empty if not supported
     */
    Optional<HealthCheckResponse> healthCheck();
}
