package turnstile.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the token lifecycle.
 *
 * <p>Configuration prefix: {@code turnstile.token}
 *
 * <p>The TTL and renewal threshold are sourced from the
 * {@code TOKEN_TTL_SECONDS} and {@code TOKEN_RENEW_THRESHOLD_SECONDS}
 * environment variables in {@code application.properties}.
 */
@ConfigMapping(prefix = "turnstile.token")
public interface TokenConfig {

    /**
     * Maximum token age in seconds without renewal.
     *
     * @return TTL in seconds (default: 300)
     */
    @WithDefault("300")
    long ttlSeconds();

    /**
     * Token age in seconds from which a renewing validation extends the token.
     *
     * @return renewal threshold in seconds (default: 30)
     */
    @WithDefault("30")
    long renewThresholdSeconds();

    /**
     * Server-side secret mixed into every generated token.
     *
     * @return secret (default: local_secret)
     */
    @WithDefault("local_secret")
    String secret();

    /**
     * Token generation configuration.
     */
    IdGenerationConfig idGeneration();

    /**
     * Background sweep configuration.
     */
    SweepConfig sweep();

    /**
     * Storage configuration.
     */
    StorageConfig storage();

    /**
     * Token generation options.
     */
    interface IdGenerationConfig {

        /**
         * Maximum attempts to store a freshly generated token.
         *
         * <p>A collision with an existing token makes issuance retry with a
         * new value, up to this many attempts in total.
         *
         * @return max attempts (default: 3)
         */
        @WithDefault("3")
        int maxRetries();
    }

    /**
     * Background sweep options.
     */
    interface SweepConfig {

        /**
         * Schedule the periodic sweep of expired tokens.
         *
         * @return true if the sweep runs (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }

    /**
     * Storage options.
     */
    interface StorageConfig {

        /**
         * Storage provider name.
         *
         * <p>Available providers: jdbc, memory, or custom SPI name.
         *
         * @return provider name (default: jdbc)
         */
        @WithDefault("jdbc")
        String provider();

        /**
         * JDBC storage configuration.
         */
        JdbcConfig jdbc();

        /**
         * JDBC storage options.
         */
        interface JdbcConfig {

            /**
             * Name of the token table.
             *
             * @return table name (default: tokens_cache)
             */
            @WithDefault("tokens_cache")
            String table();

            /**
             * Create the token table at startup if it does not exist.
             *
             * @return true to run the schema script (default: true)
             */
            @WithDefault("true")
            boolean createTable();
        }
    }
}
