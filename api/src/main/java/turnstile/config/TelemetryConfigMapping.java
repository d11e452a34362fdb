package turnstile.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry features.
 *
 * <p>Example configuration:
 * <pre>{@code
 * turnstile.telemetry.enabled=true
 * turnstile.telemetry.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "turnstile.telemetry")
public interface TelemetryConfigMapping {

    /**
     * Master toggle for all telemetry features.
     * When disabled, all sub-features are also disabled regardless of their individual settings.
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Metrics configuration for Micrometer metrics collection.
     */
    MetricsConfig metrics();

    /**
     * Metrics configuration.
     */
    interface MetricsConfig {
        /**
         * Enable token lifecycle metrics.
         * Requires turnstile.telemetry.enabled=true to take effect.
         */
        @WithDefault("true")
        boolean enabled();
    }
}
