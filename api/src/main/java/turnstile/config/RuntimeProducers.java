package turnstile.config;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Default;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.quarkus.arc.DefaultBean;

/**
 * Provides default infrastructure beans.
 *
 * <p>Each bean is a {@link DefaultBean}, so an application (or a test profile)
 * that produces its own replaces it.
 */
@ApplicationScoped
public class RuntimeProducers {

    /**
     * Provides the clock used for token timestamps.
     *
     * @return the system UTC clock
     */
    @Produces
    @Singleton
    @DefaultBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Provides a fallback MeterRegistry when the Micrometer extension has no registry backend.
     *
     * @return a simple in-memory meter registry
     */
    @Produces
    @Singleton
    @DefaultBean
    @Default
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
