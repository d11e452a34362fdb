package turnstile.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import turnstile.config.TelemetryConfigMapping;
import turnstile.core.port.out.TokenMetrics;

/**
 * Records token lifecycle metrics using Micrometer.
 *
 * <p>All methods are no-ops when telemetry is disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code turnstile.tokens.issued} - Tokens issued</li>
 *   <li>{@code turnstile.tokens.issue.collisions} - Issue attempts that hit an existing token</li>
 *   <li>{@code turnstile.tokens.validations} - Validations by outcome</li>
 *   <li>{@code turnstile.tokens.renewal.conflicts} - Renewals that lost the compare-and-set</li>
 *   <li>{@code turnstile.tokens.revoked} - Revoked tokens by reason</li>
 *   <li>{@code turnstile.tokens.swept} - Tokens removed by the background sweep</li>
 *   <li>{@code turnstile.tokens.sweep.failures} - Failed sweep iterations</li>
 * </ul>
 */
@ApplicationScoped
public class TokenLifecycleMetrics implements TokenMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public TokenLifecycleMetrics(MeterRegistry registry, TelemetryConfigMapping config) {
        this(registry, config != null && config.enabled() && config.metrics().enabled());
    }

    public TokenLifecycleMetrics(MeterRegistry registry, boolean enabled) {
        this.registry = registry;
        this.enabled = enabled;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordIssued() {
        increment("turnstile.tokens.issued", "Number of tokens issued");
    }

    @Override
    public void recordIssueCollision() {
        increment("turnstile.tokens.issue.collisions", "Number of issue attempts that collided with an existing token");
    }

    @Override
    public void recordValidation(ValidationOutcome outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("turnstile.tokens.validations")
                .description("Number of token validations by outcome")
                .tag("outcome", outcome.name().toLowerCase())
                .register(registry)
                .increment();
    }

    @Override
    public void recordRenewalConflict() {
        increment("turnstile.tokens.renewal.conflicts", "Number of renewals that lost a concurrent compare-and-set");
    }

    @Override
    public void recordRevoked(String reason, long count) {
        if (!enabled || count <= 0) {
            return;
        }

        Counter.builder("turnstile.tokens.revoked")
                .description("Number of revoked tokens")
                .tag("reason", reason)
                .register(registry)
                .increment(count);
    }

    @Override
    public void recordSwept(long count) {
        if (!enabled || count <= 0) {
            return;
        }

        Counter.builder("turnstile.tokens.swept")
                .description("Number of expired tokens removed by the background sweep")
                .register(registry)
                .increment(count);
    }

    @Override
    public void recordSweepFailure() {
        increment("turnstile.tokens.sweep.failures", "Number of failed sweep iterations");
    }

    private void increment(String name, String description) {
        if (!enabled) {
            return;
        }

        Counter.builder(name).description(description).register(registry).increment();
    }
}
