package turnstile.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import turnstile.core.service.token.TokenStorageProviderRegistry;
import turnstile.spi.TokenStorageProvider;

/**
 * Readiness check for the selected token storage provider.
 *
 * <p>Reports DOWN when the provider reports its backend as unreachable;
 * token validation cannot succeed without the store.
 */
@Readiness
@ApplicationScoped
public class TokenStorageHealthCheck implements HealthCheck {

    private final TokenStorageProviderRegistry registry;

    @Inject
    public TokenStorageHealthCheck(TokenStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        TokenStorageProvider provider = registry.getSelectedProvider();
        return provider.healthCheck()
                .orElseGet(() -> HealthCheckResponse.named("token-storage-" + provider.name())
                        .up()
                        .withData("type", provider.name())
                        .build());
    }
}
