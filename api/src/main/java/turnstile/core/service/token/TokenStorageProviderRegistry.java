package turnstile.core.service.token;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import turnstile.core.config.TokenConfig;
import turnstile.core.port.out.TokenStore;
import turnstile.spi.TokenStorageProvider;

/**
 * Registry for token storage providers.
 *
 * <p>Discovers available providers via CDI and selects one based on
 * configuration and availability:
 * <ol>
 *   <li>Configured provider (turnstile.token.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 *   <li>Memory fallback (always available)</li>
 * </ol>
 */
@ApplicationScoped
public class TokenStorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(TokenStorageProviderRegistry.class);

    private final Instance<TokenStorageProvider> providers;
    private final TokenConfig config;

    private volatile TokenStorageProvider selectedProvider;
    private volatile TokenStore store;

    @Inject
    public TokenStorageProviderRegistry(Instance<TokenStorageProvider> providers, TokenConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Select the provider and create its store at startup.
     *
     * <p>Provider checks and schema creation may block, so they run here on
     * the startup thread rather than lazily inside the first request.
     */
    void onStart(@Observes StartupEvent event) {
        getStore();
        LOG.infof("Token storage provider initialized: %s", selectedProvider.name());
    }

    /**
     * Get the token store of the selected provider.
     *
     * @return token store instance
     */
    public TokenStore getStore() {
        TokenStore current = store;
        if (current == null) {
            synchronized (this) {
                if (store == null) {
                    store = getSelectedProvider().createStore();
                }
                current = store;
            }
        }
        return current;
    }

    /**
     * Get the selected storage provider.
     *
     * @return selected provider
     */
    public TokenStorageProvider getSelectedProvider() {
        TokenStorageProvider current = selectedProvider;
        if (current == null) {
            synchronized (this) {
                if (selectedProvider == null) {
                    selectedProvider = selectProvider();
                }
                current = selectedProvider;
            }
        }
        return current;
    }

    private TokenStorageProvider selectProvider() {
        String configuredProvider = config.storage().provider();
        List<TokenStorageProvider> availableProviders = providers.stream()
                .filter(TokenStorageProvider::isAvailable)
                .sorted(Comparator.comparingInt(TokenStorageProvider::priority).reversed())
                .toList();

        LOG.debugf(
                "Available token storage providers: %s",
                availableProviders.stream().map(TokenStorageProvider::name).toList());

        Optional<TokenStorageProvider> configured = availableProviders.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();

        if (configured.isPresent()) {
            LOG.infof("Using configured token storage provider: %s", configuredProvider);
            return configured.get();
        }

        if (!configuredProvider.equals("memory")) {
            LOG.warnf("Configured token storage provider '%s' is not available, falling back", configuredProvider);
        }

        if (!availableProviders.isEmpty()) {
            TokenStorageProvider provider = availableProviders.get(0);
            LOG.infof("Using token storage provider: %s (priority: %d)", provider.name(), provider.priority());
            return provider;
        }

        // The memory provider is always available
        throw new IllegalStateException("No token storage providers available");
    }
}
