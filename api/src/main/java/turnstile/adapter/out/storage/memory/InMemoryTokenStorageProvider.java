package turnstile.adapter.out.storage.memory;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import turnstile.core.port.out.TokenStore;
import turnstile.spi.TokenStorageProvider;

/**
 * In-memory token storage provider.
 *
 * <p>This provider is always available and serves as a fallback when no
 * datasource is configured.
 *
 * <p><strong>Warning:</strong> tokens are not shared between instances and
 * are lost on restart. Not recommended for production.
 */
@ApplicationScoped
public class InMemoryTokenStorageProvider implements TokenStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryTokenStorageProvider.class);
    private static final int PRIORITY = 0; // Lowest priority - fallback only

    private InMemoryTokenStore store;

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized TokenStore createStore() {
        if (store == null) {
            LOG.warn("Token storage is in-memory only; tokens are lost on restart and not shared across instances");
            store = new InMemoryTokenStore();
        }
        return store;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("token-storage-memory")
                .up()
                .withData("type", "in-memory")
                .withData("tokens", currentSize())
                .build());
    }

    private synchronized long currentSize() {
        return store != null ? store.size() : 0;
    }
}
