package turnstile.adapter.out.storage.memory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.model.token.TokenRecord;
import turnstile.core.port.out.TokenConflictException;
import turnstile.core.port.out.TokenStore;
import turnstile.core.util.SecureHash;

/**
 * In-memory implementation of TokenStore.
 *
 * <p>This implementation is intended for development and testing only.
 * Tokens are lost on restart and not shared across instances.
 *
 * <p>The compare-and-set is a single {@link ConcurrentMap#computeIfPresent}
 * call, which is atomic per key.
 */
public class InMemoryTokenStore implements TokenStore {

    private static final Logger LOG = Logger.getLogger(InMemoryTokenStore.class);

    private final ConcurrentMap<String, TokenRecord> records = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> insert(TokenRecord record) {
        return Uni.createFrom().item(() -> {
            TokenRecord stored = new TokenRecord(record.token(), copyOf(record.payload()), record.modifiedAt());
            TokenRecord existing = records.putIfAbsent(record.token(), stored);
            if (existing != null) {
                throw new TokenConflictException("Token already exists: " + SecureHash.fingerprint(record.token()));
            }
            return null;
        });
    }

    @Override
    public Uni<Optional<TokenRecord>> findByToken(String token) {
        return Uni.createFrom().item(() -> Optional.ofNullable(records.get(token)));
    }

    @Override
    public Uni<Optional<TokenRecord>> compareAndSetModifiedAt(String token, long expectedModifiedAt, long newModifiedAt) {
        return Uni.createFrom().item(() -> {
            AtomicReference<TokenRecord> updated = new AtomicReference<>();
            records.computeIfPresent(token, (key, current) -> {
                if (current.modifiedAt() != expectedModifiedAt) {
                    return current;
                }
                TokenRecord next = current.withModifiedAt(newModifiedAt);
                updated.set(next);
                return next;
            });
            return Optional.ofNullable(updated.get());
        });
    }

    @Override
    public Uni<Boolean> delete(String token) {
        return Uni.createFrom().item(() -> records.remove(token) != null);
    }

    @Override
    public Uni<Long> deleteByUserId(String userId) {
        return Uni.createFrom().item(() -> {
            long removed = removeMatching(record -> record.userId().map(userId::equals).orElse(false));
            LOG.debugf("Deleted %d tokens for user %s", removed, userId);
            return removed;
        });
    }

    @Override
    public Uni<Long> deleteOlderThan(long cutoffEpochSeconds) {
        return Uni.createFrom().item(() -> removeMatching(record -> record.modifiedAt() < cutoffEpochSeconds));
    }

    /**
     * Return the current token count (for testing and health reporting).
     */
    public int size() {
        return records.size();
    }

    private long removeMatching(Predicate<TokenRecord> predicate) {
        long removed = 0;
        for (var entry : records.entrySet()) {
            // remove(key, value) skips records renewed since they were read
            if (predicate.test(entry.getValue()) && records.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    private static Map<String, Object> copyOf(Map<String, Object> payload) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
