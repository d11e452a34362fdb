package turnstile.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import turnstile.core.model.token.TokenRecord;

/**
 * Outbound port for token persistence.
 *
 * <p>The store exclusively owns token state. Apart from the initial
 * {@link #insert}, the only write to an existing row is
 * {@link #compareAndSetModifiedAt}; unconditional updates of
 * {@code modified_at} are not part of this contract.
 *
 * <p>Every operation fails with {@link TokenStoreException} on backend errors.
 */
public interface TokenStore {

    /**
     * Store a new token record.
     *
     * <p>Implementation notes:
     * <ul>
     *   <li>JDBC: plain INSERT, primary key violation mapped to a conflict</li>
     *   <li>In-Memory: ConcurrentMap.putIfAbsent()</li>
     * </ul>
     *
     * @param record the record to insert
     * @return Uni completing when stored; fails with {@link TokenConflictException}
     *     if the token already exists
     */
    Uni<Void> insert(TokenRecord record);

    /**
     * Retrieve a token record. No side effects.
     *
     * @param token the token
     * @return the record, or empty if not found
     */
    Uni<Optional<TokenRecord>> findByToken(String token);

    /**
     * Atomically move {@code modified_at} from {@code expectedModifiedAt} to
     * {@code newModifiedAt}.
     *
     * <p>This must be a single atomic operation at the store level (a
     * conditional update), never a read followed by a write.
     *
     * @param token the token
     * @param expectedModifiedAt the value the caller last observed
     * @param newModifiedAt the value to store
     * @return the updated record, or empty if the stored value differed or the
     *     record does not exist
     */
    Uni<Optional<TokenRecord>> compareAndSetModifiedAt(String token, long expectedModifiedAt, long newModifiedAt);

    /**
     * Delete a token record.
     *
     * @param token the token
     * @return true if a record was removed
     */
    Uni<Boolean> delete(String token);

    /**
     * Delete every record whose payload {@code user_id} equals the given identifier.
     *
     * @param userId user identifier
     * @return number of records removed
     */
    Uni<Long> deleteByUserId(String userId);

    /**
     * Delete every record with {@code modified_at < cutoff}.
     *
     * @param cutoffEpochSeconds exclusive upper bound for {@code modified_at}
     * @return number of records removed
     */
    Uni<Long> deleteOlderThan(long cutoffEpochSeconds);
}
