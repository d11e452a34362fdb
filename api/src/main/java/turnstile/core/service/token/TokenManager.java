package turnstile.core.service.token;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.config.TokenConfig;
import turnstile.core.model.token.TokenExpiredException;
import turnstile.core.model.token.TokenIssue;
import turnstile.core.model.token.TokenNotFoundException;
import turnstile.core.model.token.TokenPolicy;
import turnstile.core.model.token.TokenRecord;
import turnstile.core.model.token.TokenRejectedException;
import turnstile.core.model.token.TokenValidation;
import turnstile.core.port.in.TokenManagement;
import turnstile.core.port.out.TokenConflictException;
import turnstile.core.port.out.TokenMetrics;
import turnstile.core.port.out.TokenMetrics.ValidationOutcome;
import turnstile.core.port.out.TokenStore;
import turnstile.core.util.SecureHash;

/**
 * Implementation of the token lifecycle.
 *
 * <p>Handles issuance with collision retry, validation with optimistic
 * renewal, revocation and the expiry sweep. The manager keeps no token state
 * in memory; every operation is a point query or mutation against the store,
 * so a single instance is shared by all request workers without locking.
 *
 * <p>Renewal relies on {@link TokenStore#compareAndSetModifiedAt}: when several
 * validations race to renew the same token, exactly one compare-and-set wins
 * and the others re-read the record the winner wrote.
 */
@ApplicationScoped
public class TokenManager implements TokenManagement {

    private static final Logger LOG = Logger.getLogger(TokenManager.class);

    private final TokenStorageProviderRegistry storageRegistry;
    private final TokenGenerator generator;
    private final TokenPolicy policy;
    private final int maxIssueAttempts;
    private final Clock clock;
    private final TokenMetrics metrics;

    @Inject
    public TokenManager(
            TokenStorageProviderRegistry storageRegistry,
            TokenGenerator generator,
            TokenConfig config,
            Clock clock,
            TokenMetrics metrics) {
        this.storageRegistry = storageRegistry;
        this.generator = generator;
        this.policy = new TokenPolicy(config.ttlSeconds(), config.renewThresholdSeconds());
        this.maxIssueAttempts = Math.max(1, config.idGeneration().maxRetries());
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    public TokenPolicy policy() {
        return policy;
    }

    @Override
    public Uni<TokenIssue> issue(Map<String, Object> payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        long now = now();
        return issueWithRetry(payload, now, 0);
    }

    private Uni<TokenIssue> issueWithRetry(Map<String, Object> payload, long now, int attempt) {
        if (attempt >= maxIssueAttempts) {
            return Uni.createFrom()
                    .failure(new TokenIssueException(
                            "Failed to store a unique token after " + maxIssueAttempts + " attempts"));
        }

        String token = generator.generate(now);
        return getStore()
                .insert(new TokenRecord(token, payload, now))
                .map(v -> {
                    metrics.recordIssued();
                    LOG.debugf("Token issued: %s", SecureHash.fingerprint(token));
                    return new TokenIssue(token, policy.expiresAt(now));
                })
                .onFailure(TokenConflictException.class)
                .recoverWithUni(e -> {
                    metrics.recordIssueCollision();
                    LOG.warnf("Token collision detected (attempt %d/%d), retrying", attempt + 1, maxIssueAttempts);
                    return issueWithRetry(payload, now, attempt + 1);
                });
    }

    @Override
    public Uni<TokenValidation> validate(String token, boolean renewIfNeeded) {
        if (token == null || token.isBlank()) {
            metrics.recordValidation(ValidationOutcome.NOT_FOUND);
            return Uni.createFrom().failure(new TokenNotFoundException());
        }

        TokenStore store = getStore();
        return store.findByToken(token)
                .flatMap(found -> {
                    if (found.isEmpty()) {
                        return Uni.createFrom().<TokenValidation>failure(new TokenNotFoundException());
                    }

                    TokenRecord record = found.get();
                    long now = now();

                    if (policy.isExpired(record.modifiedAt(), now)) {
                        return expire(store, record);
                    }

                    if (!renewIfNeeded || !policy.shouldRenew(record.modifiedAt(), now)) {
                        return Uni.createFrom().item(toValidation(record, false));
                    }

                    return renew(store, record, now);
                })
                .invoke(validation ->
                        metrics.recordValidation(validation.renewed() ? ValidationOutcome.RENEWED : ValidationOutcome.VALID))
                .onFailure()
                .invoke(this::recordValidationFailure);
    }

    private Uni<TokenValidation> renew(TokenStore store, TokenRecord record, long now) {
        String token = record.token();
        return store.compareAndSetModifiedAt(token, record.modifiedAt(), now).flatMap(updated -> {
            if (updated.isPresent()) {
                LOG.debugf("Token renewed: %s", SecureHash.fingerprint(token));
                return Uni.createFrom().item(toValidation(updated.get(), true));
            }

            // Lost the race: someone else renewed or deleted the record
            metrics.recordRenewalConflict();
            LOG.debugf("Concurrent renewal detected for token %s, re-reading", SecureHash.fingerprint(token));
            return store.findByToken(token).flatMap(current -> adoptAfterConflict(store, current, now));
        });
    }

    private Uni<TokenValidation> adoptAfterConflict(TokenStore store, Optional<TokenRecord> current, long now) {
        if (current.isEmpty()) {
            return Uni.createFrom().failure(new TokenNotFoundException());
        }
        TokenRecord record = current.get();
        if (policy.isExpired(record.modifiedAt(), now)) {
            return expire(store, record);
        }
        return Uni.createFrom().item(toValidation(record, false));
    }

    /**
     * Delete an expired record and fail with {@link TokenExpiredException}.
     *
     * <p>The delete is best effort: expiry is reported even if it fails, and
     * the sweep reclaims the row later. The delete is not guarded against a
     * renewal that lands between the expiry check and the delete.
     */
    private Uni<TokenValidation> expire(TokenStore store, TokenRecord record) {
        long expiredAt = policy.expiresAt(record.modifiedAt());
        String fingerprint = SecureHash.fingerprint(record.token());
        return store.delete(record.token())
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Failed to delete expired token %s: %s", fingerprint, e.getMessage());
                    return false;
                })
                .flatMap(deleted -> {
                    LOG.debugf("Token %s expired at %d", fingerprint, expiredAt);
                    return Uni.createFrom().<TokenValidation>failure(new TokenExpiredException(expiredAt));
                });
    }

    private TokenValidation toValidation(TokenRecord record, boolean renewed) {
        return new TokenValidation(record, renewed, policy.expiresAt(record.modifiedAt()));
    }

    private void recordValidationFailure(Throwable failure) {
        if (failure instanceof TokenExpiredException) {
            metrics.recordValidation(ValidationOutcome.EXPIRED);
        } else if (failure instanceof TokenRejectedException) {
            metrics.recordValidation(ValidationOutcome.NOT_FOUND);
        } else {
            metrics.recordValidation(ValidationOutcome.ERROR);
            LOG.warnf("Token validation failed: %s", failure.getMessage());
        }
    }

    @Override
    public Uni<Boolean> revoke(String token) {
        if (token == null || token.isBlank()) {
            return Uni.createFrom().item(false);
        }
        return getStore().delete(token).invoke(removed -> {
            if (removed) {
                metrics.recordRevoked("logout", 1);
                LOG.infof("Token revoked: %s", SecureHash.fingerprint(token));
            }
        });
    }

    @Override
    public Uni<Long> revokeAllForUser(String userId) {
        Objects.requireNonNull(userId, "userId must not be null");
        return getStore().deleteByUserId(userId).invoke(count -> {
            metrics.recordRevoked("user", count);
            LOG.infof("Revoked %d tokens for user: %s", count, userId);
        });
    }

    @Override
    public Uni<Long> sweep() {
        long cutoff = policy.sweepCutoff(now());
        return getStore().deleteOlderThan(cutoff).invoke(count -> {
            metrics.recordSwept(count);
            if (count > 0) {
                LOG.infof("Swept %d expired tokens", count);
            }
        });
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private TokenStore getStore() {
        return storageRegistry.getStore();
    }
}
