package turnstile.core.model.token;

import java.time.Duration;

/**
 * Lifetime rules for issued tokens, captured once from configuration.
 *
 * <p>All timestamps are epoch seconds. A token is expired strictly after
 * {@code modifiedAt + ttlSeconds}; it becomes eligible for renewal once its
 * age reaches {@code renewThresholdSeconds}.
 *
 * @param ttlSeconds maximum age of a token without renewal
 * @param renewThresholdSeconds age from which validation may renew the token
 */
public record TokenPolicy(long ttlSeconds, long renewThresholdSeconds) {

    static final long MIN_SWEEP_INTERVAL_SECONDS = 30;

    public long expiresAt(long modifiedAt) {
        return modifiedAt + ttlSeconds;
    }

    public boolean isExpired(long modifiedAt, long now) {
        return now - modifiedAt > ttlSeconds;
    }

    public boolean shouldRenew(long modifiedAt, long now) {
        return now - modifiedAt >= renewThresholdSeconds;
    }

    /**
     * Returns the cutoff below which records are swept.
     *
     * <p>The TTL is clamped to at least one second so a misconfigured
     * non-positive TTL never sweeps live tokens created in the current second.
     */
    public long sweepCutoff(long now) {
        return now - Math.max(ttlSeconds, 1);
    }

    /**
     * Returns the interval between background sweeps: half the TTL, but never
     * less than 30 seconds, and 30 seconds flat for a non-positive TTL.
     */
    public Duration sweepInterval() {
        if (ttlSeconds <= 0) {
            return Duration.ofSeconds(MIN_SWEEP_INTERVAL_SECONDS);
        }
        return Duration.ofSeconds(Math.max(ttlSeconds / 2, MIN_SWEEP_INTERVAL_SECONDS));
    }
}
