package turnstile.core.port.out;

/**
 * Port interface for recording token lifecycle metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface TokenMetrics {

    /**
     * Validation outcomes.
     */
    enum ValidationOutcome {
        VALID,
        RENEWED,
        NOT_FOUND,
        EXPIRED,
        ERROR
    }

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record an issued token.
     */
    void recordIssued();

    /**
     * Record an issue attempt that collided with an existing token.
     */
    void recordIssueCollision();

    /**
     * Record the outcome of a validation.
     *
     * @param outcome the outcome
     */
    void recordValidation(ValidationOutcome outcome);

    /**
     * Record a renewal attempt that lost the compare-and-set race.
     */
    void recordRenewalConflict();

    /**
     * Record revoked tokens.
     *
     * @param reason why the tokens were revoked (logout, user)
     * @param count number of tokens removed
     */
    void recordRevoked(String reason, long count);

    /**
     * Record tokens removed by a sweep.
     *
     * @param count number of tokens removed
     */
    void recordSwept(long count);

    /**
     * Record a failed sweep iteration.
     */
    void recordSweepFailure();
}
