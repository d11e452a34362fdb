package turnstile.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import turnstile.config.TelemetryConfigMapping;
import turnstile.core.port.out.TokenMetrics.ValidationOutcome;

@DisplayName("TokenLifecycleMetrics")
class TokenLifecycleMetricsTest {

    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
    }

    private double count(String name) {
        var counter = registry.find(name).counter();
        return counter == null ? 0 : counter.count();
    }

    @Nested
    @DisplayName("When enabled")
    class EnabledTests {

        private TokenLifecycleMetrics metrics;

        @BeforeEach
        void setUp() {
            metrics = new TokenLifecycleMetrics(registry, true);
        }

        @Test
        @DisplayName("should count issued tokens and collisions")
        void shouldCountIssued() {
            metrics.recordIssued();
            metrics.recordIssued();
            metrics.recordIssueCollision();

            assertEquals(2.0, count("turnstile.tokens.issued"));
            assertEquals(1.0, count("turnstile.tokens.issue.collisions"));
        }

        @Test
        @DisplayName("should tag validations by outcome")
        void shouldTagValidations() {
            metrics.recordValidation(ValidationOutcome.RENEWED);
            metrics.recordValidation(ValidationOutcome.EXPIRED);
            metrics.recordValidation(ValidationOutcome.EXPIRED);

            assertEquals(
                    1.0,
                    registry.find("turnstile.tokens.validations")
                            .tag("outcome", "renewed")
                            .counter()
                            .count());
            assertEquals(
                    2.0,
                    registry.find("turnstile.tokens.validations")
                            .tag("outcome", "expired")
                            .counter()
                            .count());
        }

        @Test
        @DisplayName("should add revoked counts by reason")
        void shouldAddRevokedCounts() {
            metrics.recordRevoked("user", 3);
            metrics.recordRevoked("logout", 1);
            metrics.recordRevoked("user", 0);

            assertEquals(
                    3.0,
                    registry.find("turnstile.tokens.revoked").tag("reason", "user").counter().count());
            assertEquals(
                    1.0,
                    registry.find("turnstile.tokens.revoked").tag("reason", "logout").counter().count());
        }

        @Test
        @DisplayName("should count swept tokens, sweep failures and renewal conflicts")
        void shouldCountSweepAndConflicts() {
            metrics.recordSwept(5);
            metrics.recordSwept(0);
            metrics.recordSweepFailure();
            metrics.recordRenewalConflict();

            assertEquals(5.0, count("turnstile.tokens.swept"));
            assertEquals(1.0, count("turnstile.tokens.sweep.failures"));
            assertEquals(1.0, count("turnstile.tokens.renewal.conflicts"));
        }
    }

    @Nested
    @DisplayName("When disabled")
    class DisabledTests {

        @Test
        @DisplayName("should register no meters")
        void shouldRegisterNothing() {
            var metrics = new TokenLifecycleMetrics(registry, false);

            metrics.recordIssued();
            metrics.recordValidation(ValidationOutcome.VALID);
            metrics.recordRevoked("logout", 1);
            metrics.recordSwept(3);

            assertFalse(metrics.isEnabled());
            assertTrue(registry.getMeters().isEmpty());
        }

        @Test
        @DisplayName("should honour the master telemetry toggle")
        void shouldHonourMasterToggle() {
            var metrics = new TokenLifecycleMetrics(registry, config(false, true));

            metrics.recordIssued();

            assertFalse(metrics.isEnabled());
            assertNull(registry.find("turnstile.tokens.issued").counter());
        }

        @Test
        @DisplayName("should honour the metrics toggle")
        void shouldHonourMetricsToggle() {
            assertFalse(new TokenLifecycleMetrics(registry, config(true, false)).isEnabled());
            assertTrue(new TokenLifecycleMetrics(registry, config(true, true)).isEnabled());
        }
    }

    private static TelemetryConfigMapping config(boolean enabled, boolean metricsEnabled) {
        return new TelemetryConfigMapping() {
            @Override
            public boolean enabled() {
                return enabled;
            }

            @Override
            public MetricsConfig metrics() {
                return () -> metricsEnabled;
            }
        };
    }
}
