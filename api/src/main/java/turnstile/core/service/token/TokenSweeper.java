package turnstile.core.service.token;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import org.jboss.logging.Logger;

import turnstile.core.config.TokenConfig;
import turnstile.core.model.token.TokenPolicy;
import turnstile.core.port.in.TokenManagement;
import turnstile.core.port.out.TokenMetrics;

/**
 * Background task that periodically sweeps expired tokens.
 *
 * <p>The sweep reclaims tokens nobody re-validates (abandoned sessions); it is
 * redundant with the expiry check performed on every validation. It runs every
 * {@link TokenPolicy#sweepInterval()} on a Vert.x periodic timer for the
 * lifetime of the process.
 *
 * <p>Store failures during an iteration are logged and absorbed; the next
 * tick retries independently. A tick that fires while the previous sweep is
 * still running is skipped.
 */
@ApplicationScoped
public class TokenSweeper {

    private static final Logger LOG = Logger.getLogger(TokenSweeper.class);

    private final TokenManagement tokenManagement;
    private final TokenMetrics metrics;
    private final Vertx vertx;
    private final boolean enabled;
    private final Duration interval;

    private final AtomicBoolean sweeping = new AtomicBoolean(false);
    private Long timerId;

    @Inject
    public TokenSweeper(TokenManagement tokenManagement, TokenConfig config, TokenMetrics metrics, Vertx vertx) {
        this.tokenManagement = tokenManagement;
        this.metrics = metrics;
        this.vertx = vertx;
        this.enabled = config.sweep().enabled();
        this.interval = tokenManagement.policy().sweepInterval();
    }

    void onStart(@Observes StartupEvent event) {
        start();
    }

    /**
     * Start the periodic sweep. Calling this more than once has no effect.
     */
    public synchronized void start() {
        if (!enabled) {
            LOG.info("Token sweep disabled, expired tokens are only removed on validation");
            return;
        }
        if (timerId != null) {
            return;
        }
        timerId = vertx.setPeriodic(interval.toMillis(), id -> runScheduledSweep());
        LOG.infof("Scheduled token sweep every %s", interval);
    }

    /**
     * Cancel the periodic sweep.
     */
    @PreDestroy
    public synchronized void stop() {
        if (timerId != null) {
            vertx.cancelTimer(timerId);
            timerId = null;
            LOG.debug("Token sweep cancelled");
        }
    }

    /**
     * Returns true while the periodic timer is registered.
     */
    public synchronized boolean isScheduled() {
        return timerId != null;
    }

    /**
     * Returns the interval between sweeps.
     */
    public Duration interval() {
        return interval;
    }

    void runScheduledSweep() {
        if (!sweeping.compareAndSet(false, true)) {
            LOG.debug("Previous token sweep still running, skipping this tick");
            return;
        }
        sweepOnce().subscribe().with(count -> sweeping.set(false), failure -> sweeping.set(false));
    }

    /**
     * Run one sweep iteration, absorbing store failures.
     *
     * @return number of tokens removed, or 0 if the iteration failed
     */
    public Uni<Long> sweepOnce() {
        return Uni.createFrom()
                .deferred(tokenManagement::sweep)
                .onFailure()
                .recoverWithItem(e -> {
                    metrics.recordSweepFailure();
                    LOG.warnf(e, "Token sweep failed, retrying in %s", interval);
                    return 0L;
                });
    }
}
