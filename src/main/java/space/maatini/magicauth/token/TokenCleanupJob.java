package space.maatini.magicauth.token;

import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import space.maatini.magicauth.config.MagicAuthConfig;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically deletes tokens that are expired or exhausted.
 */
@Startup
@ApplicationScoped
public class TokenCleanupJob {

    private static final Logger LOG = Logger.getLogger(TokenCleanupJob.class);

    @Inject
    MagicAuthConfig config;

    @Inject
    TokenRepository repository;

    Clock clock = Clock.systemUTC();

    private ScheduledExecutorService cleanupScheduler;

    @PostConstruct
    void init() {
        if (!config.cleanup().enabled()) {
            LOG.debug("Scheduled token cleanup disabled");
            return;
        }
        long intervalMillis = config.cleanup().every().toMillis();
        if (intervalMillis <= 0) {
            throw new IllegalArgumentException("magic-auth.cleanup.every must be positive");
        }

        cleanupScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "magic-auth-token-cleanup");
            t.setDaemon(true);
            return t;
        });
        cleanupScheduler.scheduleAtFixedRate(this::scheduledCleanup, intervalMillis, intervalMillis,
                TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    void shutdown() {
        if (cleanupScheduler != null) {
            cleanupScheduler.shutdownNow();
        }
    }

    void scheduledCleanup() {
        try {
            run();
        } catch (RuntimeException e) {
            // a failed run must not cancel the schedule
            LOG.errorf(e, "Scheduled token cleanup failed");
        }
    }

    /**
     * Deletes all expired or exhausted tokens.
     *
     * @return the number of deleted tokens
     */
    public int run() {
        Instant now = clock.instant();
        int deleted = repository.deleteExpiredOrExhausted(now);
        LOG.infof("Deleted %d expired/exhausted token(s).", deleted);
        return deleted;
    }

    boolean isScheduled() {
        return cleanupScheduler != null && !cleanupScheduler.isShutdown();
    }
}
