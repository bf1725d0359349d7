package scanagram.core.service.governor;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import org.jboss.logging.Logger;

import scanagram.core.model.ratelimit.LimiterSettings;
import scanagram.core.model.retry.BackoffSettings;
import scanagram.core.port.out.GovernorMetrics;
import scanagram.core.port.out.JitterSource;
import scanagram.core.port.out.Sleeper;
import scanagram.core.port.out.TimeSource;
import scanagram.core.service.ratelimit.RollingWindowLimiter;
import scanagram.core.service.retry.BackoffPolicy;

/**
 * Hands out one {@link RequestGovernor} per profile.
 *
 * <p>
 * Governors are keyed by the lower-cased username, so each profile has its own
 * limiter history. A governor is never evicted while an operation runs through
 * it or while its limiter still holds in-window records or a running cooldown;
 * after that it stays for at least one more window from its last use. Expiry
 * runs on the injected {@link TimeSource}.
 */
@ApplicationScoped
public class GovernorRegistry {

    private static final Logger LOG = Logger.getLogger(GovernorRegistry.class);

    private final LimiterSettings limiterSettings;
    private final long windowNanos;
    private final TimeSource timeSource;
    private final Sleeper sleeper;
    private final GovernorMetrics metrics;
    private final BackoffPolicy backoff;
    private final FailureClassifier classifier = new FailureClassifier();
    private final Cache<String, RequestGovernor> governors;

    public GovernorRegistry(
            LimiterSettings limiterSettings,
            BackoffSettings backoffSettings,
            TimeSource timeSource,
            JitterSource jitterSource,
            Sleeper sleeper,
            GovernorMetrics metrics) {
        this.limiterSettings = limiterSettings;
        this.windowNanos = limiterSettings.windowDuration().toNanos();
        this.timeSource = timeSource;
        this.sleeper = sleeper;
        this.metrics = metrics;
        this.backoff = new BackoffPolicy(backoffSettings, jitterSource);
        this.governors = Caffeine.newBuilder()
                .ticker(timeSource::monotonicNanos)
                .expireAfter(new IdleExpiry())
                .build();
    }

    /**
     * Governor for the given profile, created on first use.
     *
     * @param username the profile's username, case-insensitive
     * @return the profile's governor
     * @throws IllegalArgumentException if the username is blank
     */
    public RequestGovernor forProfile(String username) {
        final var key = keyFor(username);
        return governors.get(key, this::create);
    }

    /**
     * Number of profiles currently tracked.
     *
     * @return the estimated count
     */
    public long size() {
        governors.cleanUp();
        return governors.estimatedSize();
    }

    static String keyFor(String username) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username is required");
        }
        return username.trim().toLowerCase(Locale.ROOT);
    }

    private RequestGovernor create(String key) {
        LOG.debugf("Creating request governor for profile %s", key);
        return new RequestGovernor(
                key,
                new RollingWindowLimiter(limiterSettings),
                backoff,
                timeSource,
                sleeper,
                classifier,
                metrics,
                () -> touch(key));
    }

    // A read re-evaluates the entry's expiry
    private void touch(String key) {
        governors.getIfPresent(key);
    }

    private long nanosToLive(RequestGovernor governor, long nowNanos) {
        if (governor.isBusy()) {
            return Long.MAX_VALUE;
        }
        return Math.max(windowNanos, governor.limiter().nanosUntilIdle(nowNanos));
    }

    private final class IdleExpiry implements Expiry<String, RequestGovernor> {

        @Override
        public long expireAfterCreate(String key, RequestGovernor governor, long currentTime) {
            return nanosToLive(governor, currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, RequestGovernor governor, long currentTime, long currentDuration) {
            return nanosToLive(governor, currentTime);
        }

        @Override
        public long expireAfterRead(String key, RequestGovernor governor, long currentTime, long currentDuration) {
            return nanosToLive(governor, currentTime);
        }
    }
}
