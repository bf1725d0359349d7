package scanagram.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import scanagram.core.model.ratelimit.LimiterSettings;

/**
 * Configuration mapping for outbound rate limiting.
 *
 * <p>Configuration prefix: {@code scanagram.rate-limit}
 *
 * <p>Each profile gets its own limiter built from these values. Limits are not
 * coordinated across processes, so running several instances against the same
 * remote account multiplies the effective rate.
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code SCANAGRAM_RATE_LIMIT_MAX_REQUESTS_PER_WINDOW} - Calls per window</li>
 *   <li>{@code SCANAGRAM_RATE_LIMIT_WINDOW_DURATION} - Rolling window length</li>
 *   <li>{@code SCANAGRAM_RATE_LIMIT_MIN_INTER_CALL_DELAY} - Minimum spacing between calls</li>
 * </ul>
 */
@ConfigMapping(prefix = "scanagram.rate-limit")
public interface RateLimitConfig {

    /**
     * Length of the rolling window.
     *
     * @return window duration (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration windowDuration();

    /**
     * Calls admitted per window.
     *
     * <p>Keep this below the remote service's published quota. The default is
     * 90% of a 200 calls per hour quota.
     *
     * @return max requests per window (default: 180)
     */
    @WithDefault("180")
    int maxRequestsPerWindow();

    /**
     * Minimum time between two calls, applied even when the window has capacity.
     *
     * @return minimum inter-call delay (default: 2 seconds)
     */
    @WithDefault("PT2S")
    Duration minInterCallDelay();

    /**
     * Calls within {@link #burstInterval()} that trigger a cooldown.
     *
     * @return burst threshold (default: 10)
     */
    @WithDefault("10")
    int burstThreshold();

    /**
     * Interval used for burst detection.
     *
     * @return burst interval (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration burstInterval();

    /**
     * Pause imposed once a burst is detected.
     *
     * @return burst cooldown (default: 60 seconds)
     */
    @WithDefault("PT60S")
    Duration burstCooldown();

    default LimiterSettings toSettings() {
        return new LimiterSettings(
                windowDuration(),
                maxRequestsPerWindow(),
                minInterCallDelay(),
                burstThreshold(),
                burstInterval(),
                burstCooldown());
    }
}
