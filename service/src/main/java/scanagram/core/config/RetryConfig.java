package scanagram.core.config;

import java.time.Duration;
import java.util.OptionalLong;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import scanagram.core.model.retry.BackoffSettings;

/**
 * Configuration mapping for retries of transient failures.
 *
 * <p>Configuration prefix: {@code scanagram.retry}
 *
 * <p>With the defaults a failing call is retried after roughly 5s and 10s,
 * each delay varied by up to ±30%.
 */
@ConfigMapping(prefix = "scanagram.retry")
public interface RetryConfig {

    /**
     * Delay before the first retry.
     *
     * @return base delay (default: 5 seconds)
     */
    @WithDefault("PT5S")
    Duration baseDelay();

    /**
     * Growth factor applied per retry.
     *
     * @return multiplier (default: 2.0)
     */
    @WithDefault("2.0")
    double multiplier();

    /**
     * Upper bound of the delay before jitter is applied.
     *
     * @return delay ceiling (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration delayCeiling();

    /**
     * Half-width of the symmetric jitter range as a fraction of the delay.
     *
     * @return jitter ratio (default: 0.3)
     */
    @WithDefault("0.3")
    double jitterRatio();

    /**
     * Total attempts per operation, the first call included.
     *
     * @return max attempts (default: 3)
     */
    @WithDefault("3")
    int maxAttempts();

    /**
     * Seed for the jitter source. Unset means a random seed.
     *
     * @return the seed, if configured
     */
    OptionalLong jitterSeed();

    default BackoffSettings toSettings() {
        return new BackoffSettings(baseDelay(), multiplier(), delayCeiling(), jitterRatio(), maxAttempts());
    }
}
