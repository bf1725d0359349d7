package scanagram.core.model.ratelimit;

import java.time.Duration;

/**
 * Settings for a rolling-window limiter.
 *
 * <p>{@code maxRequestsPerWindow} should sit below the remote service's
 * published ceiling; the default of 180 per hour is 90% of a 200 per hour quota.
 *
 * @param windowDuration       length of the rolling window
 * @param maxRequestsPerWindow calls admitted within one window
 * @param minInterCallDelay    minimum spacing between two recorded calls
 * @param burstThreshold       calls within {@code burstInterval} that trigger a cooldown
 * @param burstInterval        short interval used for burst detection
 * @param burstCooldown        pause imposed once a burst is detected
 */
public record LimiterSettings(
        Duration windowDuration,
        int maxRequestsPerWindow,
        Duration minInterCallDelay,
        int burstThreshold,
        Duration burstInterval,
        Duration burstCooldown) {

    public LimiterSettings {
        requirePositive(windowDuration, "windowDuration");
        requirePositive(burstInterval, "burstInterval");
        requireNonNegative(minInterCallDelay, "minInterCallDelay");
        requireNonNegative(burstCooldown, "burstCooldown");
        if (maxRequestsPerWindow < 1) {
            throw new IllegalArgumentException("maxRequestsPerWindow must be at least 1, got: " + maxRequestsPerWindow);
        }
        if (burstThreshold < 1) {
            throw new IllegalArgumentException("burstThreshold must be at least 1, got: " + burstThreshold);
        }
    }

    /**
     * Defaults: 180 calls per hour, 2s spacing, 10 calls per 30s before a 60s cooldown.
     *
     * @return the default settings
     */
    public static LimiterSettings defaults() {
        return new LimiterSettings(
                Duration.ofHours(1), 180, Duration.ofSeconds(2), 10, Duration.ofSeconds(30), Duration.ofSeconds(60));
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
    }

    private static void requireNonNegative(Duration value, String name) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative, got: " + value);
        }
    }
}
