package scanagram.core.model.retry;

import java.time.Duration;

/**
 * Settings for exponential backoff between retries.
 *
 * @param baseDelay    delay before the first retry
 * @param multiplier   growth factor per retry
 * @param delayCeiling upper bound of the pre-jitter delay
 * @param jitterRatio  half-width of the symmetric jitter range, e.g. 0.3 for ±30%
 * @param maxAttempts  total attempts of one operation, the original call included
 */
public record BackoffSettings(
        Duration baseDelay, double multiplier, Duration delayCeiling, double jitterRatio, int maxAttempts) {

    public BackoffSettings {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative, got: " + baseDelay);
        }
        if (delayCeiling == null || delayCeiling.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("delayCeiling must be at least baseDelay, got: " + delayCeiling);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0, got: " + multiplier);
        }
        if (jitterRatio < 0.0 || jitterRatio >= 1.0) {
            throw new IllegalArgumentException("jitterRatio must be in [0.0, 1.0), got: " + jitterRatio);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got: " + maxAttempts);
        }
    }

    /**
     * Defaults: 5s, 10s, 20s, ... capped at 5 minutes, ±30% jitter, 3 attempts.
     *
     * @return the default settings
     */
    public static BackoffSettings defaults() {
        return new BackoffSettings(Duration.ofSeconds(5), 2.0, Duration.ofMinutes(5), 0.3, 3);
    }
}
