package scanagram.core.service.retry;

import java.time.Duration;

import scanagram.core.model.retry.BackoffSettings;
import scanagram.core.port.out.JitterSource;

/**
 * Exponential backoff with a ceiling and symmetric jitter.
 *
 * <p>For retry {@code n} (1 for the first retry) the delay is
 * {@code min(ceiling, base * multiplier^(n-1)) * (1 + u)} with {@code u} drawn
 * fresh from {@code [-jitterRatio, jitterRatio]}. The policy holds no mutable
 * state; the attempt number is all it needs.
 */
public class BackoffPolicy {

    private final BackoffSettings settings;
    private final JitterSource jitter;

    public BackoffPolicy(BackoffSettings settings, JitterSource jitter) {
        this.settings = settings;
        this.jitter = jitter;
    }

    public BackoffSettings settings() {
        return settings;
    }

    /**
     * Total attempts allowed per operation, the first call included.
     *
     * @return max attempts
     */
    public int maxAttempts() {
        return settings.maxAttempts();
    }

    /**
     * Whether another attempt may follow the given failed attempt.
     *
     * @param attempt the attempt that just failed
     * @return true while attempts remain
     */
    public boolean shouldRetry(int attempt) {
        return attempt < settings.maxAttempts();
    }

    /**
     * Delay before retry {@code attempt}, jitter excluded. Non-decreasing in
     * {@code attempt} and never above the ceiling.
     *
     * @param attempt retry number, values below 1 count as 1
     * @return the delay
     */
    public Duration baseDelayForAttempt(int attempt) {
        final var exponent = Math.max(1, attempt) - 1;
        final var baseNanos = (double) settings.baseDelay().toNanos();
        final var ceilingNanos = (double) settings.delayCeiling().toNanos();

        final var grown = baseNanos * Math.pow(settings.multiplier(), exponent);
        return Duration.ofNanos((long) Math.min(ceilingNanos, grown));
    }

    /**
     * Delay before retry {@code attempt}, jitter included.
     *
     * @param attempt retry number, values below 1 count as 1
     * @return the delay, within {@code [0, ceiling * (1 + jitterRatio)]}
     */
    public Duration delayForAttempt(int attempt) {
        final var baseNanos = baseDelayForAttempt(attempt).toNanos();
        if (settings.jitterRatio() == 0.0) {
            return Duration.ofNanos(baseNanos);
        }

        final var ratio = settings.jitterRatio();
        final var offset = Math.max(-ratio, Math.min(ratio, jitter.nextSymmetric(ratio)));
        return Duration.ofNanos((long) Math.max(0.0, baseNanos * (1.0 + offset)));
    }
}
