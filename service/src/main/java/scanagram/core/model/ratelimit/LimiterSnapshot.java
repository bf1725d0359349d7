package scanagram.core.model.ratelimit;

import java.time.Duration;

/**
 * Point-in-time statistics of a limiter, reported alongside collected data.
 *
 * @param totalIssued       calls recorded since the limiter was created
 * @param totalDenied       admission checks that were refused
 * @param inWindow          calls recorded within the current window
 * @param limit             maximum calls per window
 * @param utilizationPercent {@code inWindow / limit * 100}, one decimal
 * @param coolingDown       whether a burst cooldown is running
 * @param cooldownRemaining time left on the cooldown (zero when not cooling down)
 */
public record LimiterSnapshot(
        long totalIssued,
        long totalDenied,
        int inWindow,
        int limit,
        double utilizationPercent,
        boolean coolingDown,
        Duration cooldownRemaining) {}
