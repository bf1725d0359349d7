package scanagram.core.model.ratelimit;

/**
 * One call the limiter let through.
 *
 * @param timestampNanos monotonic timestamp of the call
 * @param attempt        attempt number within its governed operation (1 for the first try)
 */
public record RequestRecord(long timestampNanos, int attempt) {}
