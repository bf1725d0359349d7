package scanagram.core.model.ratelimit;

/**
 * Why the limiter refused a call. When several constraints apply, the one with
 * the longest wait is reported.
 */
public enum DenialReason {
    NONE,
    WINDOW_EXHAUSTED,
    BURST_COOLDOWN,
    MIN_INTERVAL
}
