package scanagram.core.model.ratelimit;

import java.time.Duration;

/**
 * Result of an admission check against a rolling-window limiter.
 *
 * @param admitted   whether the call may proceed now
 * @param retryAfter how long to wait before asking again (zero when admitted)
 * @param reason     the constraint that produced the longest wait
 * @param inWindow   calls recorded within the current window
 * @param remaining  calls still available in the current window
 */
public record AdmissionDecision(
        boolean admitted, Duration retryAfter, DenialReason reason, int inWindow, int remaining) {

    public static AdmissionDecision admit(int inWindow, int remaining) {
        return new AdmissionDecision(true, Duration.ZERO, DenialReason.NONE, inWindow, remaining);
    }

    public static AdmissionDecision deny(Duration retryAfter, DenialReason reason, int inWindow, int remaining) {
        return new AdmissionDecision(false, retryAfter, reason, inWindow, remaining);
    }
}
