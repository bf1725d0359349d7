package scanagram.core.port.out;

import java.time.Duration;

import scanagram.core.model.governor.GovernorResult;
import scanagram.core.model.ratelimit.DenialReason;

/**
 * Port for recording request-governance metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface GovernorMetrics {

    /**
     * Record that the limiter admitted a call.
     *
     * @param operation the governed operation name
     */
    void recordAdmission(String operation);

    /**
     * Record that the limiter refused a call and the governor will wait.
     *
     * @param operation the governed operation name
     * @param reason    the dominant denial reason
     * @param wait      the wait imposed
     */
    void recordDenial(String operation, DenialReason reason, Duration wait);

    /**
     * Record a backoff delay before a retry.
     *
     * @param operation the governed operation name
     * @param attempt   the attempt that failed
     * @param delay     the delay before the next attempt
     */
    void recordBackoff(String operation, int attempt, Duration delay);

    /**
     * Record the terminal result of a governed operation.
     *
     * @param operation the governed operation name
     * @param result    the result
     */
    void recordResult(String operation, GovernorResult<?> result);
}
