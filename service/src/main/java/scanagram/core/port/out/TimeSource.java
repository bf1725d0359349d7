package scanagram.core.port.out;

import java.time.Instant;

/**
 * Port for reading time.
 *
 * <p>Rate limiting and backoff run on the monotonic clock; wall time is only
 * used to stamp reports.
 */
public interface TimeSource {

    /**
     * Monotonic time in nanoseconds. Only differences are meaningful.
     *
     * @return the current monotonic time
     */
    long monotonicNanos();

    /**
     * Current wall-clock time.
     *
     * @return now
     */
    Instant now();
}
