package scanagram.core.port.out;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

/**
 * Port for suspending a governed operation without blocking a thread.
 *
 * <p>Cancelling the returned {@link Uni} must cancel the pending wake-up.
 */
public interface Sleeper {

    /**
     * Complete after the given delay.
     *
     * @param delay how long to wait, zero or negative completes immediately
     * @return a Uni completing after the delay
     */
    Uni<Void> sleep(Duration delay);
}
