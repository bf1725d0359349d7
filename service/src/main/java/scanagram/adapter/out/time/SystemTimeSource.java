package scanagram.adapter.out.time;

import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;

import scanagram.core.port.out.TimeSource;

/**
 * Time source backed by {@link System#nanoTime()} and the system clock.
 */
@ApplicationScoped
public class SystemTimeSource implements TimeSource {

    @Override
    public long monotonicNanos() {
        return System.nanoTime();
    }

    @Override
    public Instant now() {
        return Instant.now();
    }
}
