package scanagram.adapter.out.time;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;

import scanagram.core.port.out.Sleeper;

/**
 * Sleeper built on Mutiny's delayed items, which run on the default scheduler
 * and drop the pending timer on cancellation.
 */
@ApplicationScoped
public class MutinySleeper implements Sleeper {

    @Override
    public Uni<Void> sleep(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return Uni.createFrom().voidItem();
        }
        return Uni.createFrom().voidItem().onItem().delayIt().by(delay);
    }
}
