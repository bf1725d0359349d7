package scanagram.adapter.out.time;

import java.util.Random;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import scanagram.core.config.RetryConfig;
import scanagram.core.port.out.JitterSource;

/**
 * Jitter drawn from {@link Random}, optionally seeded for reproducible delays.
 *
 * <p>{@code java.util.Random} is thread-safe; contention is negligible at the
 * rate retries happen.
 */
@ApplicationScoped
public class RandomJitterSource implements JitterSource {

    private static final Logger LOG = Logger.getLogger(RandomJitterSource.class);

    private final Random random;

    @Inject
    public RandomJitterSource(RetryConfig config) {
        this(createRandom(config));
    }

    public RandomJitterSource(Random random) {
        this.random = random;
    }

    @Override
    public double nextSymmetric(double ratio) {
        if (ratio <= 0.0) {
            return 0.0;
        }
        return (random.nextDouble() * 2.0 - 1.0) * ratio;
    }

    private static Random createRandom(RetryConfig config) {
        final var seed = config.jitterSeed();
        if (seed.isPresent()) {
            LOG.infof("Using fixed jitter seed %d", seed.getAsLong());
            return new Random(seed.getAsLong());
        }
        return new Random();
    }
}
