package scanagram.adapter.out.time;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Time adapters")
class TimeAdaptersTest {

    @Nested
    @DisplayName("RandomJitterSource")
    class RandomJitterSourceTests {

        @Test
        @DisplayName("should draw within the symmetric range")
        void shouldDrawWithinRange() {
            final var jitter = new RandomJitterSource(new Random(1));

            for (var i = 0; i < 1000; i++) {
                final var value = jitter.nextSymmetric(0.3);
                assertTrue(value >= -0.3 && value <= 0.3, "value " + value);
            }
        }

        @Test
        @DisplayName("should repeat the sequence for the same seed")
        void shouldRepeatForSameSeed() {
            final var first = new RandomJitterSource(new Random(42));
            final var second = new RandomJitterSource(new Random(42));

            for (var i = 0; i < 10; i++) {
                assertEquals(first.nextSymmetric(0.3), second.nextSymmetric(0.3));
            }
        }

        @Test
        @DisplayName("should return zero for a zero ratio")
        void shouldReturnZeroForZeroRatio() {
            assertEquals(0.0, new RandomJitterSource(new Random()).nextSymmetric(0.0));
        }
    }

    @Nested
    @DisplayName("MutinySleeper")
    class MutinySleeperTests {

        private final MutinySleeper sleeper = new MutinySleeper();

        @Test
        @DisplayName("should complete after the delay")
        void shouldCompleteAfterDelay() {
            final var start = System.nanoTime();

            sleeper.sleep(Duration.ofMillis(50)).await().atMost(Duration.ofSeconds(5));

            assertTrue(System.nanoTime() - start >= Duration.ofMillis(50).toNanos());
        }

        @Test
        @DisplayName("should complete at once for non-positive delays")
        void shouldCompleteImmediately() {
            sleeper.sleep(Duration.ZERO).await().atMost(Duration.ofMillis(100));
            sleeper.sleep(Duration.ofSeconds(-1)).await().atMost(Duration.ofMillis(100));
        }
    }
}
