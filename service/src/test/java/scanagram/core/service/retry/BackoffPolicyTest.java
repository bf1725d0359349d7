package scanagram.core.service.retry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import scanagram.core.model.retry.BackoffSettings;
import scanagram.core.port.out.JitterSource;

@DisplayName("BackoffPolicy")
class BackoffPolicyTest {

    private static final JitterSource NO_JITTER = ratio -> 0.0;

    private static BackoffSettings settings(double jitterRatio) {
        return new BackoffSettings(Duration.ofSeconds(5), 2.0, Duration.ofMinutes(5), jitterRatio, 3);
    }

    @Nested
    @DisplayName("baseDelayForAttempt()")
    class BaseDelayTests {

        private final BackoffPolicy policy = new BackoffPolicy(settings(0.0), NO_JITTER);

        @Test
        @DisplayName("should grow exponentially from the base delay")
        void shouldGrowExponentially() {
            assertEquals(Duration.ofSeconds(5), policy.baseDelayForAttempt(1));
            assertEquals(Duration.ofSeconds(10), policy.baseDelayForAttempt(2));
            assertEquals(Duration.ofSeconds(20), policy.baseDelayForAttempt(3));
        }

        @Test
        @DisplayName("should treat attempts below one as the first retry")
        void shouldClampLowAttempts() {
            assertEquals(Duration.ofSeconds(5), policy.baseDelayForAttempt(0));
            assertEquals(Duration.ofSeconds(5), policy.baseDelayForAttempt(-3));
        }

        @Test
        @DisplayName("should stop at the ceiling")
        void shouldStopAtCeiling() {
            assertEquals(Duration.ofMinutes(5), policy.baseDelayForAttempt(7));
            assertEquals(Duration.ofMinutes(5), policy.baseDelayForAttempt(500));
        }

        @Test
        @DisplayName("should never decrease")
        void shouldBeMonotonic() {
            var previous = Duration.ZERO;
            for (var attempt = 1; attempt <= 100; attempt++) {
                final var delay = policy.baseDelayForAttempt(attempt);
                assertTrue(delay.compareTo(previous) >= 0, "attempt " + attempt);
                previous = delay;
            }
        }
    }

    @Nested
    @DisplayName("delayForAttempt()")
    class DelayTests {

        @Test
        @DisplayName("should equal the base delay without jitter")
        void shouldEqualBaseWithoutJitter() {
            final var policy = new BackoffPolicy(settings(0.0), ratio -> {
                throw new AssertionError("jitter must not be drawn");
            });

            assertEquals(Duration.ofSeconds(10), policy.delayForAttempt(2));
        }

        @Test
        @DisplayName("should apply the drawn jitter")
        void shouldApplyJitter() {
            final var up = new BackoffPolicy(settings(0.3), ratio -> ratio);
            final var down = new BackoffPolicy(settings(0.3), ratio -> -ratio);

            assertEquals(6.5, up.delayForAttempt(1).toNanos() / 1e9, 1e-6);
            assertEquals(3.5, down.delayForAttempt(1).toNanos() / 1e9, 1e-6);
        }

        @Test
        @DisplayName("should stay within the jitter bounds")
        void shouldStayWithinBounds() {
            final var random = new Random(7);
            final JitterSource jitter = ratio -> (random.nextDouble() * 2.0 - 1.0) * ratio;
            final var policy = new BackoffPolicy(settings(0.3), jitter);

            for (var attempt = 1; attempt <= 20; attempt++) {
                final var base = policy.baseDelayForAttempt(attempt).toNanos();
                final var delay = policy.delayForAttempt(attempt).toNanos();
                assertTrue(delay >= base * 0.7 - 1 && delay <= base * 1.3 + 1, "attempt " + attempt);
            }
        }

        @Test
        @DisplayName("should clamp jitter outside the configured ratio")
        void shouldClampJitter() {
            final var policy = new BackoffPolicy(settings(0.3), ratio -> -5.0);

            assertEquals(3.5, policy.delayForAttempt(1).toNanos() / 1e9, 1e-6);
        }

        @Test
        @DisplayName("should be reproducible with the same jitter sequence")
        void shouldBeReproducible() {
            final var first = new Random(42);
            final var second = new Random(42);
            final var a = new BackoffPolicy(settings(0.3), ratio -> (first.nextDouble() * 2.0 - 1.0) * ratio);
            final var b = new BackoffPolicy(settings(0.3), ratio -> (second.nextDouble() * 2.0 - 1.0) * ratio);

            for (var attempt = 1; attempt <= 5; attempt++) {
                assertEquals(a.delayForAttempt(attempt), b.delayForAttempt(attempt));
            }
        }
    }

    @Nested
    @DisplayName("shouldRetry()")
    class ShouldRetryTests {

        @Test
        @DisplayName("should allow retries while attempts remain")
        void shouldAllowWhileAttemptsRemain() {
            final var policy = new BackoffPolicy(settings(0.0), NO_JITTER);

            assertEquals(3, policy.maxAttempts());
            assertTrue(policy.shouldRetry(1));
            assertTrue(policy.shouldRetry(2));
            assertFalse(policy.shouldRetry(3));
        }
    }

    @Nested
    @DisplayName("BackoffSettings")
    class SettingsTests {

        @Test
        @DisplayName("should reject invalid settings")
        void shouldRejectInvalidSettings() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new BackoffSettings(Duration.ofSeconds(5), 0.5, Duration.ofMinutes(5), 0.3, 3));
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new BackoffSettings(Duration.ofSeconds(5), 2.0, Duration.ofMinutes(5), 1.5, 3));
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new BackoffSettings(Duration.ofSeconds(5), 2.0, Duration.ofMinutes(5), 0.3, 0));
        }
    }
}
