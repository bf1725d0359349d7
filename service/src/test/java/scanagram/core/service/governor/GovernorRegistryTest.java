package scanagram.core.service.governor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.UniEmitter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import scanagram.core.model.governor.CallOutcome;
import scanagram.core.model.governor.GovernorResult;
import scanagram.core.model.ratelimit.LimiterSettings;
import scanagram.core.model.retry.BackoffSettings;
import scanagram.core.port.out.GovernorMetrics;
import scanagram.mock.ManualClock;

@DisplayName("GovernorRegistry")
@ExtendWith(MockitoExtension.class)
class GovernorRegistryTest {

    @Mock
    private GovernorMetrics metrics;

    private ManualClock clock;
    private GovernorRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        registry = new GovernorRegistry(
                LimiterSettings.defaults(), BackoffSettings.defaults(), clock, ratio -> 0.0, clock, metrics);
    }

    @Test
    @DisplayName("should reuse the governor of a profile regardless of case")
    void shouldReuseGovernor() {
        final var first = registry.forProfile("Alice");
        final var second = registry.forProfile("  alice ");

        assertSame(first, second);
        assertEquals("alice", first.key());
        assertEquals(1, registry.size());
    }

    @Test
    @DisplayName("should keep limiter history separate per profile")
    void shouldIsolateProfiles() {
        final var alice = registry.forProfile("alice");
        final var bob = registry.forProfile("bob");
        alice.limiter().tryAcquire(clock.monotonicNanos(), 1);

        assertNotSame(alice.limiter(), bob.limiter());
        assertEquals(1, alice.limiter().snapshot(clock.monotonicNanos()).totalIssued());
        assertEquals(0, bob.limiter().snapshot(clock.monotonicNanos()).totalIssued());
    }

    @Test
    @DisplayName("should reject blank usernames")
    void shouldRejectBlankUsername() {
        assertThrows(IllegalArgumentException.class, () -> registry.forProfile(" "));
        assertThrows(IllegalArgumentException.class, () -> registry.forProfile(null));
    }

    @Nested
    @DisplayName("Expiry")
    class ExpiryTests {

        private GovernorRegistry oneCallPerSecond;

        @BeforeEach
        void setUp() {
            oneCallPerSecond = new GovernorRegistry(
                    new LimiterSettings(
                            Duration.ofSeconds(1), 1, Duration.ZERO, 10, Duration.ofSeconds(1), Duration.ZERO),
                    BackoffSettings.defaults(),
                    clock,
                    ratio -> 0.0,
                    clock,
                    metrics);
        }

        @Test
        @DisplayName("should keep a governor whose last call is still in the window")
        void shouldKeepGovernorWithCallInWindow() {
            final var first = oneCallPerSecond.forProfile("alice");
            clock.advance(Duration.ofMillis(600));
            first.<String>execute("fetch-profile", () -> Uni.createFrom().item(CallOutcome.success("ok")))
                    .await()
                    .atMost(Duration.ofSeconds(5));
            clock.advance(Duration.ofMillis(600));

            final var second = oneCallPerSecond.forProfile("alice");

            assertSame(first, second);
            assertFalse(second.limiter().tryAdmit(clock.monotonicNanos()).admitted());
        }

        @Test
        @DisplayName("should keep a governor while an operation is running through it")
        void shouldKeepBusyGovernor() {
            final var first = oneCallPerSecond.forProfile("alice");
            final var pending = new AtomicReference<UniEmitter<? super CallOutcome<String>>>();
            final var result = new AtomicReference<GovernorResult<String>>();
            first.<String>execute("fetch-profile", () -> Uni.createFrom().<CallOutcome<String>>emitter(pending::set))
                    .subscribe()
                    .with(result::set);

            clock.advance(Duration.ofSeconds(5));
            assertTrue(first.isBusy());
            assertSame(first, oneCallPerSecond.forProfile("alice"));

            pending.get().complete(CallOutcome.success("ok"));
            assertFalse(first.isBusy());
            assertTrue(result.get().isSuccess());

            clock.advance(Duration.ofMillis(900));
            assertSame(first, oneCallPerSecond.forProfile("alice"));
        }

        @Test
        @DisplayName("should replace a governor once it has been idle for a full window")
        void shouldReplaceIdleGovernor() {
            final var first = oneCallPerSecond.forProfile("alice");
            first.<String>execute("fetch-profile", () -> Uni.createFrom().item(CallOutcome.success("ok")))
                    .await()
                    .atMost(Duration.ofSeconds(5));

            clock.advance(Duration.ofMillis(1_001));

            final var second = oneCallPerSecond.forProfile("alice");
            assertNotSame(first, second);
            assertTrue(second.limiter().tryAdmit(clock.monotonicNanos()).admitted());
        }
    }
}
