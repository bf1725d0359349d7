package scanagram.core.service.ratelimit;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

import org.jboss.logging.Logger;

import scanagram.core.model.ratelimit.AdmissionDecision;
import scanagram.core.model.ratelimit.DenialReason;
import scanagram.core.model.ratelimit.LimiterSettings;
import scanagram.core.model.ratelimit.LimiterSnapshot;
import scanagram.core.model.ratelimit.RequestRecord;

/**
 * Rolling-window limiter with burst protection and a minimum inter-call delay.
 *
 * <p>
 * A call is admitted when all of the following hold:
 * <ul>
 * <li>fewer than {@code maxRequestsPerWindow} calls were recorded in the trailing window</li>
 * <li>no burst cooldown is running</li>
 * <li>at least {@code minInterCallDelay} has passed since the last recorded call</li>
 * </ul>
 *
 * <p>
 * A burst cooldown starts when a recorded call brings the number of calls within
 * {@code burstInterval} to {@code burstThreshold}. Once the cooldown has elapsed
 * burst tracking starts over: calls recorded before the end of the cooldown no
 * longer count toward the next burst.
 *
 * <p>
 * All timestamps are monotonic nanoseconds. Every public method holds the
 * instance lock, so {@link #tryAcquire(long, int)} checks and records
 * atomically. One instance serves one profile; instances share nothing.
 */
public class RollingWindowLimiter {

    private static final Logger LOG = Logger.getLogger(RollingWindowLimiter.class);

    private final LimiterSettings settings;
    private final long windowNanos;
    private final long minDelayNanos;
    private final long burstIntervalNanos;
    private final long burstCooldownNanos;

    private final Deque<RequestRecord> records = new ArrayDeque<>();

    private boolean hasLastCall;
    private long lastCallNanos;
    private boolean coolingDown;
    private long cooldownUntilNanos;
    private boolean hasBurstEpoch;
    private long burstEpochNanos;
    private long totalIssued;
    private long totalDenied;

    public RollingWindowLimiter(LimiterSettings settings) {
        this.settings = settings;
        this.windowNanos = settings.windowDuration().toNanos();
        this.minDelayNanos = settings.minInterCallDelay().toNanos();
        this.burstIntervalNanos = settings.burstInterval().toNanos();
        this.burstCooldownNanos = settings.burstCooldown().toNanos();
    }

    public LimiterSettings settings() {
        return settings;
    }

    /**
     * Check whether a call may be issued now, without recording it.
     *
     * @param nowNanos current monotonic time
     * @return the admission decision
     */
    public synchronized AdmissionDecision tryAdmit(long nowNanos) {
        prune(nowNanos);
        endCooldownIfElapsed(nowNanos);

        final var decision = evaluate(nowNanos);
        if (!decision.admitted()) {
            totalDenied++;
        }
        return decision;
    }

    /**
     * Record a call that is being issued.
     *
     * <p>
     * Callers that check with {@link #tryAdmit(long)} first must hold their own
     * lock across both calls; {@link #tryAcquire(long, int)} does that for them.
     *
     * @param nowNanos current monotonic time
     * @param attempt  attempt number of the call within its operation
     */
    public synchronized void recordAttempt(long nowNanos, int attempt) {
        prune(nowNanos);
        endCooldownIfElapsed(nowNanos);

        records.addLast(new RequestRecord(nowNanos, attempt));
        hasLastCall = true;
        lastCallNanos = nowNanos;
        totalIssued++;

        final var inBurst = countInBurst(nowNanos);
        if (!coolingDown && inBurst >= settings.burstThreshold()) {
            coolingDown = true;
            cooldownUntilNanos = nowNanos + burstCooldownNanos;
            LOG.warnf(
                    "Burst detected (%d calls within %s), cooling down for %s",
                    inBurst, settings.burstInterval(), settings.burstCooldown());
        }
    }

    /**
     * Admit and record a call in one step.
     *
     * @param nowNanos current monotonic time
     * @param attempt  attempt number of the call within its operation
     * @return the decision; when admitted the call has already been recorded
     */
    public synchronized AdmissionDecision tryAcquire(long nowNanos, int attempt) {
        final var decision = tryAdmit(nowNanos);
        if (!decision.admitted()) {
            return decision;
        }
        recordAttempt(nowNanos, attempt);
        return AdmissionDecision.admit(records.size(), remaining());
    }

    /**
     * Current statistics.
     *
     * @param nowNanos current monotonic time
     * @return the snapshot
     */
    public synchronized LimiterSnapshot snapshot(long nowNanos) {
        prune(nowNanos);
        endCooldownIfElapsed(nowNanos);

        final var inWindow = records.size();
        final var utilization = BigDecimal.valueOf(inWindow * 100.0 / settings.maxRequestsPerWindow())
                .setScale(1, RoundingMode.HALF_UP)
                .doubleValue();
        final var cooldownRemaining = coolingDown ? Duration.ofNanos(cooldownUntilNanos - nowNanos) : Duration.ZERO;

        return new LimiterSnapshot(
                totalIssued,
                totalDenied,
                inWindow,
                settings.maxRequestsPerWindow(),
                utilization,
                coolingDown,
                cooldownRemaining);
    }

    /**
     * Time until this limiter holds no in-window records and no running cooldown.
     *
     * <p>
     * A limiter that is idle behaves exactly like a new one, except for its
     * lifetime counters.
     *
     * @param nowNanos current monotonic time
     * @return nanoseconds until idle, zero when already idle
     */
    public synchronized long nanosUntilIdle(long nowNanos) {
        var until = 0L;
        if (!records.isEmpty()) {
            until = records.peekLast().timestampNanos() + windowNanos - nowNanos;
        }
        if (coolingDown) {
            until = Math.max(until, cooldownUntilNanos - nowNanos);
        }
        return Math.max(0L, until);
    }

    private AdmissionDecision evaluate(long nowNanos) {
        final var inWindow = records.size();

        var wait = 0L;
        var reason = DenialReason.NONE;

        if (inWindow >= settings.maxRequestsPerWindow()) {
            // The oldest record leaves the window first
            final var windowWait = records.peekFirst().timestampNanos() + windowNanos - nowNanos;
            if (windowWait > wait) {
                wait = windowWait;
                reason = DenialReason.WINDOW_EXHAUSTED;
            }
        }

        if (coolingDown) {
            final var cooldownWait = cooldownUntilNanos - nowNanos;
            if (cooldownWait > wait) {
                wait = cooldownWait;
                reason = DenialReason.BURST_COOLDOWN;
            }
        }

        if (hasLastCall) {
            final var spacingWait = lastCallNanos + minDelayNanos - nowNanos;
            if (spacingWait > wait) {
                wait = spacingWait;
                reason = DenialReason.MIN_INTERVAL;
            }
        }

        if (wait <= 0) {
            return AdmissionDecision.admit(inWindow, remaining());
        }
        return AdmissionDecision.deny(Duration.ofNanos(wait), reason, inWindow, remaining());
    }

    private void prune(long nowNanos) {
        while (!records.isEmpty() && nowNanos - records.peekFirst().timestampNanos() >= windowNanos) {
            records.pollFirst();
        }
    }

    private void endCooldownIfElapsed(long nowNanos) {
        if (coolingDown && nowNanos - cooldownUntilNanos >= 0) {
            coolingDown = false;
            hasBurstEpoch = true;
            burstEpochNanos = cooldownUntilNanos;
            LOG.debug("Burst cooldown elapsed, burst tracking reset");
        }
    }

    private int countInBurst(long nowNanos) {
        var count = 0;
        final var iterator = records.descendingIterator();
        while (iterator.hasNext()) {
            final var timestamp = iterator.next().timestampNanos();
            if (nowNanos - timestamp >= burstIntervalNanos) {
                break;
            }
            if (hasBurstEpoch && timestamp - burstEpochNanos < 0) {
                break;
            }
            count++;
        }
        return count;
    }

    private int remaining() {
        return Math.max(0, settings.maxRequestsPerWindow() - records.size());
    }
}
