package scanagram.core.service.governor;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import scanagram.core.model.governor.CallOutcome;
import scanagram.core.model.governor.FailureCategory;
import scanagram.core.model.governor.GovernorResult;
import scanagram.core.model.governor.GovernorState;
import scanagram.core.port.out.GovernorMetrics;
import scanagram.core.port.out.Sleeper;
import scanagram.core.port.out.TimeSource;
import scanagram.core.service.ratelimit.RollingWindowLimiter;
import scanagram.core.service.retry.BackoffPolicy;

/**
 * Runs remote calls for one profile under its rate limiter and retry policy.
 *
 * <p>
 * Each attempt first waits until the limiter admits it; admission waits do not
 * count as attempts. Transient failures are retried after the backoff delay
 * until the attempt budget is spent. Fatal failures end the operation at once.
 *
 * <p>
 * All waiting goes through the {@link Sleeper}, so no thread is blocked and
 * cancelling the returned {@link Uni} abandons the pending wait without
 * recording another attempt.
 *
 * <p>
 * The activity listener runs whenever an operation starts or terminates, so an
 * owner can tell a governor that is in use from an idle one.
 */
public class RequestGovernor {

    private static final Logger LOG = Logger.getLogger(RequestGovernor.class);

    private final String key;
    private final RollingWindowLimiter limiter;
    private final BackoffPolicy backoff;
    private final TimeSource timeSource;
    private final Sleeper sleeper;
    private final FailureClassifier classifier;
    private final GovernorMetrics metrics;
    private final Runnable activityListener;
    private final AtomicInteger inFlight = new AtomicInteger();

    public RequestGovernor(
            String key,
            RollingWindowLimiter limiter,
            BackoffPolicy backoff,
            TimeSource timeSource,
            Sleeper sleeper,
            FailureClassifier classifier,
            GovernorMetrics metrics) {
        this(key, limiter, backoff, timeSource, sleeper, classifier, metrics, () -> {});
    }

    public RequestGovernor(
            String key,
            RollingWindowLimiter limiter,
            BackoffPolicy backoff,
            TimeSource timeSource,
            Sleeper sleeper,
            FailureClassifier classifier,
            GovernorMetrics metrics,
            Runnable activityListener) {
        this.key = key;
        this.limiter = limiter;
        this.backoff = backoff;
        this.timeSource = timeSource;
        this.sleeper = sleeper;
        this.classifier = classifier;
        this.metrics = metrics;
        this.activityListener = activityListener;
    }

    public String key() {
        return key;
    }

    public RollingWindowLimiter limiter() {
        return limiter;
    }

    public BackoffPolicy backoff() {
        return backoff;
    }

    /**
     * Whether an operation is running, including its admission and backoff waits.
     *
     * @return true while at least one operation has not terminated
     */
    public boolean isBusy() {
        return inFlight.get() > 0;
    }

    /**
     * Run an operation until it succeeds, fails fatally, or runs out of attempts.
     *
     * <p>
     * The supplier is invoked once per attempt and must start a fresh call each
     * time. Exceptions it throws and failures of the Uni it returns are
     * classified with {@link FailureClassifier}.
     *
     * @param operation name used in logs and metrics
     * @param call      starts one remote call
     * @param <T>       the response type
     * @return a Uni emitting the terminal result; it never fails for call errors
     */
    public <T> Uni<GovernorResult<T>> execute(String operation, Supplier<Uni<CallOutcome<T>>> call) {
        return Uni.createFrom()
                .deferred(() -> {
                    inFlight.incrementAndGet();
                    activityListener.run();
                    LOG.debugf("[%s] %s: %s", key, operation, GovernorState.IDLE);
                    return attempt(operation, call, 1);
                })
                .invoke(result -> {
                    LOG.debugf("[%s] %s: %s after %d attempt(s)", key, operation, result.state(), result.attempts());
                    metrics.recordResult(operation, result);
                })
                .onTermination()
                .invoke(() -> {
                    inFlight.decrementAndGet();
                    activityListener.run();
                });
    }

    private <T> Uni<GovernorResult<T>> attempt(String operation, Supplier<Uni<CallOutcome<T>>> call, int attempt) {
        return awaitAdmission(operation, attempt)
                .chain(() -> invoke(operation, call, attempt))
                .chain(outcome -> handle(operation, call, attempt, outcome));
    }

    private Uni<Void> awaitAdmission(String operation, int attempt) {
        return Uni.createFrom().deferred(() -> {
            final var decision = limiter.tryAcquire(timeSource.monotonicNanos(), attempt);
            if (decision.admitted()) {
                metrics.recordAdmission(operation);
                return Uni.createFrom().voidItem();
            }

            metrics.recordDenial(operation, decision.reason(), decision.retryAfter());
            LOG.debugf(
                    "[%s] %s: %s for %s (%s)",
                    key, operation, GovernorState.WAITING_FOR_ADMISSION, decision.retryAfter(), decision.reason());
            return sleeper.sleep(decision.retryAfter()).chain(() -> awaitAdmission(operation, attempt));
        });
    }

    private <T> Uni<CallOutcome<T>> invoke(String operation, Supplier<Uni<CallOutcome<T>>> call, int attempt) {
        LOG.debugf("[%s] %s: %s attempt %d", key, operation, GovernorState.EXECUTING, attempt);
        return Uni.createFrom()
                .deferred(() -> {
                    final var pending = call.get();
                    if (pending == null) {
                        return Uni.createFrom()
                                .<CallOutcome<T>>failure(new IllegalStateException("Call did not start"));
                    }
                    return pending;
                })
                .onItem()
                .ifNull()
                .continueWith(() -> CallOutcome.failure(FailureCategory.UNEXPECTED, "Call completed without outcome"))
                .onFailure()
                .recoverWithItem(failure -> classifier.<T>toOutcome(failure));
    }

    private <T> Uni<GovernorResult<T>> handle(
            String operation, Supplier<Uni<CallOutcome<T>>> call, int attempt, CallOutcome<T> outcome) {
        if (outcome instanceof CallOutcome.Success<T> success) {
            return Uni.createFrom().item(new GovernorResult.Success<>(success.value(), attempt));
        }
        if (outcome instanceof CallOutcome.FatalFailure<T> fatal) {
            return Uni.createFrom()
                    .item(new GovernorResult.FatalFailure<>(fatal.category(), fatal.message(), attempt));
        }

        final var failure = (CallOutcome.TransientFailure<T>) outcome;
        if (!backoff.shouldRetry(attempt)) {
            return Uni.createFrom()
                    .item(new GovernorResult.RetriesExhausted<>(attempt, failure.category(), failure.message()));
        }

        final var delay = backoff.delayForAttempt(attempt);
        metrics.recordBackoff(operation, attempt, delay);
        LOG.debugf(
                "[%s] %s: %s on attempt %d (%s: %s), retrying in %s",
                key, operation, GovernorState.TRANSIENT_FAILURE, attempt, failure.category(), failure.message(), delay);
        return sleeper.sleep(delay).chain(() -> attempt(operation, call, attempt + 1));
    }

    /**
     * Wait a caller should observe before trying again after the retries ran out.
     *
     * @return the longest backoff delay before jitter
     */
    public Duration suggestedRetryAfter() {
        return backoff.baseDelayForAttempt(backoff.maxAttempts());
    }
}
