package scanagram.adapter.out.telemetry;

import java.time.Duration;
import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import scanagram.config.TelemetryConfig;
import scanagram.core.model.governor.GovernorResult;
import scanagram.core.model.ratelimit.DenialReason;
import scanagram.core.port.out.GovernorMetrics;

/**
 * Records request-governance metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code scanagram.limiter.admissions} - Calls admitted by the limiter, by operation</li>
 *   <li>{@code scanagram.limiter.denials} - Admission refusals by operation and reason</li>
 *   <li>{@code scanagram.limiter.wait} - Admission waits in seconds</li>
 *   <li>{@code scanagram.governor.attempts} - Remote call attempts, by operation</li>
 *   <li>{@code scanagram.governor.backoff} - Backoff delays before retries</li>
 *   <li>{@code scanagram.governor.results} - Terminal results by operation and outcome</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerGovernorMetrics implements GovernorMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerGovernorMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.metricsEnabled();
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordAdmission(String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("scanagram.limiter.admissions")
                .description("Calls admitted by the rate limiter")
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();

        Counter.builder("scanagram.governor.attempts")
                .description("Remote call attempts")
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    @Override
    public void recordDenial(String operation, DenialReason reason, Duration wait) {
        if (!enabled) {
            return;
        }

        Counter.builder("scanagram.limiter.denials")
                .description("Calls held back by the rate limiter")
                .tag("operation", nullSafe(operation))
                .tag("reason", reason.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();

        DistributionSummary.builder("scanagram.limiter.wait")
                .description("Time spent waiting for admission")
                .baseUnit("seconds")
                .tag("reason", reason.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .record(wait.toMillis() / 1000.0);
    }

    @Override
    public void recordBackoff(String operation, int attempt, Duration delay) {
        if (!enabled) {
            return;
        }

        Timer.builder("scanagram.governor.backoff")
                .description("Delay before retrying a failed call")
                .tag("operation", nullSafe(operation))
                .register(registry)
                .record(delay);
    }

    @Override
    public void recordResult(String operation, GovernorResult<?> result) {
        if (!enabled) {
            return;
        }

        Counter.builder("scanagram.governor.results")
                .description("Terminal results of governed operations")
                .tag("operation", nullSafe(operation))
                .tag("outcome", result.state().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    private String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
