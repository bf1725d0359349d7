package scanagram.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry.
 *
 * <p>Example configuration:
 * <pre>{@code
 * scanagram.telemetry.metrics-enabled=false
 * }</pre>
 */
@ConfigMapping(prefix = "scanagram.telemetry")
public interface TelemetryConfig {

    /**
     * Record limiter and governor metrics with Micrometer.
     */
    @WithDefault("true")
    boolean metricsEnabled();
}
