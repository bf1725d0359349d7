package scanagram.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import scanagram.core.config.RateLimitConfig;
import scanagram.core.config.RetryConfig;
import scanagram.core.model.ratelimit.LimiterSettings;
import scanagram.core.model.retry.BackoffSettings;

/**
 * Produces the settings records core services are built from.
 * Invalid values fail here, at startup.
 */
@ApplicationScoped
public class GovernanceProducer {

    private final RateLimitConfig rateLimitConfig;
    private final RetryConfig retryConfig;

    @Inject
    public GovernanceProducer(RateLimitConfig rateLimitConfig, RetryConfig retryConfig) {
        this.rateLimitConfig = rateLimitConfig;
        this.retryConfig = retryConfig;
    }

    @Produces
    @Singleton
    public LimiterSettings limiterSettings() {
        return rateLimitConfig.toSettings();
    }

    @Produces
    @Singleton
    public BackoffSettings backoffSettings() {
        return retryConfig.toSettings();
    }
}
