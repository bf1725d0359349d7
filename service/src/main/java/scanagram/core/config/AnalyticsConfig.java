package scanagram.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the engagement analysis.
 *
 * <p>Configuration prefix: {@code scanagram.analytics}
 */
@ConfigMapping(prefix = "scanagram.analytics")
public interface AnalyticsConfig {

    /**
     * Entries kept in hashtag and location rankings.
     *
     * @return top N (default: 10)
     */
    @WithDefault("10")
    int topN();

    /**
     * Posts kept in the top-posts ranking.
     *
     * @return top posts (default: 5)
     */
    @WithDefault("5")
    int topPosts();
}
