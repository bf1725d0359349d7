package scanagram.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for profile collection.
 *
 * <p>Configuration prefix: {@code scanagram.collection}
 */
@ConfigMapping(prefix = "scanagram.collection")
public interface CollectionConfig {

    /**
     * Maximum posts collected per profile.
     *
     * @return max posts (default: 50)
     */
    @WithDefault("50")
    int maxPosts();

    /**
     * Posts requested per page. Every page costs one call against the quota.
     *
     * @return page size (default: 12)
     */
    @WithDefault("12")
    int pageSize();
}
