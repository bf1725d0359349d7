package scanagram.adapter.out.http;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the remote profile API.
 *
 * <p>Configuration prefix: {@code scanagram.source}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code SCANAGRAM_SOURCE_BASE_URL} - Base URL of the profile API</li>
 *   <li>{@code SCANAGRAM_SOURCE_ACCESS_TOKEN} - Bearer token of the logged-in session</li>
 * </ul>
 */
@ConfigMapping(prefix = "scanagram.source")
public interface SourceConfig {

    /**
     * Base URL of the profile API, without a trailing slash.
     *
     * @return base URL (default: http://localhost:8081)
     */
    @WithDefault("http://localhost:8081")
    URI baseUrl();

    /**
     * Access token sent as a bearer token. Only profiles the session is
     * allowed to see are returned.
     *
     * @return the token, if configured
     */
    Optional<String> accessToken();

    /**
     * Timeout of a single call.
     *
     * @return request timeout (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration requestTimeout();

    /**
     * User agent identifying this client.
     *
     * @return user agent (default: scanagram/1.0)
     */
    @WithDefault("scanagram/1.0")
    String userAgent();
}
