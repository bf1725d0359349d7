package scanagram.adapter.out.http;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeoutException;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import scanagram.adapter.out.http.dto.PostPagePayload;
import scanagram.adapter.out.http.dto.ProfilePayload;
import scanagram.core.model.governor.CallOutcome;
import scanagram.core.model.governor.FailureCategory;
import scanagram.core.model.profile.PostPage;
import scanagram.core.model.profile.ProfileMetadata;
import scanagram.core.port.out.ProfileSource;

/**
 * HTTP adapter for the remote profile API using Vert.x WebClient.
 *
 * <p>
 * Every response is classified into a {@link CallOutcome}; the returned Uni
 * does not fail for HTTP or transport errors.
 * <ul>
 * <li>2xx - success, body parsed</li>
 * <li>429, 408, 5xx - transient</li>
 * <li>400, 401, 403, 404 and any other status - fatal</li>
 * <li>connection errors and timeouts - transient</li>
 * <li>unparseable bodies - fatal; single malformed posts are skipped</li>
 * </ul>
 */
@ApplicationScoped
public class HttpProfileSource implements ProfileSource {

    private static final Logger LOG = Logger.getLogger(HttpProfileSource.class);

    private final Vertx vertx;
    private final SourceConfig config;
    private final ObjectMapper objectMapper;
    private WebClient webClient;

    @Inject
    public HttpProfileSource(Vertx vertx, SourceConfig config, ObjectMapper objectMapper) {
        this.vertx = vertx;
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    void init() {
        final var options = new WebClientOptions().setUserAgent(config.userAgent());
        this.webClient = WebClient.create(vertx, options);
    }

    @Override
    public Uni<CallOutcome<ProfileMetadata>> fetchProfile(String username) {
        final var request = prepare(webClient.getAbs(baseUrl() + "/profiles/" + encode(username)));
        return send(request, "profile " + username, body -> objectMapper
                .readValue(body, ProfilePayload.class)
                .toDomain());
    }

    @Override
    public Uni<CallOutcome<PostPage>> fetchPostPage(String username, String cursor, int limit) {
        final var request = prepare(webClient.getAbs(baseUrl() + "/profiles/" + encode(username) + "/posts"))
                .addQueryParam("limit", String.valueOf(limit));
        if (cursor != null) {
            request.addQueryParam("cursor", cursor);
        }
        return send(request, "posts of " + username, body -> objectMapper
                .readValue(body, PostPagePayload.class)
                .toDomain((post, reason) -> LOG.warnf(
                        "Skipping malformed post %s of %s: %s", post.shortcode(), username, reason.getMessage())));
    }

    private HttpRequest<Buffer> prepare(HttpRequest<Buffer> request) {
        request.timeout(config.requestTimeout().toMillis())
                .putHeader(HttpHeaders.ACCEPT.toString(), "application/json");
        config.accessToken()
                .filter(token -> !token.isBlank())
                .ifPresent(request::bearerTokenAuthentication);
        return request;
    }

    private <T> Uni<CallOutcome<T>> send(HttpRequest<Buffer> request, String description, BodyParser<T> parser) {
        return request.send()
                .map(response -> classify(response, description, parser))
                .onFailure()
                .recoverWithItem(failure -> transportFailure(description, failure));
    }

    private <T> CallOutcome<T> classify(HttpResponse<Buffer> response, String description, BodyParser<T> parser) {
        final var status = response.statusCode();
        if (status >= 200 && status < 300) {
            final var body = response.bodyAsString();
            if (body == null || body.isBlank()) {
                return CallOutcome.failure(FailureCategory.UNEXPECTED, "Empty response body for " + description);
            }
            try {
                return CallOutcome.success(parser.parse(body));
            } catch (Exception e) {
                LOG.warnf("Malformed response for %s: %s", description, e.getMessage());
                return CallOutcome.failure(FailureCategory.UNEXPECTED, "Malformed response for " + description);
            }
        }

        final var category = categorize(status);
        LOG.debugf("HTTP %d for %s (%s)", status, description, category);
        return CallOutcome.failure(category, "HTTP " + status + " for " + description);
    }

    static FailureCategory categorize(int status) {
        if (status == 429) {
            return FailureCategory.RATE_LIMITED;
        }
        if (status == 408) {
            return FailureCategory.TIMEOUT;
        }
        if (status >= 500 && status < 600) {
            return FailureCategory.UNAVAILABLE;
        }
        return switch (status) {
            case 400 -> FailureCategory.INVALID_REQUEST;
            case 401 -> FailureCategory.UNAUTHORIZED;
            case 403 -> FailureCategory.FORBIDDEN;
            case 404 -> FailureCategory.NOT_FOUND;
            default -> FailureCategory.UNEXPECTED;
        };
    }

    private <T> CallOutcome<T> transportFailure(String description, Throwable failure) {
        final var category = failure instanceof TimeoutException ? FailureCategory.TIMEOUT : FailureCategory.NETWORK;
        LOG.debugf("Transport failure for %s: %s", description, failure.toString());
        return CallOutcome.failure(category, failure.getMessage() != null ? failure.getMessage() : failure.toString());
    }

    private String baseUrl() {
        final var base = config.baseUrl().toString();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8)
                .replace("+", "%20");
    }

    @FunctionalInterface
    private interface BodyParser<T> {
        T parse(String body) throws Exception;
    }
}
