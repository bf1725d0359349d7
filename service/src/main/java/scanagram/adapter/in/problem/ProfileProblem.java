package scanagram.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

import scanagram.core.model.governor.FailureCategory;

/**
 * RFC 7807 Problem Details factory for profile endpoints.
 *
 * <p>Failures of the remote profile service carry the failure category of the
 * last call as a {@code category} extension member; exhausted retries also
 * carry {@code retryAfter} in seconds.
 */
public final class ProfileProblem {

    private ProfileProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Remote Failures ==========

    public static HttpProblem profileNotFound(String username, FailureCategory category) {
        return HttpProblem.builder()
                .withTitle("Profile Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail("Profile '%s' does not exist".formatted(username))
                .with("category", categoryName(category))
                .build();
    }

    public static HttpProblem accessRefused(String username, FailureCategory category) {
        return HttpProblem.builder()
                .withTitle("Forbidden")
                .withStatus(Status.FORBIDDEN)
                .withDetail("Access to profile '%s' was refused by the remote service".formatted(username))
                .with("category", categoryName(category))
                .build();
    }

    public static HttpProblem badGateway(String detail, FailureCategory category) {
        final var builder = HttpProblem.builder()
                .withTitle("Bad Gateway")
                .withStatus(Status.BAD_GATEWAY)
                .withDetail(detail);
        if (category != null) {
            builder.with("category", categoryName(category));
        }
        return builder.build();
    }

    /**
     * Create a 503 problem for a profile whose remote calls kept failing.
     *
     * @param username          the profile being collected
     * @param category          category of the last failed attempt
     * @param retryAfterSeconds seconds until the client should retry
     * @return service unavailable problem
     */
    public static HttpProblem retriesExhausted(String username, FailureCategory category, long retryAfterSeconds) {
        return HttpProblem.builder()
                .withTitle("Service Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail("Remote service kept failing for profile '%s'".formatted(username))
                .with("category", categoryName(category))
                .with("retryAfter", retryAfterSeconds)
                .build();
    }

    // ========== Local Failures ==========

    public static HttpProblem validationError(String detail) {
        return HttpProblem.builder()
                .withTitle("Validation Error")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem internalError(String detail) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }

    private static String categoryName(FailureCategory category) {
        return category != null ? category.name() : FailureCategory.UNEXPECTED.name();
    }
}
