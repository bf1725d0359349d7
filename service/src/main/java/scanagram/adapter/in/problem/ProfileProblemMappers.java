package scanagram.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import scanagram.core.model.governor.FailureCategory;
import scanagram.core.model.profile.ProfileCollectionException;
import scanagram.core.model.report.ReportExportException;

/**
 * Exception mappers converting collection and export failures to RFC 7807
 * Problem Details.
 */
@ApplicationScoped
public class ProfileProblemMappers {

    private static final Logger LOG = Logger.getLogger(ProfileProblemMappers.class);
    static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapProfileCollectionException(ProfileCollectionException e) {
        final var category = e.category();

        if (e.isRetriesExhausted()) {
            final var seconds = Math.max(1L, e.retryAfter().toSeconds());
            LOG.warnv("Giving up on {0}: {1}", e.username(), e.getMessage());
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .header(HttpHeaders.RETRY_AFTER, seconds)
                    .type(PROBLEM_JSON)
                    .entity(ProfileProblem.retriesExhausted(e.username(), category, seconds))
                    .build();
        }

        if (category == FailureCategory.NOT_FOUND) {
            LOG.debugv("Profile not found: {0}", e.username());
            return toResponse(ProfileProblem.profileNotFound(e.username(), category));
        }

        if (category == FailureCategory.FORBIDDEN || category == FailureCategory.UNAUTHORIZED) {
            LOG.debugv("Access to {0} refused: {1}", e.username(), category);
            return toResponse(ProfileProblem.accessRefused(e.username(), category));
        }

        LOG.warnv("Collecting {0} failed: {1}", e.username(), e.getMessage());
        return toResponse(ProfileProblem.badGateway(e.getMessage(), category));
    }

    @ServerExceptionMapper
    public Response mapReportExportException(ReportExportException e) {
        LOG.errorv(e, "Export failed: {0}", e.getMessage());
        return toResponse(ProfileProblem.internalError(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(ProfileProblem.validationError(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
