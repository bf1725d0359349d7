package scanagram.adapter.in.rest;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import scanagram.core.model.report.ExportFormat;
import scanagram.core.model.report.ProfileReport;
import scanagram.core.port.in.ProfileReporting;
import scanagram.core.service.export.ReportExportService;

/**
 * REST resource for profile reports.
 *
 * <p>
 * Provides endpoints for:
 * <ul>
 * <li>Collecting and returning a profile report</li>
 * <li>Collecting a report and exporting it to files</li>
 * <li>Inspecting a profile's rate limiter</li>
 * </ul>
 *
 * <p>
 * Collection can take minutes: every remote call waits for the profile's
 * limiter, and failed calls are retried with backoff.
 */
@Path("/profiles")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class ProfileReportResource {

    private static final Logger LOG = Logger.getLogger(ProfileReportResource.class);

    private final ProfileReporting reporting;
    private final ReportExportService exportService;

    public ProfileReportResource(ProfileReporting reporting, ReportExportService exportService) {
        this.reporting = reporting;
        this.exportService = exportService;
    }

    /**
     * Collect and analyze a profile.
     *
     * @param username the profile
     * @return the report
     */
    @GET
    @Path("/{username}/report")
    public Uni<Response> report(@PathParam("username") String username) {
        return reporting.collect(username).map(report -> Response.ok(report).build());
    }

    /**
     * Collect a profile and write the report to the export directory.
     *
     * @param username the profile
     * @param format   {@code json}, {@code markdown} or {@code both}; the configured formats when absent
     * @return the written files and the engagement summary
     */
    @POST
    @Path("/{username}/exports")
    public Uni<Response> export(@PathParam("username") String username, @QueryParam("format") String format) {
        final var formats = format != null ? ExportFormat.parseSelection(format) : null;

        return reporting
                .collect(username)
                // File writes block
                .emitOn(Infrastructure.getDefaultWorkerPool())
                .map(report -> {
                    final var files = formats != null
                            ? exportService.export(report, formats)
                            : exportService.exportDefault(report);
                    LOG.infof("Exported %d file(s) for %s", files.size(), report.username());
                    return Response.status(Response.Status.CREATED)
                            .entity(exportBody(report, files))
                            .build();
                });
    }

    /**
     * Current limiter statistics of a profile.
     *
     * @param username the profile
     * @return the limiter snapshot
     */
    @GET
    @Path("/{username}/limiter")
    public Response limiter(@PathParam("username") String username) {
        return Response.ok(reporting.limiterStatus(username)).build();
    }

    private Map<String, Object> exportBody(ProfileReport report, Map<ExportFormat, java.nio.file.Path> files) {
        final var paths = new LinkedHashMap<String, String>();
        files.forEach((format, file) -> paths.put(format.name().toLowerCase(Locale.ROOT), file.toString()));

        final var body = new LinkedHashMap<String, Object>();
        body.put("username", report.username());
        body.put("files", paths);
        body.put("engagement", report.engagement());
        body.put("collection", report.collection());
        return body;
    }
}
