package scanagram.adapter.out.export;

import java.io.IOException;
import java.nio.file.Path;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import scanagram.core.model.report.ExportFormat;
import scanagram.core.model.report.ProfileReport;
import scanagram.core.port.out.ReportWriter;

/**
 * Writes reports as pretty-printed JSON with ISO-8601 dates and durations.
 */
@ApplicationScoped
public class JsonReportWriter implements ReportWriter {

    private final ObjectMapper mapper;

    @Inject
    public JsonReportWriter(ObjectMapper objectMapper) {
        this.mapper = objectMapper
                .copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    }

    @Override
    public ExportFormat format() {
        return ExportFormat.JSON;
    }

    @Override
    public void write(ProfileReport report, Path target) throws IOException {
        mapper.writeValue(target.toFile(), report);
    }
}
