package scanagram.core.service.export;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import scanagram.core.config.ExportConfig;
import scanagram.core.model.report.ExportFormat;
import scanagram.core.model.report.ProfileReport;
import scanagram.core.model.report.ReportExportException;
import scanagram.core.port.out.ReportWriter;

/**
 * Writes reports to the export directory in one or more formats.
 *
 * <p>
 * Files are named {@code scanagram_{username}_{yyyyMMdd_HHmmss}.{ext}}, stamped
 * with the report's generation time in UTC.
 */
@ApplicationScoped
public class ReportExportService {

    private static final Logger LOG = Logger.getLogger(ReportExportService.class);

    static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Map<ExportFormat, ReportWriter> writers = new EnumMap<>(ExportFormat.class);
    private final Path directory;
    private final Set<ExportFormat> defaultFormats;

    @Inject
    public ReportExportService(Instance<ReportWriter> writers, ExportConfig config) {
        this(writers.stream().toList(), config.directory(), config.formats());
    }

    public ReportExportService(List<ReportWriter> writers, Path directory, Set<ExportFormat> defaultFormats) {
        for (final var writer : writers) {
            this.writers.put(writer.format(), writer);
        }
        this.directory = directory;
        this.defaultFormats = Set.copyOf(defaultFormats);
    }

    /**
     * Write the report in the configured default formats.
     *
     * @param report the report
     * @return written files by format
     */
    public Map<ExportFormat, Path> exportDefault(ProfileReport report) {
        return export(report, defaultFormats);
    }

    /**
     * Write the report in each requested format.
     *
     * @param report  the report
     * @param formats formats to write
     * @return written files by format, in format order
     * @throws IllegalArgumentException if no formats are requested or a format has no writer
     * @throws ReportExportException    if a file cannot be written
     */
    public Map<ExportFormat, Path> export(ProfileReport report, Set<ExportFormat> formats) {
        if (formats == null || formats.isEmpty()) {
            throw new IllegalArgumentException("At least one export format is required");
        }

        final var written = new LinkedHashMap<ExportFormat, Path>();
        for (final var format : new TreeSet<>(formats)) {
            final var writer = writers.get(format);
            if (writer == null) {
                throw new IllegalArgumentException("No writer available for format " + format);
            }

            final var target = directory.resolve(fileName(report, format));
            try {
                Files.createDirectories(directory);
                writer.write(report, target);
            } catch (IOException e) {
                throw new ReportExportException(format, target, e);
            }
            LOG.infof("Exported %s report for %s to %s", format, report.username(), target);
            written.put(format, target);
        }
        return written;
    }

    static String fileName(ProfileReport report, ExportFormat format) {
        final var safeName = report.username().replaceAll("[^A-Za-z0-9._-]", "_");
        final var timestamp = FILE_TIMESTAMP.format(report.collection().generatedAt());
        return "scanagram_%s_%s.%s".formatted(safeName, timestamp, format.extension());
    }
}
