package scanagram.core.model.report;

import java.nio.file.Path;

/**
 * Thrown when a report cannot be written to disk.
 */
public class ReportExportException extends RuntimeException {

    private final ExportFormat format;
    private final transient Path target;

    public ReportExportException(ExportFormat format, Path target, Throwable cause) {
        super("Failed to write %s report to %s".formatted(format, target), cause);
        this.format = format;
        this.target = target;
    }

    public ExportFormat format() {
        return format;
    }

    public Path target() {
        return target;
    }
}
