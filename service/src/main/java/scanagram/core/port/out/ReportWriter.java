package scanagram.core.port.out;

import java.io.IOException;
import java.nio.file.Path;

import scanagram.core.model.report.ExportFormat;
import scanagram.core.model.report.ProfileReport;

/**
 * Port for serializing a report to a file.
 */
public interface ReportWriter {

    /**
     * The format this writer produces.
     *
     * @return the format
     */
    ExportFormat format();

    /**
     * Write the report to the given file, replacing it if it exists.
     *
     * @param report the report
     * @param target the file to write
     * @throws IOException when the file cannot be written
     */
    void write(ProfileReport report, Path target) throws IOException;
}
