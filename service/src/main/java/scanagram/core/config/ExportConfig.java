package scanagram.core.config;

import java.nio.file.Path;
import java.util.Set;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import scanagram.core.model.report.ExportFormat;

/**
 * Configuration mapping for report export.
 *
 * <p>Configuration prefix: {@code scanagram.export}
 */
@ConfigMapping(prefix = "scanagram.export")
public interface ExportConfig {

    /**
     * Directory reports are written to. Created when missing.
     *
     * @return output directory (default: results)
     */
    @WithDefault("results")
    Path directory();

    /**
     * Formats written when the caller does not choose.
     *
     * @return default formats (default: JSON and MARKDOWN)
     */
    @WithDefault("JSON,MARKDOWN")
    Set<ExportFormat> formats();
}
