package scanagram.core.model.report;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * File formats a report can be exported to.
 */
public enum ExportFormat {
    JSON("json"),
    MARKDOWN("md");

    private final String extension;

    ExportFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * Parse a format selector: {@code json}, {@code markdown} or {@code both}.
     *
     * @param value the selector, case-insensitive
     * @return the selected formats
     * @throws IllegalArgumentException for an unknown selector
     */
    public static Set<ExportFormat> parseSelection(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Export format is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "json" -> EnumSet.of(JSON);
            case "markdown", "md" -> EnumSet.of(MARKDOWN);
            case "both" -> EnumSet.allOf(ExportFormat.class);
            default -> throw new IllegalArgumentException("Unknown export format: " + value);
        };
    }
}
