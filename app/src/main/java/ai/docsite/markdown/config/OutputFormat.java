package ai.docsite.markdown.config;

import java.util.Locale;

/**
 * Output produced by the convert command, with the file extension used when no output path is given.
 */
public enum OutputFormat {
    HTML("html"),
    JSON("json"),
    MARKDOWN("md");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static OutputFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Output format must be provided");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("MD")) {
            return MARKDOWN;
        }
        try {
            return OutputFormat.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported output format: " + raw, ex);
        }
    }
}
