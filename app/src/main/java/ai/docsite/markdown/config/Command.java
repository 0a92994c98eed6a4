package ai.docsite.markdown.config;

import java.util.Locale;

/**
 * Command executed by a command-line run.
 */
public enum Command {
    CONVERT,
    VALIDATE,
    STATS,
    TOC;

    public static Command from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Command must be provided");
        }
        try {
            return Command.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown command: " + raw + " (expected convert, validate, stats or toc)", ex);
        }
    }
}
