package ai.docsite.markdown.block;

import java.util.Locale;

/**
 * Column alignment declared by a table separator row.
 */
public enum TableAlignment {
    NONE,
    LEFT,
    CENTER,
    RIGHT;

    /**
     * Parses a single separator cell such as {@code :---:}.
     */
    public static TableAlignment fromSeparatorCell(String cell) {
        if (cell == null) {
            return NONE;
        }
        String trimmed = cell.trim();
        boolean leading = trimmed.startsWith(":");
        boolean trailing = trimmed.length() > 1 && trimmed.endsWith(":");
        if (leading && trailing) {
            return CENTER;
        }
        if (trailing) {
            return RIGHT;
        }
        if (leading) {
            return LEFT;
        }
        return NONE;
    }

    /**
     * Wire value used by renderers and the JSON writer; {@code null} when no alignment is set.
     */
    public String wireValue() {
        return this == NONE ? null : name().toLowerCase(Locale.ROOT);
    }
}
