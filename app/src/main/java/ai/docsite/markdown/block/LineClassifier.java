package ai.docsite.markdown.block;

import java.util.ArrayList;
import java.util.List;

/**
 * Character-level predicates deciding which block construct a line opens.
 */
public final class LineClassifier {

    static final int MAX_HEADING_LEVEL = 6;
    static final int MIN_FENCE_LENGTH = 3;
    private static final int MAX_LIST_START_INDENT = 3;
    private static final int MAX_ORDINAL_DIGITS = 9;

    private LineClassifier() {
    }

    public static LineKind classify(String line) {
        if (isBlank(line)) {
            return LineKind.BLANK;
        }
        if (headingLevel(line) > 0) {
            return LineKind.HEADING;
        }
        if (isThematicBreak(line)) {
            return LineKind.THEMATIC_BREAK;
        }
        if (fenceLength(line) > 0) {
            return LineKind.FENCE;
        }
        if (isBlockquote(line)) {
            return LineKind.BLOCKQUOTE;
        }
        if (listMarker(line, false) != null) {
            return LineKind.LIST_ITEM;
        }
        if (htmlTagName(line) != null) {
            return LineKind.HTML;
        }
        if (isIndented(line)) {
            return LineKind.INDENTED;
        }
        return LineKind.TEXT;
    }

    public static boolean isBlank(String line) {
        return line == null || line.isBlank();
    }

    /**
     * Returns the ATX heading level of the line, or {@code 0} when the line is not a heading.
     * Seven or more leading hashes never form a heading.
     */
    public static int headingLevel(String line) {
        int hashes = countRun(line, 0, '#');
        if (hashes == 0 || hashes > MAX_HEADING_LEVEL || hashes >= line.length()) {
            return 0;
        }
        if (!Character.isWhitespace(line.charAt(hashes))) {
            return 0;
        }
        // at least one character must follow the separating whitespace
        if (line.length() == hashes + 1) {
            return 0;
        }
        return hashes;
    }

    /**
     * Heading text with the separator, an optional closing hash sequence and surrounding whitespace removed.
     */
    public static String headingText(String line, int level) {
        String content = line.substring(level + 1);
        int end = content.length();
        int run = end;
        while (run > 0 && content.charAt(run - 1) == '#') {
            run--;
        }
        if (run < end && run > 0 && Character.isWhitespace(content.charAt(run - 1))) {
            int textEnd = run;
            while (textEnd > 0 && Character.isWhitespace(content.charAt(textEnd - 1))) {
                textEnd--;
            }
            if (textEnd > 0) {
                end = textEnd;
            }
        }
        return content.substring(0, end).trim();
    }

    /**
     * Three or more of the same {@code *}, {@code -} or {@code _}, with at most one whitespace between markers.
     */
    public static boolean isThematicBreak(String line) {
        if (line == null) {
            return false;
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        char marker = trimmed.charAt(0);
        if (marker != '*' && marker != '-' && marker != '_') {
            return false;
        }
        int count = 0;
        int index = 0;
        while (index < trimmed.length()) {
            if (trimmed.charAt(index) != marker) {
                return false;
            }
            count++;
            index++;
            if (index < trimmed.length() && Character.isWhitespace(trimmed.charAt(index))) {
                index++;
            }
        }
        return count >= 3;
    }

    /**
     * Length of the opening backtick or tilde run at column zero, or {@code 0} when the line opens no fence.
     */
    public static int fenceLength(String line) {
        if (line == null || line.isEmpty()) {
            return 0;
        }
        char first = line.charAt(0);
        if (first != '`' && first != '~') {
            return 0;
        }
        int run = countRun(line, 0, first);
        return run >= MIN_FENCE_LENGTH ? run : 0;
    }

    public static boolean isBlockquote(String line) {
        return line != null && line.startsWith(">");
    }

    /**
     * Matches a bullet ({@code * + -}) or ordinal ({@code 1.} / {@code 1)}) marker followed by whitespace.
     *
     * @param line        the candidate line
     * @param anyIndent   when {@code false} at most three leading spaces are allowed, as for the first item
     *                    of a list; when {@code true} any leading whitespace is accepted
     * @return the marker, or {@code null} when the line is not a list item
     */
    public static ListMarker listMarker(String line, boolean anyIndent) {
        if (line == null) {
            return null;
        }
        int length = line.length();
        int index = 0;
        if (anyIndent) {
            while (index < length && Character.isWhitespace(line.charAt(index))) {
                index++;
            }
        } else {
            while (index < length && line.charAt(index) == ' ') {
                index++;
            }
            if (index > MAX_LIST_START_INDENT) {
                return null;
            }
        }
        if (index >= length) {
            return null;
        }

        char ch = line.charAt(index);
        String marker;
        boolean ordered;
        int markerEnd;
        if (ch == '*' || ch == '+' || ch == '-') {
            marker = String.valueOf(ch);
            ordered = false;
            markerEnd = index + 1;
        } else if (isAsciiDigit(ch)) {
            int digitsEnd = index;
            while (digitsEnd < length && isAsciiDigit(line.charAt(digitsEnd))) {
                digitsEnd++;
            }
            if (digitsEnd - index > MAX_ORDINAL_DIGITS || digitsEnd >= length) {
                return null;
            }
            char delimiter = line.charAt(digitsEnd);
            if (delimiter != '.' && delimiter != ')') {
                return null;
            }
            marker = line.substring(index, digitsEnd);
            ordered = true;
            markerEnd = digitsEnd + 1;
        } else {
            return null;
        }

        if (markerEnd >= length || !Character.isWhitespace(line.charAt(markerEnd))) {
            return null;
        }
        int contentStart = markerEnd;
        while (contentStart < length && Character.isWhitespace(line.charAt(contentStart))) {
            contentStart++;
        }
        return new ListMarker(marker, ordered, contentStart);
    }

    /**
     * Name of the tag opening the line ({@code <div ...} yields {@code div}), or {@code null}.
     */
    public static String htmlTagName(String line) {
        if (line == null || line.length() < 2 || line.charAt(0) != '<' || !isAsciiLetter(line.charAt(1))) {
            return null;
        }
        int end = 2;
        while (end < line.length()) {
            char ch = line.charAt(end);
            if (!isAsciiLetter(ch) && !isAsciiDigit(ch) && ch != '-') {
                break;
            }
            end++;
        }
        return line.substring(1, end);
    }

    public static boolean isIndented(String line) {
        return line != null && (line.startsWith("    ") || line.startsWith("\t"));
    }

    /**
     * Removes one level of indentation: four spaces or one tab.
     */
    public static String dedent(String line) {
        if (line.startsWith("    ")) {
            return line.substring(4);
        }
        if (line.startsWith("\t")) {
            return line.substring(1);
        }
        return line;
    }

    /**
     * A separator row: a non-blank line whose cells are each {@code :?-+:?} or empty, so {@code |} alone qualifies.
     */
    public static boolean isTableSeparator(String line) {
        if (line == null || line.isBlank()) {
            return false;
        }
        for (String cell : splitOnPipes(line)) {
            String trimmed = cell.trim();
            if (!trimmed.isEmpty() && !isSeparatorCell(trimmed)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Splits a table row into trimmed cells, ignoring one leading and one trailing pipe.
     */
    public static List<String> splitTableRow(String line) {
        String trimmed = line.trim();
        int start = trimmed.startsWith("|") ? 1 : 0;
        int end = trimmed.length();
        if (end > start && trimmed.endsWith("|")) {
            end--;
        }
        List<String> cells = new ArrayList<>();
        for (String cell : splitOnPipes(trimmed.substring(start, end))) {
            cells.add(cell.trim());
        }
        return cells;
    }

    static int countRun(String text, int from, char ch) {
        int index = from;
        while (index < text.length() && text.charAt(index) == ch) {
            index++;
        }
        return index - from;
    }

    private static boolean isSeparatorCell(String cell) {
        int start = cell.startsWith(":") ? 1 : 0;
        int end = cell.length() > start && cell.endsWith(":") ? cell.length() - 1 : cell.length();
        if (end <= start) {
            return false;
        }
        for (int i = start; i < end; i++) {
            if (cell.charAt(i) != '-') {
                return false;
            }
        }
        return true;
    }

    private static List<String> splitOnPipes(String text) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '|') {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    private static boolean isAsciiDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isAsciiLetter(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }
}
