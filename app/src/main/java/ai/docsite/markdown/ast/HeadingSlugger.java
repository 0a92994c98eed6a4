package ai.docsite.markdown.ast;

import java.util.Locale;

/**
 * Derives heading anchors from flattened heading text.
 *
 * <p>The text is lowercased and trimmed, characters other than ASCII word characters, whitespace and
 * hyphens are dropped, whitespace runs become one hyphen and hyphen runs collapse. Identical headings
 * get identical ids.
 */
public final class HeadingSlugger {

    private HeadingSlugger() {
    }

    public static String slug(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String normalized = text.toLowerCase(Locale.ROOT).trim();
        StringBuilder builder = new StringBuilder(normalized.length());
        boolean pendingSeparator = false;
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            if (Character.isWhitespace(ch) || ch == '-') {
                pendingSeparator = true;
            } else if (isWordChar(ch)) {
                if (pendingSeparator) {
                    builder.append('-');
                    pendingSeparator = false;
                }
                builder.append(ch);
            }
        }
        if (pendingSeparator) {
            builder.append('-');
        }
        return builder.toString();
    }

    private static boolean isWordChar(char ch) {
        return (ch >= 'a' && ch <= 'z')
                || (ch >= 'A' && ch <= 'Z')
                || (ch >= '0' && ch <= '9')
                || ch == '_';
    }
}
