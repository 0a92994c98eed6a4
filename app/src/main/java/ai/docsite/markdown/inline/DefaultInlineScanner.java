package ai.docsite.markdown.inline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Left-to-right inline scanner. At each position the structured matchers are tried in priority order
 * (escape, code span, link, image, strong, emphasis, strikethrough) and the first match wins.
 *
 * <p>Overlapping emphasis is resolved by that order alone; there is no delimiter-run bookkeeping
 * across positions. Adjacent plain text is merged into one {@link InlineToken.Text}.
 */
public class DefaultInlineScanner implements InlineScanner {

    private static final String ESCAPABLE = "\\`*{}[]()#+-.!_>~|";
    private static final String MARKERS = "\\`*_[]~";

    private final boolean strikethrough;

    public DefaultInlineScanner() {
        this(true);
    }

    public DefaultInlineScanner(boolean strikethrough) {
        this.strikethrough = strikethrough;
    }

    @Override
    public List<InlineToken> scan(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }

        List<InlineToken> tokens = new ArrayList<>();
        int position = 0;
        while (position < text.length()) {
            Match match = matchAt(text, position);
            if (match == null) {
                int end = textRunEnd(text, position);
                if (end == position) {
                    end = position + 1;
                }
                String run = text.substring(position, end);
                match = new Match(new InlineToken.Text(run), end);
            }
            append(tokens, match.token());
            position = match.end();
        }
        return tokens;
    }

    private Match matchAt(String text, int position) {
        Match match = escape(text, position);
        if (match == null) {
            match = codeSpan(text, position);
        }
        if (match == null) {
            match = link(text, position);
        }
        if (match == null) {
            match = image(text, position);
        }
        if (match == null) {
            match = strong(text, position);
        }
        if (match == null) {
            match = emphasis(text, position);
        }
        if (match == null && strikethrough) {
            match = strikethrough(text, position);
        }
        return match;
    }

    private Match escape(String text, int position) {
        if (text.charAt(position) != '\\' || position + 1 >= text.length()) {
            return null;
        }
        char escaped = text.charAt(position + 1);
        if (ESCAPABLE.indexOf(escaped) < 0) {
            return null;
        }
        return new Match(new InlineToken.Text(String.valueOf(escaped), text.substring(position, position + 2)), position + 2);
    }

    /**
     * A backtick run closes only on a run of the same length. An unclosed run is kept as literal text.
     */
    private Match codeSpan(String text, int position) {
        if (text.charAt(position) != '`') {
            return null;
        }
        int open = runLength(text, position, '`');
        int index = position + open;
        while (index < text.length()) {
            if (text.charAt(index) == '`') {
                int close = runLength(text, index, '`');
                if (close == open) {
                    String code = text.substring(position + open, index);
                    String raw = text.substring(position, index + close);
                    return new Match(new InlineToken.InlineCode(code, raw), index + close);
                }
                index += close;
            } else {
                index++;
            }
        }
        String run = text.substring(position, position + open);
        return new Match(new InlineToken.Text(run), position + open);
    }

    private Match link(String text, int position) {
        if (text.charAt(position) != '[') {
            return null;
        }
        LinkParts parts = linkParts(text, position);
        if (parts == null) {
            return null;
        }
        String raw = text.substring(position, parts.end());
        return new Match(new InlineToken.Link(parts.label(), parts.destination(), parts.title(), raw), parts.end());
    }

    private Match image(String text, int position) {
        if (text.charAt(position) != '!' || position + 1 >= text.length() || text.charAt(position + 1) != '[') {
            return null;
        }
        LinkParts parts = linkParts(text, position + 1);
        if (parts == null) {
            return null;
        }
        String raw = text.substring(position, parts.end());
        return new Match(new InlineToken.Image(parts.label(), parts.destination(), parts.title(), raw), parts.end());
    }

    /**
     * Parses {@code [label](destination "title")} starting at the opening bracket.
     */
    private LinkParts linkParts(String text, int bracket) {
        int labelEnd = text.indexOf(']', bracket + 1);
        if (labelEnd < 0 || labelEnd + 1 >= text.length() || text.charAt(labelEnd + 1) != '(') {
            return null;
        }
        int index = labelEnd + 2;
        int destinationStart = index;
        while (index < text.length() && text.charAt(index) != ')' && !Character.isWhitespace(text.charAt(index))) {
            index++;
        }
        if (index == destinationStart || index >= text.length()) {
            return null;
        }
        String destination = text.substring(destinationStart, index);

        Optional<String> title = Optional.empty();
        int afterDestination = skipWhitespace(text, index);
        if (afterDestination > index && afterDestination < text.length()) {
            char quote = text.charAt(afterDestination);
            if (quote == '"' || quote == '\'') {
                int closingQuote = text.indexOf(quote, afterDestination + 1);
                if (closingQuote < 0) {
                    return null;
                }
                title = Optional.of(text.substring(afterDestination + 1, closingQuote));
                index = closingQuote + 1;
            }
        }
        index = skipWhitespace(text, index);
        if (index >= text.length() || text.charAt(index) != ')') {
            return null;
        }
        return new LinkParts(text.substring(bracket + 1, labelEnd), destination, title, index + 1);
    }

    private Match strong(String text, int position) {
        char marker = text.charAt(position);
        if ((marker != '*' && marker != '_') || position + 1 >= text.length() || text.charAt(position + 1) != marker) {
            return null;
        }
        String delimiter = String.valueOf(new char[] {marker, marker});
        int close = text.indexOf(delimiter, position + 3);
        if (close < 0) {
            return null;
        }
        String inner = text.substring(position + 2, close);
        return new Match(new InlineToken.Strong(inner, text.substring(position, close + 2)), close + 2);
    }

    /**
     * Single-marker emphasis. The inner span may not start or end with whitespace; doubled markers inside are skipped.
     * Only the first single marker can close the span.
     */
    private Match emphasis(String text, int position) {
        char marker = text.charAt(position);
        if ((marker != '*' && marker != '_') || position + 1 >= text.length()) {
            return null;
        }
        char first = text.charAt(position + 1);
        if (first == marker || Character.isWhitespace(first)) {
            return null;
        }
        int index = position + 2;
        while (index < text.length()) {
            if (text.charAt(index) != marker) {
                index++;
                continue;
            }
            int run = runLength(text, index, marker);
            if (run > 1) {
                index += run;
                continue;
            }
            if (Character.isWhitespace(text.charAt(index - 1))) {
                return null;
            }
            String inner = text.substring(position + 1, index);
            return new Match(new InlineToken.Em(inner, text.substring(position, index + 1)), index + 1);
        }
        return null;
    }

    private Match strikethrough(String text, int position) {
        if (!text.startsWith("~~", position)) {
            return null;
        }
        int close = text.indexOf("~~", position + 2);
        if (close <= position + 2) {
            return null;
        }
        String inner = text.substring(position + 2, close);
        if (inner.indexOf('~') >= 0) {
            return null;
        }
        return new Match(new InlineToken.Del(inner, text.substring(position, close + 2)), close + 2);
    }

    private int textRunEnd(String text, int position) {
        int index = position;
        while (index < text.length()) {
            char ch = text.charAt(index);
            if (MARKERS.indexOf(ch) >= 0) {
                break;
            }
            if (ch == '!' && index + 1 < text.length() && text.charAt(index + 1) == '[') {
                break;
            }
            index++;
        }
        return index;
    }

    private static void append(List<InlineToken> tokens, InlineToken token) {
        if (token instanceof InlineToken.Text text && !tokens.isEmpty()
                && tokens.get(tokens.size() - 1) instanceof InlineToken.Text previous) {
            tokens.set(tokens.size() - 1, new InlineToken.Text(previous.text() + text.text(), previous.raw() + text.raw()));
            return;
        }
        tokens.add(token);
    }

    private static int runLength(String text, int from, char ch) {
        int index = from;
        while (index < text.length() && text.charAt(index) == ch) {
            index++;
        }
        return index - from;
    }

    private static int skipWhitespace(String text, int from) {
        int index = from;
        while (index < text.length() && Character.isWhitespace(text.charAt(index))) {
            index++;
        }
        return index;
    }

    private record Match(InlineToken token, int end) {
    }

    private record LinkParts(String label, String destination, Optional<String> title, int end) {
    }
}
