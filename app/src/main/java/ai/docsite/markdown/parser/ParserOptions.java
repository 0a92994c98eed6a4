package ai.docsite.markdown.parser;

import java.util.Objects;

/**
 * Options shared by the scanners and the HTML renderer.
 *
 * @param strikethrough recognise {@code ~~text~~}
 * @param sanitize      replace raw HTML blocks with a marker comment when rendering
 * @param breaks        render newlines inside paragraphs as line breaks
 * @param langPrefix    CSS class prefix for the language of fenced code
 */
public record ParserOptions(boolean strikethrough, boolean sanitize, boolean breaks, String langPrefix) {

    public static final String DEFAULT_LANG_PREFIX = "language-";

    public ParserOptions {
        Objects.requireNonNull(langPrefix, "langPrefix");
        if (langPrefix.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("langPrefix must not contain whitespace");
        }
    }

    public static ParserOptions defaults() {
        return new ParserOptions(true, false, false, DEFAULT_LANG_PREFIX);
    }

    public ParserOptions withStrikethrough(boolean value) {
        return new ParserOptions(value, sanitize, breaks, langPrefix);
    }

    public ParserOptions withSanitize(boolean value) {
        return new ParserOptions(strikethrough, value, breaks, langPrefix);
    }

    public ParserOptions withBreaks(boolean value) {
        return new ParserOptions(strikethrough, sanitize, value, langPrefix);
    }

    public ParserOptions withLangPrefix(String value) {
        return new ParserOptions(strikethrough, sanitize, breaks, value);
    }
}
