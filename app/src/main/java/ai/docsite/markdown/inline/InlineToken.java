package ai.docsite.markdown.inline;

import java.util.Optional;

/**
 * Structural unit inside a single span of text.
 *
 * <p>Container tokens ({@link Link}, {@link Strong}, {@link Em}, {@link Del}) hold their inner span
 * unparsed; the tree builder scans it again to build children.
 */
public sealed interface InlineToken {

    /**
     * Source text this token was produced from.
     */
    String raw();

    record Text(String text, String raw) implements InlineToken {

        public Text(String text) {
            this(text, text);
        }
    }

    record InlineCode(String code, String raw) implements InlineToken {
    }

    record Link(String text, String href, Optional<String> title, String raw) implements InlineToken {

        public Link {
            title = title == null ? Optional.empty() : title;
        }
    }

    record Image(String alt, String src, Optional<String> title, String raw) implements InlineToken {

        public Image {
            title = title == null ? Optional.empty() : title;
        }
    }

    record Strong(String text, String raw) implements InlineToken {
    }

    record Em(String text, String raw) implements InlineToken {
    }

    record Del(String text, String raw) implements InlineToken {
    }
}
