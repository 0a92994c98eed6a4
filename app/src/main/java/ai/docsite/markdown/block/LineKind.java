package ai.docsite.markdown.block;

/**
 * Classification of a single source line by the block construct it can open.
 *
 * <p>Constants are declared in the order the block scanner tries them. Tables are absent because
 * recognizing one needs the following line.
 */
public enum LineKind {
    BLANK,
    HEADING,
    THEMATIC_BREAK,
    FENCE,
    BLOCKQUOTE,
    LIST_ITEM,
    HTML,
    INDENTED,
    TEXT;

    /**
     * Whether a line of this kind ends a running paragraph.
     */
    public boolean interruptsParagraph() {
        return this == HEADING || this == THEMATIC_BREAK || this == BLOCKQUOTE || this == LIST_ITEM;
    }
}
