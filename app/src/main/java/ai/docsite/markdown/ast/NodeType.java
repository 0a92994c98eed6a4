package ai.docsite.markdown.ast;

/**
 * Type tag of every tree node, with the name used on the wire.
 */
public enum NodeType {
    ROOT("root"),
    HEADING("heading"),
    PARAGRAPH("paragraph"),
    CODE_BLOCK("codeBlock"),
    BULLET_LIST("list"),
    ORDERED_LIST("orderedList"),
    LIST_ITEM("listItem"),
    BLOCKQUOTE("blockquote"),
    TABLE("table"),
    THEMATIC_BREAK("hr"),
    HTML("html"),
    TEXT("text"),
    INLINE_CODE("inlineCode"),
    LINK("link"),
    IMAGE("image"),
    STRONG("strong"),
    EMPHASIS("em"),
    STRIKETHROUGH("del");

    private final String wireName;

    NodeType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static NodeType fromWireName(String raw) {
        for (NodeType type : values()) {
            if (type.wireName.equals(raw)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported node type: " + raw);
    }
}
