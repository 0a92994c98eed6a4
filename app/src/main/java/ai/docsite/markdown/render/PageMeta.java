package ai.docsite.markdown.render;

/**
 * Document metadata for a standalone HTML page. Blank fields are left out of the page head.
 */
public record PageMeta(String title, String author, String description) {

    public static final String DEFAULT_TITLE = "Markdown Document";

    public PageMeta {
        title = title == null || title.isBlank() ? DEFAULT_TITLE : title;
        author = author == null ? "" : author;
        description = description == null ? "" : description;
    }

    public static PageMeta titled(String title) {
        return new PageMeta(title, null, null);
    }
}
