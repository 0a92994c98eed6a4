package ai.docsite.markdown.render;

import ai.docsite.markdown.ast.Node;
import ai.docsite.markdown.ast.NodeType;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a tree as an HTML fragment. Block elements end with a newline; inline elements do not.
 */
public class HtmlRenderer extends DispatchingRenderer {

    public static final String DEFAULT_LANG_PREFIX = "language-";

    private static final String SANITIZED_HTML = "<!-- HTML block sanitized -->\n";

    private final boolean sanitize;
    private final boolean breaks;
    private final String langPrefix;

    public HtmlRenderer() {
        this(false, false, DEFAULT_LANG_PREFIX);
    }

    /**
     * @param sanitize   replace raw HTML blocks with a marker comment
     * @param breaks     render newlines inside text as {@code <br />}
     * @param langPrefix class prefix for the language of fenced code
     */
    public HtmlRenderer(boolean sanitize, boolean breaks, String langPrefix) {
        this.sanitize = sanitize;
        this.breaks = breaks;
        this.langPrefix = Objects.requireNonNull(langPrefix, "langPrefix");
        registerDefaults();
    }

    private void registerDefaults() {
        register(NodeType.ROOT, Node.Root.class, root -> renderChildren(root.children()));
        register(NodeType.HEADING, Node.Heading.class, this::heading);
        register(NodeType.PARAGRAPH, Node.Paragraph.class,
                paragraph -> "<p>" + renderChildren(paragraph.children()) + "</p>\n");
        register(NodeType.CODE_BLOCK, Node.CodeBlock.class, this::codeBlock);
        register(NodeType.BULLET_LIST, Node.BulletList.class,
                list -> "<ul>\n" + renderChildren(list.items()) + "</ul>\n");
        register(NodeType.ORDERED_LIST, Node.OrderedList.class,
                list -> "<ol>\n" + renderChildren(list.items()) + "</ol>\n");
        register(NodeType.LIST_ITEM, Node.ListItem.class,
                item -> "<li>" + renderChildren(item.children()) + "</li>\n");
        register(NodeType.BLOCKQUOTE, Node.Blockquote.class,
                quote -> "<blockquote>\n" + renderChildren(quote.children()) + "</blockquote>\n");
        register(NodeType.TABLE, Node.Table.class, this::table);
        register(NodeType.THEMATIC_BREAK, Node.ThematicBreak.class, rule -> "<hr />\n");
        register(NodeType.HTML, Node.Html.class, html -> sanitize ? SANITIZED_HTML : html.html() + "\n");
        register(NodeType.TEXT, Node.Text.class, this::text);
        register(NodeType.INLINE_CODE, Node.InlineCode.class, code -> "<code>" + escape(code.code()) + "</code>");
        register(NodeType.LINK, Node.Link.class, this::link);
        register(NodeType.IMAGE, Node.Image.class, this::image);
        register(NodeType.STRONG, Node.Strong.class,
                strong -> "<strong>" + renderChildren(strong.children()) + "</strong>");
        register(NodeType.EMPHASIS, Node.Emphasis.class, em -> "<em>" + renderChildren(em.children()) + "</em>");
        register(NodeType.STRIKETHROUGH, Node.Strikethrough.class,
                del -> "<del>" + renderChildren(del.children()) + "</del>");
    }

    private String heading(Node.Heading heading) {
        String id = heading.id().isEmpty() ? "" : " id=\"" + escape(heading.id()) + "\"";
        return "<h" + heading.level() + id + ">" + renderChildren(heading.children()) + "</h" + heading.level() + ">\n";
    }

    private String codeBlock(Node.CodeBlock codeBlock) {
        String language = codeBlock.language().isEmpty()
                ? ""
                : " class=\"" + escape(langPrefix + codeBlock.language()) + "\"";
        return "<pre><code" + language + ">" + escape(codeBlock.code()) + "</code></pre>\n";
    }

    private String table(Node.Table table) {
        StringBuilder html = new StringBuilder("<table>\n");
        html.append("<thead>\n");
        appendRow(html, table.head(), "th");
        html.append("</thead>\n");
        html.append("<tbody>\n");
        for (Node.TableRow row : table.rows()) {
            appendRow(html, row, "td");
        }
        html.append("</tbody>\n");
        return html.append("</table>\n").toString();
    }

    private void appendRow(StringBuilder html, Node.TableRow row, String tag) {
        html.append("<tr>\n");
        for (Node.TableCell cell : row.cells()) {
            String align = cell.align().wireValue();
            html.append('<').append(tag);
            if (align != null) {
                html.append(" style=\"text-align: ").append(align).append('"');
            }
            html.append('>').append(renderChildren(cell.content())).append("</").append(tag).append(">\n");
        }
        html.append("</tr>\n");
    }

    private String text(Node.Text text) {
        String escaped = escape(text.text());
        return breaks ? escaped.replace("\n", "<br />\n") : escaped;
    }

    private String link(Node.Link link) {
        StringBuilder html = new StringBuilder("<a href=\"").append(escape(link.href())).append('"');
        link.title().ifPresent(title -> html.append(" title=\"").append(escape(title)).append('"'));
        appendAttributes(html, link.attributes());
        return html.append('>').append(renderChildren(link.children())).append("</a>").toString();
    }

    private String image(Node.Image image) {
        StringBuilder html = new StringBuilder("<img src=\"").append(escape(image.src())).append('"')
                .append(" alt=\"").append(escape(image.alt())).append('"');
        image.title().ifPresent(title -> html.append(" title=\"").append(escape(title)).append('"'));
        appendAttributes(html, image.attributes());
        return html.append(" />").toString();
    }

    private static void appendAttributes(StringBuilder html, Map<String, String> attributes) {
        attributes.forEach((name, value) -> html.append(' ').append(escape(name))
                .append("=\"").append(escape(value)).append('"'));
    }

    /**
     * Wraps rendered content in a standalone HTML5 document with a small embedded stylesheet.
     */
    public String generateFullPage(String content, PageMeta meta) {
        PageMeta page = meta == null ? PageMeta.titled(null) : meta;
        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n")
                .append("<html lang=\"en\">\n")
                .append("<head>\n")
                .append("  <meta charset=\"UTF-8\">\n")
                .append("  <meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n")
                .append("  <title>").append(escape(page.title())).append("</title>\n");
        if (!page.author().isBlank()) {
            html.append("  <meta name=\"author\" content=\"").append(escape(page.author())).append("\">\n");
        }
        if (!page.description().isBlank()) {
            html.append("  <meta name=\"description\" content=\"").append(escape(page.description())).append("\">\n");
        }
        html.append("  <style>\n").append(STYLESHEET).append("  </style>\n")
                .append("</head>\n")
                .append("<body>\n")
                .append("  <article>\n")
                .append(content == null ? "" : content).append('\n')
                .append("  </article>\n")
                .append("</body>\n")
                .append("</html>\n");
        return html.toString();
    }

    public static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            switch (ch) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#39;");
                default -> escaped.append(ch);
            }
        }
        return escaped.toString();
    }

    private static final String STYLESHEET = String.join("\n", List.of(
            "    body { font-family: -apple-system, \"Segoe UI\", Roboto, Arial, sans-serif; line-height: 1.6;"
                    + " color: #333; max-width: 900px; margin: 0 auto; padding: 20px; }",
            "    h1, h2, h3, h4, h5, h6 { margin-top: 24px; margin-bottom: 16px; font-weight: 600; line-height: 1.25; }",
            "    blockquote { margin: 0 0 16px; padding: 0 1em; color: #6a737d; border-left: 0.25em solid #dfe2e5; }",
            "    code { background-color: rgba(27, 31, 35, 0.05); border-radius: 3px; padding: 0.2em 0.4em; }",
            "    pre { background-color: #f6f8fa; border-radius: 6px; padding: 16px; overflow: auto; }",
            "    pre code { background-color: transparent; padding: 0; }",
            "    table { border-collapse: collapse; width: 100%; margin-bottom: 16px; }",
            "    table th, table td { border: 1px solid #dfe2e5; padding: 6px 13px; }",
            "    img { max-width: 100%; height: auto; }",
            "    del { color: #6a737d; }",
            ""));
}
