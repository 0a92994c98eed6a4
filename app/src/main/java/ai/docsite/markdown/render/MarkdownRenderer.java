package ai.docsite.markdown.render;

import ai.docsite.markdown.ast.Node;
import ai.docsite.markdown.ast.NodeType;
import ai.docsite.markdown.block.TableAlignment;
import java.util.ArrayList;
import java.util.List;

/**
 * Re-emits a tree as normalized markup: ATX headings, backtick fences, {@code -} bullets and
 * renumbered ordinals. Top-level blocks are separated by one blank line. Source formatting is not
 * preserved.
 */
public class MarkdownRenderer extends DispatchingRenderer {

    public MarkdownRenderer() {
        register(NodeType.ROOT, Node.Root.class, this::root);
        register(NodeType.HEADING, Node.Heading.class,
                heading -> "#".repeat(heading.level()) + " " + renderChildren(heading.children()) + "\n");
        register(NodeType.PARAGRAPH, Node.Paragraph.class, paragraph -> renderChildren(paragraph.children()) + "\n");
        register(NodeType.CODE_BLOCK, Node.CodeBlock.class,
                code -> "```" + code.language() + "\n" + code.code() + "\n```\n");
        register(NodeType.BULLET_LIST, Node.BulletList.class, list -> list(list.items(), false));
        register(NodeType.ORDERED_LIST, Node.OrderedList.class, list -> list(list.items(), true));
        register(NodeType.LIST_ITEM, Node.ListItem.class, item -> "- " + renderChildren(item.children()).trim());
        register(NodeType.BLOCKQUOTE, Node.Blockquote.class, this::blockquote);
        register(NodeType.TABLE, Node.Table.class, this::table);
        register(NodeType.THEMATIC_BREAK, Node.ThematicBreak.class, rule -> "---\n");
        register(NodeType.HTML, Node.Html.class, html -> html.html() + "\n");
        register(NodeType.TEXT, Node.Text.class, Node.Text::text);
        register(NodeType.INLINE_CODE, Node.InlineCode.class, code -> "`" + code.code() + "`");
        register(NodeType.LINK, Node.Link.class, link -> "[" + renderChildren(link.children()) + "]("
                + link.href() + link.title().map(title -> " \"" + title + "\"").orElse("") + ")");
        register(NodeType.IMAGE, Node.Image.class, image -> "![" + image.alt() + "]("
                + image.src() + image.title().map(title -> " \"" + title + "\"").orElse("") + ")");
        register(NodeType.STRONG, Node.Strong.class, strong -> "**" + renderChildren(strong.children()) + "**");
        register(NodeType.EMPHASIS, Node.Emphasis.class, em -> "*" + renderChildren(em.children()) + "*");
        register(NodeType.STRIKETHROUGH, Node.Strikethrough.class,
                del -> "~~" + renderChildren(del.children()) + "~~");
    }

    /**
     * Drops blank lines and trims every remaining line.
     */
    public static String minify(String markdown) {
        if (markdown == null || markdown.isEmpty()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        for (String line : markdown.split("\n", -1)) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        return String.join("\n", lines);
    }

    private String root(Node.Root root) {
        String body = joinBlocks(root.children()).trim();
        return body.isEmpty() ? "" : body + "\n";
    }

    private String joinBlocks(List<Node> blocks) {
        List<String> rendered = new ArrayList<>(blocks.size());
        for (Node block : blocks) {
            rendered.add(render(block));
        }
        return String.join("\n", rendered);
    }

    private String list(List<Node.ListItem> items, boolean ordered) {
        List<String> lines = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            String content = renderChildren(items.get(i).children()).trim();
            String marker = ordered ? (i + 1) + "." : "-";
            lines.add(marker + " " + content);
        }
        return String.join("\n", lines) + "\n";
    }

    private String blockquote(Node.Blockquote quote) {
        String content = joinBlocks(quote.children());
        if (content.endsWith("\n")) {
            content = content.substring(0, content.length() - 1);
        }
        List<String> lines = new ArrayList<>();
        for (String line : content.split("\n", -1)) {
            lines.add(line.isBlank() ? ">" : "> " + line);
        }
        return String.join("\n", lines) + "\n";
    }

    private String table(Node.Table table) {
        StringBuilder markdown = new StringBuilder();
        List<String> separators = new ArrayList<>();
        for (Node.TableCell cell : table.head().cells()) {
            separators.add(separator(cell.align()));
        }
        appendRow(markdown, table.head());
        markdown.append("| ").append(String.join(" | ", separators)).append(" |\n");
        for (Node.TableRow row : table.rows()) {
            appendRow(markdown, row);
        }
        return markdown.toString();
    }

    private void appendRow(StringBuilder markdown, Node.TableRow row) {
        List<String> cells = new ArrayList<>(row.cells().size());
        for (Node.TableCell cell : row.cells()) {
            cells.add(renderChildren(cell.content()).trim());
        }
        markdown.append("| ").append(String.join(" | ", cells)).append(" |\n");
    }

    private static String separator(TableAlignment align) {
        return switch (align) {
            case CENTER -> ":---:";
            case RIGHT -> "---:";
            case LEFT -> ":---";
            case NONE -> "---";
        };
    }
}
