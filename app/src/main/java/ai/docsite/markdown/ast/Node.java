package ai.docsite.markdown.ast;

import ai.docsite.markdown.block.TableAlignment;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Node of the syntax tree. Children are kept in document order.
 *
 * <p>Block nodes carry the zero-based source line they start on. {@link Link} and {@link Image} carry an
 * ordered attribute map that only plugins fill.
 */
public sealed interface Node {

    NodeType type();

    /**
     * Nested nodes in document order: {@code children} for containers, {@code items} for lists and
     * the content of every cell for tables.
     */
    default List<Node> children() {
        return List.of();
    }

    record Root(List<Node> children, int nodeCount) implements Node {

        public Root {
            children = List.copyOf(Objects.requireNonNull(children, "children"));
        }

        @Override
        public NodeType type() {
            return NodeType.ROOT;
        }
    }

    record Heading(int level, String id, List<Node> children, int line) implements Node {

        public Heading {
            Objects.requireNonNull(id, "id");
            children = List.copyOf(Objects.requireNonNull(children, "children"));
        }

        @Override
        public NodeType type() {
            return NodeType.HEADING;
        }
    }

    record Paragraph(List<Node> children, int line) implements Node {

        public Paragraph {
            children = List.copyOf(Objects.requireNonNull(children, "children"));
        }

        @Override
        public NodeType type() {
            return NodeType.PARAGRAPH;
        }
    }

    record CodeBlock(String language, String code, int lineCount, int line) implements Node {

        public CodeBlock {
            language = language == null ? "" : language;
            Objects.requireNonNull(code, "code");
        }

        @Override
        public NodeType type() {
            return NodeType.CODE_BLOCK;
        }
    }

    record BulletList(List<ListItem> items, int line) implements Node {

        public BulletList {
            items = List.copyOf(Objects.requireNonNull(items, "items"));
        }

        @Override
        public NodeType type() {
            return NodeType.BULLET_LIST;
        }

        @Override
        public List<Node> children() {
            return List.copyOf(items);
        }
    }

    record OrderedList(List<ListItem> items, int line) implements Node {

        public OrderedList {
            items = List.copyOf(Objects.requireNonNull(items, "items"));
        }

        @Override
        public NodeType type() {
            return NodeType.ORDERED_LIST;
        }

        @Override
        public List<Node> children() {
            return List.copyOf(items);
        }
    }

    record ListItem(String marker, List<Node> children, int line) implements Node {

        public ListItem {
            children = List.copyOf(Objects.requireNonNull(children, "children"));
        }

        @Override
        public NodeType type() {
            return NodeType.LIST_ITEM;
        }
    }

    record Blockquote(List<Node> children, int line) implements Node {

        public Blockquote {
            children = List.copyOf(Objects.requireNonNull(children, "children"));
        }

        @Override
        public NodeType type() {
            return NodeType.BLOCKQUOTE;
        }
    }

    record Table(TableRow head, List<TableRow> rows, int line) implements Node {

        public Table {
            Objects.requireNonNull(head, "head");
            rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
        }

        @Override
        public NodeType type() {
            return NodeType.TABLE;
        }

        @Override
        public List<Node> children() {
            List<Node> nodes = new ArrayList<>();
            for (TableCell cell : head.cells()) {
                nodes.addAll(cell.content());
            }
            for (TableRow row : rows) {
                for (TableCell cell : row.cells()) {
                    nodes.addAll(cell.content());
                }
            }
            return Collections.unmodifiableList(nodes);
        }

        public int columnCount() {
            return head.cells().size();
        }
    }

    record ThematicBreak(int line) implements Node {

        @Override
        public NodeType type() {
            return NodeType.THEMATIC_BREAK;
        }
    }

    record Html(String html, int line) implements Node {

        public Html {
            Objects.requireNonNull(html, "html");
        }

        @Override
        public NodeType type() {
            return NodeType.HTML;
        }
    }

    record Text(String text) implements Node {

        public Text {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public NodeType type() {
            return NodeType.TEXT;
        }
    }

    record InlineCode(String code) implements Node {

        public InlineCode {
            Objects.requireNonNull(code, "code");
        }

        @Override
        public NodeType type() {
            return NodeType.INLINE_CODE;
        }
    }

    record Link(String href, Optional<String> title, List<Node> children, Map<String, String> attributes) implements Node {

        public Link {
            Objects.requireNonNull(href, "href");
            title = title == null ? Optional.empty() : title;
            children = List.copyOf(Objects.requireNonNull(children, "children"));
            attributes = copyAttributes(attributes);
        }

        public Link(String href, Optional<String> title, List<Node> children) {
            this(href, title, children, Map.of());
        }

        @Override
        public NodeType type() {
            return NodeType.LINK;
        }

        public Link withAttribute(String name, String value) {
            Map<String, String> updated = new LinkedHashMap<>(attributes);
            updated.put(name, value);
            return new Link(href, title, children, updated);
        }
    }

    record Image(String alt, String src, Optional<String> title, Map<String, String> attributes) implements Node {

        public Image {
            alt = alt == null ? "" : alt;
            Objects.requireNonNull(src, "src");
            title = title == null ? Optional.empty() : title;
            attributes = copyAttributes(attributes);
        }

        public Image(String alt, String src, Optional<String> title) {
            this(alt, src, title, Map.of());
        }

        @Override
        public NodeType type() {
            return NodeType.IMAGE;
        }

        public Image withAttribute(String name, String value) {
            Map<String, String> updated = new LinkedHashMap<>(attributes);
            updated.put(name, value);
            return new Image(alt, src, title, updated);
        }
    }

    record Strong(List<Node> children) implements Node {

        public Strong {
            children = List.copyOf(Objects.requireNonNull(children, "children"));
        }

        @Override
        public NodeType type() {
            return NodeType.STRONG;
        }
    }

    record Emphasis(List<Node> children) implements Node {

        public Emphasis {
            children = List.copyOf(Objects.requireNonNull(children, "children"));
        }

        @Override
        public NodeType type() {
            return NodeType.EMPHASIS;
        }
    }

    record Strikethrough(List<Node> children) implements Node {

        public Strikethrough {
            children = List.copyOf(Objects.requireNonNull(children, "children"));
        }

        @Override
        public NodeType type() {
            return NodeType.STRIKETHROUGH;
        }
    }

    /**
     * A table row; not a node itself, its cells hold inline content.
     */
    record TableRow(List<TableCell> cells) {

        public TableRow {
            cells = List.copyOf(Objects.requireNonNull(cells, "cells"));
        }
    }

    record TableCell(List<Node> content, TableAlignment align, boolean header) {

        public TableCell {
            content = List.copyOf(Objects.requireNonNull(content, "content"));
            align = align == null ? TableAlignment.NONE : align;
        }
    }

    private static Map<String, String> copyAttributes(Map<String, String> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
