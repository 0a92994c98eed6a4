package ai.docsite.markdown.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Pre-order walks over a tree. Every walk visits container children, list items and table cell
 * contents in document order.
 */
public final class AstTraversal {

    private AstTraversal() {
    }

    public static void walk(Node node, Consumer<Node> visitor) {
        Objects.requireNonNull(visitor, "visitor");
        if (node == null) {
            return;
        }
        visitor.accept(node);
        for (Node child : node.children()) {
            walk(child, visitor);
        }
    }

    public static List<Node> filterByType(Node node, NodeType type) {
        List<Node> matches = new ArrayList<>();
        walk(node, candidate -> {
            if (candidate.type() == type) {
                matches.add(candidate);
            }
        });
        return matches;
    }

    public static List<LinkInfo> extractLinks(Node node) {
        List<LinkInfo> links = new ArrayList<>();
        walk(node, candidate -> {
            if (candidate instanceof Node.Link link) {
                links.add(new LinkInfo(flattenText(link.children()), link.href(), link.title()));
            }
        });
        return links;
    }

    public static List<ImageInfo> extractImages(Node node) {
        List<ImageInfo> images = new ArrayList<>();
        walk(node, candidate -> {
            if (candidate instanceof Node.Image image) {
                images.add(new ImageInfo(image.alt(), image.src(), image.title()));
            }
        });
        return images;
    }

    public static List<HeadingInfo> extractHeadings(Node node) {
        List<HeadingInfo> headings = new ArrayList<>();
        walk(node, candidate -> {
            if (candidate instanceof Node.Heading heading) {
                headings.add(new HeadingInfo(heading.level(), flattenText(heading), heading.id()));
            }
        });
        return headings;
    }

    /**
     * Concatenates the text of every {@link Node.Text} and {@link Node.InlineCode} below the node.
     */
    public static String flattenText(Node node) {
        StringBuilder builder = new StringBuilder();
        appendText(node, builder);
        return builder.toString();
    }

    public static String flattenText(List<Node> nodes) {
        StringBuilder builder = new StringBuilder();
        for (Node node : nodes) {
            appendText(node, builder);
        }
        return builder.toString();
    }

    private static void appendText(Node node, StringBuilder builder) {
        if (node instanceof Node.Text text) {
            builder.append(text.text());
        } else if (node instanceof Node.InlineCode code) {
            builder.append(code.code());
        } else if (node != null) {
            for (Node child : node.children()) {
                appendText(child, builder);
            }
        }
    }

    /**
     * Number of nodes in the subtree, the node itself included.
     */
    public static int countNodes(Node node) {
        if (node == null) {
            return 0;
        }
        int count = 1;
        for (Node child : node.children()) {
            count += countNodes(child);
        }
        return count;
    }

    /**
     * Applies {@code transformer} to every node in pre-order and rebuilds the parents around the results.
     * The transformer sees a node before its children; children of the returned node are then
     * transformed in turn. A root result gets its node count recomputed.
     */
    public static Node transform(Node node, UnaryOperator<Node> transformer) {
        Objects.requireNonNull(transformer, "transformer");
        Node transformed = Objects.requireNonNull(transformer.apply(node), "transformer returned null");
        Node rebuilt = rebuild(transformed, transformer);
        if (rebuilt instanceof Node.Root root) {
            int count = 0;
            for (Node child : root.children()) {
                count += countNodes(child);
            }
            return new Node.Root(root.children(), count);
        }
        return rebuilt;
    }

    public static Node.Root transformRoot(Node.Root root, UnaryOperator<Node> transformer) {
        Node result = transform(root, transformer);
        if (result instanceof Node.Root transformedRoot) {
            return transformedRoot;
        }
        throw new IllegalStateException("Transformer replaced the root with " + result.type().wireName());
    }

    private static Node rebuild(Node node, UnaryOperator<Node> transformer) {
        if (node instanceof Node.Root root) {
            return new Node.Root(transformAll(root.children(), transformer), root.nodeCount());
        }
        if (node instanceof Node.Heading heading) {
            return new Node.Heading(heading.level(), heading.id(), transformAll(heading.children(), transformer),
                    heading.line());
        }
        if (node instanceof Node.Paragraph paragraph) {
            return new Node.Paragraph(transformAll(paragraph.children(), transformer), paragraph.line());
        }
        if (node instanceof Node.BulletList list) {
            return new Node.BulletList(transformItems(list.items(), transformer), list.line());
        }
        if (node instanceof Node.OrderedList list) {
            return new Node.OrderedList(transformItems(list.items(), transformer), list.line());
        }
        if (node instanceof Node.ListItem item) {
            return new Node.ListItem(item.marker(), transformAll(item.children(), transformer), item.line());
        }
        if (node instanceof Node.Blockquote blockquote) {
            return new Node.Blockquote(transformAll(blockquote.children(), transformer), blockquote.line());
        }
        if (node instanceof Node.Table table) {
            List<Node.TableRow> rows = new ArrayList<>(table.rows().size());
            for (Node.TableRow row : table.rows()) {
                rows.add(transformRow(row, transformer));
            }
            return new Node.Table(transformRow(table.head(), transformer), rows, table.line());
        }
        if (node instanceof Node.Link link) {
            return new Node.Link(link.href(), link.title(), transformAll(link.children(), transformer),
                    link.attributes());
        }
        if (node instanceof Node.Strong strong) {
            return new Node.Strong(transformAll(strong.children(), transformer));
        }
        if (node instanceof Node.Emphasis emphasis) {
            return new Node.Emphasis(transformAll(emphasis.children(), transformer));
        }
        if (node instanceof Node.Strikethrough strikethrough) {
            return new Node.Strikethrough(transformAll(strikethrough.children(), transformer));
        }
        return node;
    }

    private static List<Node> transformAll(List<Node> nodes, UnaryOperator<Node> transformer) {
        List<Node> result = new ArrayList<>(nodes.size());
        for (Node child : nodes) {
            result.add(transform(child, transformer));
        }
        return result;
    }

    private static List<Node.ListItem> transformItems(List<Node.ListItem> items, UnaryOperator<Node> transformer) {
        List<Node.ListItem> result = new ArrayList<>(items.size());
        for (Node.ListItem item : items) {
            Node transformed = transform(item, transformer);
            if (!(transformed instanceof Node.ListItem listItem)) {
                throw new IllegalStateException("List items can only be replaced by list items, got "
                        + transformed.type().wireName());
            }
            result.add(listItem);
        }
        return result;
    }

    private static Node.TableRow transformRow(Node.TableRow row, UnaryOperator<Node> transformer) {
        List<Node.TableCell> cells = new ArrayList<>(row.cells().size());
        for (Node.TableCell cell : row.cells()) {
            cells.add(new Node.TableCell(transformAll(cell.content(), transformer), cell.align(), cell.header()));
        }
        return new Node.TableRow(cells);
    }
}
