package ai.docsite.markdown.ast;

import ai.docsite.markdown.block.BlockScanner;
import ai.docsite.markdown.block.BlockToken;
import ai.docsite.markdown.block.DefaultBlockScanner;
import ai.docsite.markdown.block.TableAlignment;
import ai.docsite.markdown.inline.DefaultInlineScanner;
import ai.docsite.markdown.inline.InlineScanner;
import ai.docsite.markdown.inline.InlineToken;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Fuses block and inline scanner output into a single rooted tree.
 *
 * <p>The builder keeps no state between calls. Blockquote content goes back through the block scanner
 * and container inline spans go back through the inline scanner, always on a strictly shorter
 * substring. Inline nesting deeper than {@value #MAX_INLINE_DEPTH} levels is kept as plain text, and a
 * blockquote nested {@value #MAX_BLOCKQUOTE_DEPTH} levels deep holds its remaining content as one plain paragraph.
 */
public class AstBuilder {

    static final int MAX_INLINE_DEPTH = 32;
    static final int MAX_BLOCKQUOTE_DEPTH = 32;

    private final BlockScanner blockScanner;
    private final InlineScanner inlineScanner;

    public AstBuilder() {
        this(new DefaultBlockScanner(), new DefaultInlineScanner());
    }

    public AstBuilder(BlockScanner blockScanner, InlineScanner inlineScanner) {
        this.blockScanner = Objects.requireNonNull(blockScanner, "blockScanner");
        this.inlineScanner = Objects.requireNonNull(inlineScanner, "inlineScanner");
    }

    public Node.Root build(List<BlockToken> tokens) {
        validateTokens(tokens);
        List<Node> children = buildBlocks(tokens, 0);
        int nodeCount = 0;
        for (Node child : children) {
            nodeCount += AstTraversal.countNodes(child);
        }
        return new Node.Root(children, nodeCount);
    }

    /**
     * Checks a token list for the structural fields the builder relies on.
     *
     * @throws MalformedTokenStreamException naming the first offending token
     */
    public void validateTokens(List<BlockToken> tokens) {
        if (tokens == null) {
            throw new MalformedTokenStreamException(-1, "token list is null");
        }
        for (int i = 0; i < tokens.size(); i++) {
            BlockToken token = tokens.get(i);
            if (token == null) {
                throw new MalformedTokenStreamException(i, "token is null");
            }
            validateToken(i, token);
        }
    }

    private void validateToken(int index, BlockToken token) {
        if (token instanceof BlockToken.Heading heading) {
            if (heading.level() < 1 || heading.level() > 6) {
                throw new MalformedTokenStreamException(index, "heading level " + heading.level() + " outside 1..6");
            }
            requireField(index, heading.text(), "heading text");
        } else if (token instanceof BlockToken.Paragraph paragraph) {
            requireField(index, paragraph.text(), "paragraph text");
        } else if (token instanceof BlockToken.CodeBlock codeBlock) {
            requireField(index, codeBlock.code(), "code");
        } else if (token instanceof BlockToken.ListBlock list) {
            if (list.items() == null) {
                throw new MalformedTokenStreamException(index, "list has no items");
            }
            for (BlockToken.ListItem item : list.items()) {
                if (item == null) {
                    throw new MalformedTokenStreamException(index, "list contains a null item");
                }
                requireField(index, item.content(), "list item content");
            }
        } else if (token instanceof BlockToken.Blockquote blockquote) {
            requireField(index, blockquote.content(), "blockquote content");
        } else if (token instanceof BlockToken.Table table) {
            if (table.headers() == null || table.headers().contains(null)) {
                throw new MalformedTokenStreamException(index, "table headers missing");
            }
            if (table.rows() == null) {
                throw new MalformedTokenStreamException(index, "table rows missing");
            }
            for (List<String> row : table.rows()) {
                if (row == null || row.contains(null)) {
                    throw new MalformedTokenStreamException(index, "table row missing or holds a null cell");
                }
            }
        } else if (token instanceof BlockToken.Html html) {
            requireField(index, html.html(), "html");
        }
    }

    private static void requireField(int index, String value, String field) {
        if (value == null) {
            throw new MalformedTokenStreamException(index, field + " is null");
        }
    }

    private List<Node> buildBlocks(List<BlockToken> tokens, int quoteDepth) {
        List<Node> nodes = new ArrayList<>();
        for (BlockToken token : tokens) {
            if (!(token instanceof BlockToken.Blank)) {
                nodes.add(buildBlock(token, quoteDepth));
            }
        }
        return nodes;
    }

    private Node buildBlock(BlockToken token, int quoteDepth) {
        if (token instanceof BlockToken.Heading heading) {
            List<Node> children = buildInline(heading.text(), 0);
            String id = HeadingSlugger.slug(AstTraversal.flattenText(children));
            return new Node.Heading(heading.level(), id, children, heading.line());
        }
        if (token instanceof BlockToken.Paragraph paragraph) {
            return new Node.Paragraph(buildInline(paragraph.text(), 0), paragraph.line());
        }
        if (token instanceof BlockToken.CodeBlock codeBlock) {
            String code = codeBlock.code();
            int lineCount = code.split("\n", -1).length;
            return new Node.CodeBlock(codeBlock.language(), code, lineCount, codeBlock.line());
        }
        if (token instanceof BlockToken.ListBlock list) {
            return buildList(list);
        }
        if (token instanceof BlockToken.Blockquote blockquote) {
            return buildBlockquote(blockquote, quoteDepth);
        }
        if (token instanceof BlockToken.Table table) {
            return buildTable(table);
        }
        if (token instanceof BlockToken.ThematicBreak rule) {
            return new Node.ThematicBreak(rule.line());
        }
        if (token instanceof BlockToken.Html html) {
            return new Node.Html(html.html(), html.line());
        }
        throw new MalformedTokenStreamException(-1, "Unsupported block token: " + token.getClass().getSimpleName());
    }

    private Node buildBlockquote(BlockToken.Blockquote blockquote, int quoteDepth) {
        String content = blockquote.content();
        if (quoteDepth >= MAX_BLOCKQUOTE_DEPTH) {
            List<Node> flat = content.isBlank()
                    ? List.of()
                    : List.of(new Node.Paragraph(List.of(new Node.Text(content)), blockquote.line()));
            return new Node.Blockquote(flat, blockquote.line());
        }
        List<String> lines = Arrays.asList(content.split("\n", -1));
        List<BlockToken> nested = blockScanner.scan(lines, blockquote.line());
        return new Node.Blockquote(buildBlocks(nested, quoteDepth + 1), blockquote.line());
    }

    private Node buildList(BlockToken.ListBlock list) {
        List<Node.ListItem> items = new ArrayList<>(list.items().size());
        for (BlockToken.ListItem item : list.items()) {
            items.add(new Node.ListItem(item.marker(), buildInline(item.content(), 0), item.line()));
        }
        return list.ordered()
                ? new Node.OrderedList(items, list.line())
                : new Node.BulletList(items, list.line());
    }

    private Node buildTable(BlockToken.Table table) {
        List<BlockToken.TableHeader> headers = table.headers();
        List<Node.TableCell> headCells = new ArrayList<>(headers.size());
        for (BlockToken.TableHeader header : headers) {
            headCells.add(new Node.TableCell(buildInline(header.text(), 0), header.align(), true));
        }
        List<Node.TableRow> rows = new ArrayList<>(table.rows().size());
        for (List<String> row : table.rows()) {
            List<Node.TableCell> cells = new ArrayList<>(row.size());
            for (int column = 0; column < row.size(); column++) {
                TableAlignment align = column < headers.size() ? headers.get(column).align() : TableAlignment.NONE;
                cells.add(new Node.TableCell(buildInline(row.get(column), 0), align, false));
            }
            rows.add(new Node.TableRow(cells));
        }
        return new Node.Table(new Node.TableRow(headCells), rows, table.line());
    }

    private List<Node> buildInline(String text, int depth) {
        if (text.isEmpty()) {
            return List.of();
        }
        if (depth >= MAX_INLINE_DEPTH) {
            return List.of(new Node.Text(text));
        }
        List<InlineToken> tokens = inlineScanner.scan(text);
        List<Node> nodes = new ArrayList<>(tokens.size());
        for (InlineToken token : tokens) {
            nodes.add(buildInlineNode(token, depth));
        }
        return nodes;
    }

    private Node buildInlineNode(InlineToken token, int depth) {
        if (token instanceof InlineToken.Text text) {
            return new Node.Text(text.text());
        }
        if (token instanceof InlineToken.InlineCode code) {
            return new Node.InlineCode(code.code());
        }
        if (token instanceof InlineToken.Link link) {
            return new Node.Link(link.href(), link.title(), buildInline(link.text(), depth + 1));
        }
        if (token instanceof InlineToken.Image image) {
            return new Node.Image(image.alt(), image.src(), image.title());
        }
        if (token instanceof InlineToken.Strong strong) {
            return new Node.Strong(buildInline(strong.text(), depth + 1));
        }
        if (token instanceof InlineToken.Em em) {
            return new Node.Emphasis(buildInline(em.text(), depth + 1));
        }
        if (token instanceof InlineToken.Del del) {
            return new Node.Strikethrough(buildInline(del.text(), depth + 1));
        }
        return new Node.Text(token.raw());
    }
}
