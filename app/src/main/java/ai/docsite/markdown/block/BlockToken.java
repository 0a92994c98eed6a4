package ai.docsite.markdown.block;

import java.util.List;

/**
 * Structural unit spanning one or more whole source lines.
 *
 * <p>Every token keeps the exact source lines it consumed in {@link #raw()}, joined with {@code \n},
 * and the zero-based index of its first line in {@link #line()}. Fields are not null-checked on
 * construction; the tree builder validates hand-built token lists before use.
 */
public sealed interface BlockToken {

    String raw();

    int line();

    record Heading(int level, String text, String raw, int line) implements BlockToken {
    }

    record Paragraph(String text, String raw, int line) implements BlockToken {
    }

    record CodeBlock(String language, String code, String raw, int line) implements BlockToken {
    }

    record ListBlock(boolean ordered, List<ListItem> items, String raw, int line) implements BlockToken {
    }

    /**
     * Quoted region. {@code content} is the raw text with quote markers removed, scanned again by the builder.
     */
    record Blockquote(String content, String raw, int line) implements BlockToken {
    }

    record Table(List<TableHeader> headers, List<List<String>> rows, String raw, int line) implements BlockToken {
    }

    record ThematicBreak(String raw, int line) implements BlockToken {
    }

    record Html(String html, String raw, int line) implements BlockToken {
    }

    record Blank(String raw, int line) implements BlockToken {
    }

    /**
     * One list entry; {@code content} includes continuation lines joined with {@code \n}.
     */
    record ListItem(String marker, String content, String raw, int line) {
    }

    record TableHeader(String text, TableAlignment align) {
    }
}
