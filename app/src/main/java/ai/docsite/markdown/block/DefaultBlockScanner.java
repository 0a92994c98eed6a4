package ai.docsite.markdown.block;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cursor-driven block scanner trying each construct in a fixed priority order.
 *
 * <p>Stateless: all progress lives in locals, so one instance may be shared between threads.
 */
public class DefaultBlockScanner implements BlockScanner {

    @Override
    public List<BlockToken> scan(List<String> lines, int firstLine) {
        if (lines == null || lines.isEmpty()) {
            return Collections.emptyList();
        }

        List<BlockToken> tokens = new ArrayList<>();
        int index = 0;
        while (index < lines.size()) {
            Step step = next(lines, index, firstLine);
            tokens.add(step.token());
            index = step.nextIndex();
        }
        return tokens;
    }

    private Step next(List<String> lines, int index, int offset) {
        String line = lines.get(index);
        return switch (LineClassifier.classify(line)) {
            case BLANK -> new Step(new BlockToken.Blank(line, offset + index), index + 1);
            case HEADING -> heading(line, index, offset);
            case THEMATIC_BREAK -> new Step(new BlockToken.ThematicBreak(line, offset + index), index + 1);
            case FENCE -> fencedCode(lines, index, offset);
            case BLOCKQUOTE -> blockquote(lines, index, offset);
            case LIST_ITEM -> list(lines, index, offset);
            case HTML, INDENTED, TEXT -> lateBlock(lines, index, offset);
        };
    }

    private Step lateBlock(List<String> lines, int index, int offset) {
        String line = lines.get(index);
        if (opensTable(lines, index)) {
            return table(lines, index, offset);
        }
        String tag = LineClassifier.htmlTagName(line);
        if (tag != null) {
            return htmlBlock(lines, index, offset, tag);
        }
        if (LineClassifier.isIndented(line)) {
            return indentedCode(lines, index, offset);
        }
        return paragraph(lines, index, offset);
    }

    private Step heading(String line, int index, int offset) {
        int level = LineClassifier.headingLevel(line);
        String text = LineClassifier.headingText(line, level);
        return new Step(new BlockToken.Heading(level, text, line, offset + index), index + 1);
    }

    private Step fencedCode(List<String> lines, int start, int offset) {
        String opening = lines.get(start);
        int fenceLength = LineClassifier.fenceLength(opening);
        String fence = opening.substring(0, fenceLength);
        String language = opening.substring(fenceLength).trim();

        List<String> code = new ArrayList<>();
        int end = lines.size() - 1;
        for (int i = start + 1; i < lines.size(); i++) {
            String current = lines.get(i);
            int fenceIndex = current.indexOf(fence);
            if (fenceIndex >= 0) {
                String before = current.substring(0, fenceIndex);
                int runEnd = fenceIndex + LineClassifier.countRun(current, fenceIndex, fence.charAt(0));
                String after = current.substring(runEnd);
                if (before.isBlank() && after.isBlank()) {
                    end = i;
                    break;
                }
                if (!before.isBlank()) {
                    // text ahead of the closing fence is the last code line; anything after the fence is dropped
                    code.add(before);
                    end = i;
                    break;
                }
            }
            code.add(current);
        }

        BlockToken token = new BlockToken.CodeBlock(language, String.join("\n", code),
                join(lines, start, end), offset + start);
        return new Step(token, end + 1);
    }

    private Step blockquote(List<String> lines, int start, int offset) {
        List<String> content = new ArrayList<>();
        int end = start;
        for (int i = start; i < lines.size(); i++) {
            String current = lines.get(i);
            if (LineClassifier.isBlockquote(current)) {
                content.add(stripQuoteMarker(current));
            } else if (LineClassifier.isBlank(current)) {
                content.add(current);
            } else {
                break;
            }
            end = i;
        }
        BlockToken token = new BlockToken.Blockquote(String.join("\n", content), join(lines, start, end), offset + start);
        return new Step(token, end + 1);
    }

    private Step list(List<String> lines, int start, int offset) {
        boolean ordered = LineClassifier.listMarker(lines.get(start), false).ordered();
        List<ItemBuilder> items = new ArrayList<>();
        int end = start;
        for (int i = start; i < lines.size(); i++) {
            String current = lines.get(i);
            if (LineClassifier.isBlank(current)) {
                end = i;
                continue;
            }
            ListMarker marker = LineClassifier.listMarker(current, true);
            if (marker != null && marker.ordered() == ordered) {
                items.add(new ItemBuilder(marker.marker(), current.substring(marker.contentStart()), current, offset + i));
            } else if (current.startsWith("  ") && !items.isEmpty()) {
                // indented lines stay raw in the open item, nested markers of the other kind included
                items.get(items.size() - 1).content.append('\n').append(current);
            } else {
                break;
            }
            end = i;
        }

        List<BlockToken.ListItem> built = new ArrayList<>(items.size());
        for (ItemBuilder item : items) {
            built.add(item.build());
        }
        BlockToken token = new BlockToken.ListBlock(ordered, Collections.unmodifiableList(built),
                join(lines, start, end), offset + start);
        return new Step(token, end + 1);
    }

    private boolean opensTable(List<String> lines, int index) {
        return lines.get(index).indexOf('|') >= 0
                && index + 1 < lines.size()
                && LineClassifier.isTableSeparator(lines.get(index + 1));
    }

    private Step table(List<String> lines, int start, int offset) {
        List<String> headerCells = LineClassifier.splitTableRow(lines.get(start));
        List<String> separatorCells = LineClassifier.splitTableRow(lines.get(start + 1));

        List<BlockToken.TableHeader> headers = new ArrayList<>(headerCells.size());
        for (int column = 0; column < headerCells.size(); column++) {
            TableAlignment align = column < separatorCells.size()
                    ? TableAlignment.fromSeparatorCell(separatorCells.get(column))
                    : TableAlignment.NONE;
            headers.add(new BlockToken.TableHeader(headerCells.get(column), align));
        }

        List<List<String>> rows = new ArrayList<>();
        int end = start + 1;
        for (int i = start + 2; i < lines.size(); i++) {
            String current = lines.get(i);
            if (current.indexOf('|') < 0) {
                break;
            }
            rows.add(Collections.unmodifiableList(LineClassifier.splitTableRow(current)));
            end = i;
        }

        BlockToken token = new BlockToken.Table(Collections.unmodifiableList(headers), Collections.unmodifiableList(rows),
                join(lines, start, end), offset + start);
        return new Step(token, end + 1);
    }

    private Step htmlBlock(List<String> lines, int start, int offset, String tag) {
        String closing = "</" + tag + ">";
        int end = start;
        for (int i = start; i < lines.size(); i++) {
            if (lines.get(i).contains(closing)) {
                end = i;
                break;
            }
        }
        String html = join(lines, start, end);
        return new Step(new BlockToken.Html(html, html, offset + start), end + 1);
    }

    private Step indentedCode(List<String> lines, int start, int offset) {
        List<String> code = new ArrayList<>();
        int end = start;
        int lastCodeLine = 0;
        for (int i = start; i < lines.size(); i++) {
            String current = lines.get(i);
            if (LineClassifier.isBlank(current)) {
                code.add("");
            } else if (LineClassifier.isIndented(current)) {
                code.add(LineClassifier.dedent(current));
                lastCodeLine = code.size();
            } else {
                break;
            }
            end = i;
        }
        // trailing blank lines stay in raw but not in the code
        String joined = String.join("\n", code.subList(0, lastCodeLine));
        return new Step(new BlockToken.CodeBlock("", joined, join(lines, start, end), offset + start), end + 1);
    }

    private Step paragraph(List<String> lines, int start, int offset) {
        int end = start;
        for (int i = start + 1; i < lines.size(); i++) {
            LineKind kind = LineClassifier.classify(lines.get(i));
            if (kind == LineKind.BLANK || kind.interruptsParagraph()) {
                break;
            }
            end = i;
        }
        String text = join(lines, start, end);
        return new Step(new BlockToken.Paragraph(text, text, offset + start), end + 1);
    }

    private static String stripQuoteMarker(String line) {
        String stripped = line.substring(1);
        if (!stripped.isEmpty() && (stripped.charAt(0) == ' ' || stripped.charAt(0) == '\t')) {
            return stripped.substring(1);
        }
        return stripped;
    }

    private static String join(List<String> lines, int start, int endInclusive) {
        return String.join("\n", lines.subList(start, endInclusive + 1));
    }

    private record Step(BlockToken token, int nextIndex) {
    }

    private static final class ItemBuilder {

        private final String marker;
        private final StringBuilder content;
        private final String raw;
        private final int line;

        private ItemBuilder(String marker, String content, String raw, int line) {
            this.marker = marker;
            this.content = new StringBuilder(content);
            this.raw = raw;
            this.line = line;
        }

        private BlockToken.ListItem build() {
            return new BlockToken.ListItem(marker, content.toString(), raw, line);
        }
    }
}
