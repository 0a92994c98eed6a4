package ai.docsite.markdown.block;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class DefaultBlockScannerTest {

    private final DefaultBlockScanner scanner = new DefaultBlockScanner();

    @Test
    void scansHeadingBlankAndParagraph() {
        List<BlockToken> tokens = scan("# Title\n\nParagraph text");

        assertThat(tokens).containsExactly(
                new BlockToken.Heading(1, "Title", "# Title", 0),
                new BlockToken.Blank("", 1),
                new BlockToken.Paragraph("Paragraph text", "Paragraph text", 2));
    }

    @Test
    void sevenHashesFallThroughToParagraph() {
        List<BlockToken> tokens = scan("####### Too deep");

        assertThat(tokens).singleElement().isInstanceOf(BlockToken.Paragraph.class);
    }

    @Test
    void unclosedFenceConsumesRestOfInput() {
        List<BlockToken> tokens = scan("```js\nconst x=1;");

        assertThat(tokens).containsExactly(new BlockToken.CodeBlock("js", "const x=1;", "```js\nconst x=1;", 0));
    }

    @Test
    void fenceClosesOnSameOrLongerRun() {
        assertThat(scan("```\na\n```")).containsExactly(new BlockToken.CodeBlock("", "a", "```\na\n```", 0));
        assertThat(scan("~~~\na\n~~~~~  ")).singleElement()
                .isEqualTo(new BlockToken.CodeBlock("", "a", "~~~\na\n~~~~~  ", 0));
        assertThat(scan("````\na\n```\nb\n````")).singleElement()
                .extracting(token -> ((BlockToken.CodeBlock) token).code())
                .isEqualTo("a\n```\nb");
    }

    @Test
    void textBeforeClosingFenceBecomesLastCodeLine() {
        List<BlockToken> tokens = scan("```\nfirst\nlast```trailing\nafter");

        assertThat(tokens).hasSize(2);
        assertThat(tokens.get(0)).isEqualTo(new BlockToken.CodeBlock("", "first\nlast",
                "```\nfirst\nlast```trailing", 0));
        assertThat(tokens.get(1)).isEqualTo(new BlockToken.Paragraph("after", "after", 3));
    }

    @Test
    void scansPipeTable() {
        List<BlockToken> tokens = scan("| a | b |\n|---|---|\n| 1 | 2 |");

        assertThat(tokens).singleElement().isInstanceOfSatisfying(BlockToken.Table.class, table -> {
            assertThat(table.headers()).containsExactly(
                    new BlockToken.TableHeader("a", TableAlignment.NONE),
                    new BlockToken.TableHeader("b", TableAlignment.NONE));
            assertThat(table.rows()).containsExactly(List.of("1", "2"));
        });
    }

    @Test
    void emptyCellSeparatorOpensTable() {
        List<BlockToken> tokens = scan("| a |\n|\n| 1 |");

        assertThat(tokens).singleElement().isInstanceOfSatisfying(BlockToken.Table.class, table -> {
            assertThat(table.headers()).containsExactly(new BlockToken.TableHeader("a", TableAlignment.NONE));
            assertThat(table.rows()).containsExactly(List.of("1"));
        });
    }

    @Test
    void tableKeepsAlignmentAndExtraCells() {
        List<BlockToken> tokens = scan("| l | c | r |\n|:--|:-:|--:|\n| 1 |  | 3 | 4 |\nnot a row");

        assertThat(tokens).hasSize(2);
        BlockToken.Table table = (BlockToken.Table) tokens.get(0);
        assertThat(table.headers()).extracting(BlockToken.TableHeader::align)
                .containsExactly(TableAlignment.LEFT, TableAlignment.CENTER, TableAlignment.RIGHT);
        assertThat(table.rows()).containsExactly(List.of("1", "", "3", "4"));
        assertThat(tokens.get(1)).isInstanceOf(BlockToken.Paragraph.class);
    }

    @Test
    void blockquoteKeepsRawContentAndBlankLines() {
        List<BlockToken> tokens = scan("> a\n>\n> b\n\nafter");

        assertThat(tokens.get(0)).isEqualTo(new BlockToken.Blockquote("a\n\nb\n", "> a\n>\n> b\n", 0));
        assertThat(tokens.get(1)).isEqualTo(new BlockToken.Paragraph("after", "after", 4));
    }

    @Test
    void listAppendsIndentedContinuationAndSkipsBlanks() {
        List<BlockToken> tokens = scan("- one\n- two\n  continued\n\n- three\nafter");

        assertThat(tokens).hasSize(2);
        BlockToken.ListBlock list = (BlockToken.ListBlock) tokens.get(0);
        assertThat(list.ordered()).isFalse();
        assertThat(list.items()).extracting(BlockToken.ListItem::content)
                .containsExactly("one", "two\n  continued", "three");
        assertThat(list.items()).extracting(BlockToken.ListItem::line).containsExactly(0, 1, 4);
        assertThat(tokens.get(1)).isEqualTo(new BlockToken.Paragraph("after", "after", 5));
    }

    @Test
    void orderedListStopsAtBulletItem() {
        List<BlockToken> tokens = scan("1. first\n2) second\n- bullet");

        assertThat(tokens).hasSize(2);
        BlockToken.ListBlock ordered = (BlockToken.ListBlock) tokens.get(0);
        assertThat(ordered.ordered()).isTrue();
        assertThat(ordered.items()).extracting(BlockToken.ListItem::marker).containsExactly("1", "2");
        assertThat(((BlockToken.ListBlock) tokens.get(1)).ordered()).isFalse();
    }

    @Test
    void indentedMarkerOfOtherKindStaysInOpenItem() {
        List<BlockToken> tokens = scan("- a\n  1. b\n- c");

        assertThat(tokens).hasSize(1);
        BlockToken.ListBlock list = (BlockToken.ListBlock) tokens.get(0);
        assertThat(list.ordered()).isFalse();
        assertThat(list.items()).extracting(BlockToken.ListItem::content).containsExactly("a\n  1. b", "c");
    }

    @Test
    void htmlBlockRunsThroughClosingTag() {
        List<BlockToken> tokens = scan("<div>\n<p>x</p>\n</div>\nafter");

        assertThat(tokens.get(0)).isEqualTo(new BlockToken.Html("<div>\n<p>x</p>\n</div>", "<div>\n<p>x</p>\n</div>", 0));
        assertThat(tokens.get(1)).isEqualTo(new BlockToken.Paragraph("after", "after", 3));
    }

    @Test
    void htmlBlockWithoutClosingTagTakesOneLine() {
        List<BlockToken> tokens = scan("<span>open\ntext");

        assertThat(tokens).containsExactly(
                new BlockToken.Html("<span>open", "<span>open", 0),
                new BlockToken.Paragraph("text", "text", 1));
    }

    @Test
    void indentedCodeDedentsAndDropsTrailingBlankLines() {
        List<BlockToken> tokens = scan("    a\n\n\tb\n\nx");

        assertThat(tokens.get(0)).isEqualTo(new BlockToken.CodeBlock("", "a\n\nb", "    a\n\n\tb\n", 0));
        assertThat(tokens.get(1)).isEqualTo(new BlockToken.Paragraph("x", "x", 4));
    }

    @Test
    void paragraphStopsAtInterruptingLine() {
        List<BlockToken> tokens = scan("one\ntwo\n# Heading\nthree\n- item");

        assertThat(tokens).extracting(token -> token.getClass().getSimpleName())
                .containsExactly("Paragraph", "Heading", "Paragraph", "ListBlock");
        assertThat(((BlockToken.Paragraph) tokens.get(0)).text()).isEqualTo("one\ntwo");
    }

    @Test
    void offsetShiftsLineNumbers() {
        List<BlockToken> tokens = scanner.scan(List.of("text", "", "---"), 10);

        assertThat(tokens).extracting(BlockToken::line).containsExactly(10, 11, 12);
    }

    @Test
    void emptyInputYieldsNoTokens() {
        assertThat(scanner.scan(List.of())).isEmpty();
        assertThat(scan("")).containsExactly(new BlockToken.Blank("", 0));
    }

    @Test
    void rawFieldsReconstructTheInput() {
        List<String> documents = List.of(
                "# Title\n\nParagraph text",
                "```js\nconst x=1;",
                "```\nfirst\nlast```trailing\nafter",
                "> q\n> > nested\n\n- a\n  b\n\n\n1. x\n| a | b |\n|---|---|\n| 1 | 2 |\n",
                "<div>\nunclosed\n    code\n\n\n***\n~~~\n~~~\n",
                "\n\n\n",
                "   \t\n- \n-\n1.\n#\n|\n|---|");

        for (String document : documents) {
            String rebuilt = scan(document).stream().map(BlockToken::raw).collect(Collectors.joining("\n"));
            assertThat(rebuilt).as("raw coverage of %s", document).isEqualTo(document);
        }
    }

    private List<BlockToken> scan(String text) {
        return scanner.scan(Arrays.asList(text.split("\n", -1)));
    }
}
