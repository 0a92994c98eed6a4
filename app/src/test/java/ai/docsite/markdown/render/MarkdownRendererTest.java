package ai.docsite.markdown.render;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.markdown.ast.AstBuilder;
import ai.docsite.markdown.ast.Node;
import ai.docsite.markdown.block.DefaultBlockScanner;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class MarkdownRendererTest {

    private final MarkdownRenderer renderer = new MarkdownRenderer();

    @Test
    void normalizesBlocksAndRenumbersOrderedLists() {
        assertThat(renderer.render(tree("# Title\n\nSome __bold__ text\n* a\n+ b\n\n3. x\n4) y")))
                .isEqualTo("# Title\n\nSome **bold** text\n\n- a\n- b\n\n1. x\n2. y\n");
    }

    @Test
    void quotesEveryBlockquoteLine() {
        assertThat(renderer.render(tree("> a\n>\n> b"))).isEqualTo("> a\n>\n> b\n");
    }

    @Test
    void rendersTableSeparatorsFromAlignment() {
        assertThat(renderer.render(tree("| a | b | c |\n|:-:|--:|:--|\n| 1 | 2 | 3 |")))
                .isEqualTo("| a | b | c |\n| :---: | ---: | :--- |\n| 1 | 2 | 3 |\n");
    }

    @Test
    void rendersCodeLinksAndRules() {
        assertThat(renderer.render(tree("```js\nx\n```\n\n***\n\n[t](u \"T\") ![a](s) ~~d~~ `c`")))
                .isEqualTo("```js\nx\n```\n\n---\n\n[t](u \"T\") ![a](s) ~~d~~ `c`\n");
    }

    @Test
    void emptyTreeRendersNothing() {
        assertThat(renderer.render(new Node.Root(List.of(), 0))).isEmpty();
    }

    @Test
    void minifyDropsBlankLinesAndIndentation() {
        assertThat(MarkdownRenderer.minify("  # a  \n\n\n  b\n")).isEqualTo("# a\nb");
        assertThat(MarkdownRenderer.minify(null)).isEmpty();
    }

    private static Node.Root tree(String markdown) {
        return new AstBuilder().build(new DefaultBlockScanner().scan(Arrays.asList(markdown.split("\n", -1))));
    }
}
