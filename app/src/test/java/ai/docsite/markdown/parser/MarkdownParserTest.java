package ai.docsite.markdown.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.docsite.markdown.ast.Node;
import ai.docsite.markdown.ast.TocEntry;
import ai.docsite.markdown.block.BlockToken;
import ai.docsite.markdown.inline.InlineToken;
import ai.docsite.markdown.plugin.ExternalLinkPlugin;
import ai.docsite.markdown.render.MarkdownRenderer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class MarkdownParserTest {

    private static final String DOCUMENT = String.join("\n",
            "# T",
            "",
            "[a](b) ![i](s)",
            "",
            "- x",
            "",
            "```",
            "c",
            "```",
            "",
            "| a |",
            "|---|",
            "| 1 |");

    private final MarkdownParser parser = new MarkdownParser();

    @Test
    void parsesToTrimmedHtml() {
        assertThat(parser.parse("# Hello\n\nWorld")).isEqualTo("<h1 id=\"hello\">Hello</h1>\n<p>World</p>");
        assertThat(parser.parse("")).isEmpty();
    }

    @Test
    void rejectsNullInput() {
        assertThatThrownBy(() -> parser.parse(null))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("Input must be text, got null");
        assertThatThrownBy(() -> parser.tokenize(null)).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void normalizesLineEndingsBeforeScanning() {
        assertThat(parser.tokenize("a\r\nb\rc"))
                .containsExactly(new BlockToken.Paragraph("a\nb\nc", "a\nb\nc", 0));
    }

    @Test
    void exposesInlineTokens() {
        assertThat(parser.tokenizeInline("**x**")).containsExactly(new InlineToken.Strong("x", "**x**"));
    }

    @Test
    void cachedTreesAreReusedForEquivalentText() {
        Node.Root first = parser.parseToAst("a\nb", true);
        Node.Root second = parser.parseToAst("a\r\nb", true);

        assertThat(second).isSameAs(first);
        assertThat(parser.cacheSize()).isEqualTo(1);
        assertThat(parser.parseToAst("a\nb")).isNotSameAs(first);

        parser.clearCache();
        assertThat(parser.cacheSize()).isZero();
    }

    @Test
    void collectsDocumentStatistics() {
        DocumentStatistics statistics = parser.statistics(DOCUMENT);

        assertThat(statistics).isEqualTo(new DocumentStatistics(13, DOCUMENT.length(), 8, 15, 1, 1, 1, 1, 1, 1));
    }

    @Test
    void appliesRegisteredPlugins() {
        parser.use(ExternalLinkPlugin.NAME, new ExternalLinkPlugin());

        assertThat(parser.pluginNames()).containsExactly(ExternalLinkPlugin.NAME);
        assertThat(parser.parse("[x](https://a.b)"))
                .isEqualTo("<p><a href=\"https://a.b\" target=\"_blank\" rel=\"noopener noreferrer\">x</a></p>");

        assertThat(parser.unuse(ExternalLinkPlugin.NAME)).isTrue();
        assertThat(parser.parse("[x](https://a.b)")).isEqualTo("<p><a href=\"https://a.b\">x</a></p>");
    }

    @Test
    void optionsReachScannerAndRenderer() {
        MarkdownParser configured = new MarkdownParser(ParserOptions.defaults()
                .withStrikethrough(false)
                .withSanitize(true)
                .withBreaks(true)
                .withLangPrefix("lang-"));

        assertThat(configured.parse("~~x~~")).isEqualTo("<p>~~x~~</p>");
        assertThat(configured.parse("<div>x</div>")).isEqualTo("<!-- HTML block sanitized -->");
        assertThat(configured.parse("a\nb")).isEqualTo("<p>a<br />\nb</p>");
        assertThat(configured.parse("```js\nx\n```")).isEqualTo("<pre><code class=\"lang-js\">x</code></pre>");
    }

    @Test
    void rejectsLanguagePrefixWithWhitespace() {
        assertThatThrownBy(() -> ParserOptions.defaults().withLangPrefix("lang "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rendersWithAnyRenderer() {
        assertThat(parser.render("Title\n=====\n\n* a", new MarkdownRenderer()))
                .isEqualTo("Title\n=====\n\n- a\n");
    }

    @Test
    void exportsJsonTree() throws Exception {
        JsonNode json = new ObjectMapper().readTree(parser.exportAsJson("# T"));

        assertThat(json.get("type").asText()).isEqualTo("root");
        assertThat(json.at("/children/0/id").asText()).isEqualTo("t");
    }

    @Test
    void buildsTableOfContents() {
        List<TocEntry> toc = parser.tableOfContents("# A\n## B");

        assertThat(toc.get(0).items()).extracting(TocEntry::text).containsExactly(Optional.of("A"));
        assertThat(toc.get(0).children().get(0).items()).extracting(TocEntry::text).containsExactly(Optional.of("B"));
    }

    @Test
    void validateNeverThrows() {
        assertThat(parser.validate("# ok\n\n- item")).isEqualTo(ValidationResult.ok());
        assertThat(parser.validate(null).valid()).isFalse();
        assertThat(parser.validate(null).errors()).containsExactly("Input must be text, got null");
    }

    @Test
    void cacheKeyIsSha256Hex() {
        assertThat(ParseCache.key("")).isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }
}
