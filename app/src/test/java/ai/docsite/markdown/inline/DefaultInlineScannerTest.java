package ai.docsite.markdown.inline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeout;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class DefaultInlineScannerTest {

    private final DefaultInlineScanner scanner = new DefaultInlineScanner();

    @Test
    void splitsTextAroundStrongAndEmphasis() {
        assertThat(scanner.scan("Hello **bold** and *em*")).containsExactly(
                new InlineToken.Text("Hello "),
                new InlineToken.Strong("bold", "**bold**"),
                new InlineToken.Text(" and "),
                new InlineToken.Em("em", "*em*"));
    }

    @Test
    void codeSpanClosesOnlyOnMatchingRun() {
        assertThat(scanner.scan("`code`")).containsExactly(new InlineToken.InlineCode("code", "`code`"));
        assertThat(scanner.scan("``a`b``")).containsExactly(new InlineToken.InlineCode("a`b", "``a`b``"));
        assertThat(scanner.scan("`open")).containsExactly(new InlineToken.Text("`open"));
    }

    @Test
    void parsesLinkWithTitleAndImage() {
        assertThat(scanner.scan("[docs](https://example.com \"Guide\")")).containsExactly(
                new InlineToken.Link("docs", "https://example.com", Optional.of("Guide"),
                        "[docs](https://example.com \"Guide\")"));
        assertThat(scanner.scan("see ![logo](img/logo.png)")).containsExactly(
                new InlineToken.Text("see "),
                new InlineToken.Image("logo", "img/logo.png", Optional.empty(), "![logo](img/logo.png)"));
    }

    @Test
    void incompleteLinkStaysText() {
        assertThat(scanner.scan("[text](")).containsExactly(new InlineToken.Text("[text]("));
        assertThat(scanner.scan("[text] (x)")).containsExactly(new InlineToken.Text("[text] (x)"));
    }

    @Test
    void strikethroughCanBeDisabled() {
        assertThat(scanner.scan("~~gone~~")).containsExactly(new InlineToken.Del("gone", "~~gone~~"));
        assertThat(new DefaultInlineScanner(false).scan("~~gone~~"))
                .containsExactly(new InlineToken.Text("~~gone~~"));
    }

    @Test
    void escapedMarkersBecomeLiteralText() {
        assertThat(scanner.scan("\\*not em\\*")).containsExactly(new InlineToken.Text("*not em*", "\\*not em\\*"));
    }

    @Test
    void unmatchedMarkerIsText() {
        assertThat(scanner.scan("a * b")).containsExactly(new InlineToken.Text("a * b"));
        assertThat(scanner.scan("**open")).containsExactly(new InlineToken.Text("**open"));
    }

    @Test
    void emphasisSkipsDoubledMarkersInside() {
        assertThat(scanner.scan("*a **b** c*")).containsExactly(new InlineToken.Em("a **b** c", "*a **b** c*"));
    }

    @Test
    void emphasisDoesNotCloseAfterWhitespace() {
        assertThat(scanner.scan("*a *b*")).containsExactly(
                new InlineToken.Text("*a "),
                new InlineToken.Em("b", "*b*"));
    }

    @Test
    void unmatchedEmphasisMarkersScanInLinearTime() {
        String input = "*a ".repeat(40_000);

        List<InlineToken> tokens = assertTimeout(Duration.ofSeconds(2), () -> scanner.scan(input));

        assertThat(tokens).containsExactly(new InlineToken.Text(input));
    }

    @Test
    void emptyInputHasNoTokens() {
        assertThat(scanner.scan("")).isEmpty();
        assertThat(scanner.scan(null)).isEmpty();
    }

    @Test
    void rawFieldsReconstructPathologicalInput() {
        String input = "**a *b [c](d ~~e `f \\".repeat(200) + "![x](" + "_".repeat(500) + "[](".repeat(100);

        List<InlineToken> tokens = scanner.scan(input);

        assertThat(tokens.stream().map(InlineToken::raw).collect(Collectors.joining())).isEqualTo(input);
    }
}
