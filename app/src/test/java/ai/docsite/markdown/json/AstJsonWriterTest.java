package ai.docsite.markdown.json;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.markdown.ast.AstBuilder;
import ai.docsite.markdown.ast.Node;
import ai.docsite.markdown.block.DefaultBlockScanner;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class AstJsonWriterTest {

    private final AstJsonWriter writer = new AstJsonWriter();

    @Test
    void writesRootWithMetadataAndTaggedChildren() {
        JsonNode json = writer.toJson(tree("# Hello World\n\n```js\nx\ny\n```"));

        assertThat(json.get("type").asText()).isEqualTo("root");
        assertThat(json.at("/metadata/nodeCount").asInt()).isEqualTo(3);
        JsonNode heading = json.at("/children/0");
        assertThat(heading.get("type").asText()).isEqualTo("heading");
        assertThat(heading.get("level").asInt()).isEqualTo(1);
        assertThat(heading.get("id").asText()).isEqualTo("hello-world");
        assertThat(heading.at("/children/0/text").asText()).isEqualTo("Hello World");
        JsonNode code = json.at("/children/1");
        assertThat(code.get("type").asText()).isEqualTo("codeBlock");
        assertThat(code.get("language").asText()).isEqualTo("js");
        assertThat(code.get("lineCount").asInt()).isEqualTo(2);
        assertThat(code.get("line").asInt()).isEqualTo(2);
    }

    @Test
    void writesTableSections() {
        JsonNode table = writer.toJson(tree("| a | b |\n|---|--:|\n| 1 | 2 |")).at("/children/0");

        assertThat(table.get("type").asText()).isEqualTo("table");
        assertThat(table.at("/thead/type").asText()).isEqualTo("tableHead");
        assertThat(table.at("/thead/cells/0/isHeader").asBoolean()).isTrue();
        assertThat(table.at("/thead/cells/0/align").isNull()).isTrue();
        assertThat(table.at("/tbody/rows/0/type").asText()).isEqualTo("tableRow");
        assertThat(table.at("/tbody/rows/0/cells/1/align").asText()).isEqualTo("right");
        assertThat(table.at("/tbody/rows/0/cells/1/content/0/text").asText()).isEqualTo("2");
        assertThat(table.get("columnCount").asInt()).isEqualTo(2);
        assertThat(table.get("rowCount").asInt()).isEqualTo(1);
    }

    @Test
    void writesListsAndInlineNodes() {
        JsonNode list = writer.toJson(tree("- [*a*](u \"T\")\n- ~~b~~ `c`")).at("/children/0");

        assertThat(list.get("type").asText()).isEqualTo("list");
        assertThat(list.get("itemCount").asInt()).isEqualTo(2);
        assertThat(list.at("/items/0/type").asText()).isEqualTo("listItem");
        assertThat(list.at("/items/0/marker").asText()).isEqualTo("-");
        JsonNode link = list.at("/items/0/children/0");
        assertThat(link.get("type").asText()).isEqualTo("link");
        assertThat(link.get("title").asText()).isEqualTo("T");
        assertThat(link.at("/children/0/type").asText()).isEqualTo("em");
        assertThat(link.has("attributes")).isFalse();
        assertThat(list.at("/items/1/children/0/type").asText()).isEqualTo("del");
        assertThat(list.at("/items/1/children/2/type").asText()).isEqualTo("inlineCode");
    }

    @Test
    void writesAttributesAndNullTitle() {
        Node.Image image = new Node.Image("alt", "a.png", Optional.empty()).withAttribute("loading", "lazy");

        JsonNode json = writer.toJson(image);

        assertThat(json.get("title").isNull()).isTrue();
        assertThat(json.at("/attributes/loading").asText()).isEqualTo("lazy");
    }

    @Test
    void writeProducesParsableJson() throws Exception {
        String json = writer.write(new Node.Root(List.of(new Node.ThematicBreak(0)), 1));

        JsonNode parsed = new ObjectMapper().readTree(json);
        assertThat(parsed.at("/children/0/type").asText()).isEqualTo("hr");
        assertThat(json).contains(System.lineSeparator());
    }

    private static Node.Root tree(String markdown) {
        return new AstBuilder().build(new DefaultBlockScanner().scan(Arrays.asList(markdown.split("\n", -1))));
    }
}
