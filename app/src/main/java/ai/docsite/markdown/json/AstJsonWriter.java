package ai.docsite.markdown.json;

import ai.docsite.markdown.MarkdownException;
import ai.docsite.markdown.ast.Node;
import ai.docsite.markdown.ast.NodeType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes a tree as tagged JSON. Every object carries {@code type}; containers carry {@code children},
 * lists carry {@code items} and tables carry {@code thead}/{@code tbody}.
 */
public class AstJsonWriter {

    private final ObjectMapper mapper;

    public AstJsonWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public AstJsonWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String write(Node node) {
        try {
            return mapper.writeValueAsString(toJson(node));
        } catch (JsonProcessingException ex) {
            throw new MarkdownException("Failed to serialize tree: " + ex.getOriginalMessage(), ex);
        }
    }

    public ObjectNode toJson(Node node) {
        ObjectNode json = mapper.createObjectNode();
        json.put("type", node.type().wireName());
        if (node instanceof Node.Root root) {
            json.set("children", array(root.children()));
            json.putObject("metadata").put("nodeCount", root.nodeCount());
        } else if (node instanceof Node.Heading heading) {
            json.put("level", heading.level());
            json.put("id", heading.id());
            json.set("children", array(heading.children()));
            json.put("line", heading.line());
        } else if (node instanceof Node.Paragraph paragraph) {
            json.set("children", array(paragraph.children()));
            json.put("line", paragraph.line());
        } else if (node instanceof Node.CodeBlock codeBlock) {
            json.put("language", codeBlock.language());
            json.put("code", codeBlock.code());
            json.put("lineCount", codeBlock.lineCount());
            json.put("line", codeBlock.line());
        } else if (node instanceof Node.BulletList list) {
            json.set("items", array(list.items()));
            json.put("itemCount", list.items().size());
            json.put("line", list.line());
        } else if (node instanceof Node.OrderedList list) {
            json.set("items", array(list.items()));
            json.put("itemCount", list.items().size());
            json.put("line", list.line());
        } else if (node instanceof Node.ListItem item) {
            json.put("marker", item.marker());
            json.set("children", array(item.children()));
            json.put("line", item.line());
        } else if (node instanceof Node.Blockquote blockquote) {
            json.set("children", array(blockquote.children()));
            json.put("line", blockquote.line());
        } else if (node instanceof Node.Table table) {
            writeTable(json, table);
        } else if (node instanceof Node.ThematicBreak rule) {
            json.put("line", rule.line());
        } else if (node instanceof Node.Html html) {
            json.put("html", html.html());
            json.put("line", html.line());
        } else if (node instanceof Node.Text text) {
            json.put("text", text.text());
        } else if (node instanceof Node.InlineCode code) {
            json.put("code", code.code());
        } else if (node instanceof Node.Link link) {
            json.put("href", link.href());
            putOptional(json, "title", link.title());
            json.set("children", array(link.children()));
            putAttributes(json, link.attributes());
        } else if (node instanceof Node.Image image) {
            json.put("alt", image.alt());
            json.put("src", image.src());
            putOptional(json, "title", image.title());
            putAttributes(json, image.attributes());
        } else if (node.type() == NodeType.STRONG || node.type() == NodeType.EMPHASIS
                || node.type() == NodeType.STRIKETHROUGH) {
            json.set("children", array(node.children()));
        }
        return json;
    }

    private void writeTable(ObjectNode json, Node.Table table) {
        ObjectNode head = json.putObject("thead");
        head.put("type", "tableHead");
        head.set("cells", cells(table.head()));
        ObjectNode body = json.putObject("tbody");
        body.put("type", "tableBody");
        ArrayNode rows = body.putArray("rows");
        for (Node.TableRow row : table.rows()) {
            ObjectNode rowJson = rows.addObject();
            rowJson.put("type", "tableRow");
            rowJson.set("cells", cells(row));
        }
        json.put("columnCount", table.columnCount());
        json.put("rowCount", table.rows().size());
        json.put("line", table.line());
    }

    private ArrayNode cells(Node.TableRow row) {
        ArrayNode cells = mapper.createArrayNode();
        for (Node.TableCell cell : row.cells()) {
            ObjectNode cellJson = cells.addObject();
            cellJson.put("type", "tableCell");
            cellJson.set("content", array(cell.content()));
            cellJson.put("align", cell.align().wireValue());
            cellJson.put("isHeader", cell.header());
        }
        return cells;
    }

    private ArrayNode array(List<? extends Node> nodes) {
        ArrayNode array = mapper.createArrayNode();
        for (Node node : nodes) {
            array.add(toJson(node));
        }
        return array;
    }

    private static void putOptional(ObjectNode json, String field, Optional<String> value) {
        if (value.isPresent()) {
            json.put(field, value.get());
        } else {
            json.putNull(field);
        }
    }

    private static void putAttributes(ObjectNode json, Map<String, String> attributes) {
        if (attributes.isEmpty()) {
            return;
        }
        ObjectNode attributesJson = json.putObject("attributes");
        attributes.forEach(attributesJson::put);
    }
}
