package ai.docsite.markdown.render;

import ai.docsite.markdown.ast.Node;
import ai.docsite.markdown.ast.NodeType;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Renderer driven by a table keyed on node type. Types without an entry render as the concatenation
 * of their rendered children. Entries can be replaced or removed at any time; the table is not
 * synchronized.
 */
public abstract class DispatchingRenderer implements NodeRenderer {

    private final Map<NodeType, Function<Node, String>> renderers = new EnumMap<>(NodeType.class);

    @Override
    public String render(Node node) {
        if (node == null) {
            return "";
        }
        Function<Node, String> renderer = renderers.get(node.type());
        if (renderer != null) {
            return renderer.apply(node);
        }
        return renderChildren(node.children());
    }

    public void addRenderer(NodeType type, Function<Node, String> renderer) {
        renderers.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(renderer, "renderer"));
    }

    public void removeRenderer(NodeType type) {
        renderers.remove(type);
    }

    public boolean hasRenderer(NodeType type) {
        return renderers.containsKey(type);
    }

    protected String renderChildren(List<? extends Node> children) {
        StringBuilder builder = new StringBuilder();
        for (Node child : children) {
            builder.append(render(child));
        }
        return builder.toString();
    }

    /**
     * Registers a renderer for one concrete node record, casting before the call.
     */
    protected <T extends Node> void register(NodeType type, Class<T> nodeClass, Function<T, String> renderer) {
        addRenderer(type, node -> renderer.apply(nodeClass.cast(node)));
    }
}
