package ai.docsite.markdown.plugin;

import ai.docsite.markdown.ast.AstTraversal;
import ai.docsite.markdown.ast.Node;

public class LazyImagePlugin implements AstPlugin {

    public static final String NAME = "lazy-images";

    @Override
    public Node.Root apply(Node.Root root) {
        return AstTraversal.transformRoot(root, node -> node instanceof Node.Image image
                ? image.withAttribute("loading", "lazy")
                : node);
    }
}
