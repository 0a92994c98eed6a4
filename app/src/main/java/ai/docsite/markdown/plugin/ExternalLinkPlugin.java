package ai.docsite.markdown.plugin;

import ai.docsite.markdown.ast.AstTraversal;
import ai.docsite.markdown.ast.Node;
import java.util.Locale;

/**
 * Opens absolute {@code http(s)} links in a new browsing context.
 */
public class ExternalLinkPlugin implements AstPlugin {

    public static final String NAME = "external-links";

    @Override
    public Node.Root apply(Node.Root root) {
        return AstTraversal.transformRoot(root, node -> {
            if (node instanceof Node.Link link && isExternal(link.href())) {
                return link.withAttribute("target", "_blank").withAttribute("rel", "noopener noreferrer");
            }
            return node;
        });
    }

    static boolean isExternal(String href) {
        String lower = href.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }
}
