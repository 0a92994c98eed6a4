package ai.docsite.markdown.render;

import ai.docsite.markdown.ast.Node;

/**
 * Turns a tree, or any subtree, into text.
 */
@FunctionalInterface
public interface NodeRenderer {

    String render(Node node);
}
