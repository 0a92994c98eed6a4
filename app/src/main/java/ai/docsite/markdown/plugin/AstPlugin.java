package ai.docsite.markdown.plugin;

import ai.docsite.markdown.ast.Node;

/**
 * Post-build transform applied to every freshly built tree. Implementations return a new root or the
 * given one unchanged.
 */
@FunctionalInterface
public interface AstPlugin {

    Node.Root apply(Node.Root root);
}
