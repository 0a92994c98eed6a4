package ai.docsite.markdown.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks over a built or transformed tree. An empty problem list means the tree is valid.
 */
public final class AstValidator {

    private AstValidator() {
    }

    public static List<String> validate(Node node) {
        List<String> problems = new ArrayList<>();
        if (node == null) {
            problems.add("tree is null");
            return problems;
        }
        check(node, null, node.type().wireName(), problems);
        return problems;
    }

    public static boolean isValid(Node node) {
        return validate(node).isEmpty();
    }

    private static void check(Node node, Node parent, String path, List<String> problems) {
        if (node instanceof Node.Root && parent != null) {
            problems.add(path + ": root nested inside " + parent.type().wireName());
        }
        if (node instanceof Node.ListItem && !isList(parent)) {
            problems.add(path + ": list item outside a list");
        }
        if (node instanceof Node.Heading heading && (heading.level() < 1 || heading.level() > 6)) {
            problems.add(path + ": heading level " + heading.level() + " outside 1..6");
        }
        if (node instanceof Node.Link link && link.href().isBlank()) {
            problems.add(path + ": link without href");
        }
        if (node instanceof Node.Image image && image.src().isBlank()) {
            problems.add(path + ": image without src");
        }
        if (node instanceof Node.CodeBlock codeBlock && codeBlock.lineCount() < 1) {
            problems.add(path + ": code block line count " + codeBlock.lineCount());
        }

        List<Node> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            Node child = children.get(i);
            check(child, node, path + "/" + child.type().wireName() + "[" + i + "]", problems);
        }
    }

    private static boolean isList(Node node) {
        return node instanceof Node.BulletList || node instanceof Node.OrderedList;
    }
}
