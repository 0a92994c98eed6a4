package ai.docsite.markdown.plugin;

import ai.docsite.markdown.ast.AstValidator;
import ai.docsite.markdown.ast.Node;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs structural problems of the built tree without changing it.
 */
public class StructureValidatorPlugin implements AstPlugin {

    public static final String NAME = "structure-validator";

    private static final Logger LOGGER = LoggerFactory.getLogger(StructureValidatorPlugin.class);

    @Override
    public Node.Root apply(Node.Root root) {
        List<String> problems = AstValidator.validate(root);
        for (String problem : problems) {
            LOGGER.warn("Invalid tree structure: {}", problem);
        }
        return root;
    }
}
