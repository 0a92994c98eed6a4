package ai.docsite.markdown.ast;

import java.util.Optional;

/**
 * Link found in a tree: flattened label, target and optional title.
 */
public record LinkInfo(String text, String href, Optional<String> title) {
}
