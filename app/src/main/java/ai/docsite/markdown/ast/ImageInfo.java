package ai.docsite.markdown.ast;

import java.util.Optional;

public record ImageInfo(String alt, String src, Optional<String> title) {
}
