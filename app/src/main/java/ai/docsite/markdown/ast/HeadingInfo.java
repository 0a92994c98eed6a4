package ai.docsite.markdown.ast;

public record HeadingInfo(int level, String text, String id) {
}
