package ai.docsite.markdown.parser;

/**
 * Counts gathered from one parse. {@code nodes} includes the root; {@code lists} counts bullet and
 * ordered lists together.
 */
public record DocumentStatistics(
        int lines,
        int characters,
        int tokens,
        int nodes,
        int headings,
        int links,
        int images,
        int lists,
        int codeBlocks,
        int tables
) {
}
