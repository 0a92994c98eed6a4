package ai.docsite.markdown.block;

import java.util.List;

/**
 * Segments a document, given as lines, into block tokens.
 *
 * <p>Implementations are total: every input yields tokens, and the {@code raw} fields of the result,
 * joined with {@code \n}, reproduce the input lines.
 */
public interface BlockScanner {

    /**
     * Scans lines whose first element is line {@code firstLine} of the enclosing document.
     */
    List<BlockToken> scan(List<String> lines, int firstLine);

    default List<BlockToken> scan(List<String> lines) {
        return scan(lines, 0);
    }
}
