package ai.docsite.markdown.ast;

import ai.docsite.markdown.MarkdownException;

/**
 * Raised before tree construction when a block token list breaks the structure the builder relies on.
 * Scanner output never triggers it; only hand-built token lists can.
 */
public class MalformedTokenStreamException extends MarkdownException {

    private final int index;

    public MalformedTokenStreamException(int index, String message) {
        super(index < 0 ? message : "Token at index " + index + ": " + message);
        this.index = index;
    }

    /**
     * Position of the offending token, or {@code -1} when the list itself is unusable.
     */
    public int index() {
        return index;
    }
}
