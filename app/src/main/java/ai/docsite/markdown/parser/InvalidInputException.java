package ai.docsite.markdown.parser;

import ai.docsite.markdown.MarkdownException;

/**
 * Raised when an entry point receives no text where text is required.
 */
public class InvalidInputException extends MarkdownException {

    public InvalidInputException(String message) {
        super(message);
    }
}
