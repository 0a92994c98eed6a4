package ai.docsite.markdown;

/**
 * Base runtime exception for every failure raised by the markdown pipeline.
 */
public class MarkdownException extends RuntimeException {

    public MarkdownException(String message) {
        super(message);
    }

    public MarkdownException(String message, Throwable cause) {
        super(message, cause);
    }
}
