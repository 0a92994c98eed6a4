package ai.docsite.markdown.inline;

import java.util.List;

/**
 * Splits a span of text into inline tokens.
 *
 * <p>Implementations are total and make progress on every step, so scanning finishes in time linear
 * in the number of steps for any input.
 */
public interface InlineScanner {

    List<InlineToken> scan(String text);
}
