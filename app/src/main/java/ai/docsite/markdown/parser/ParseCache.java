package ai.docsite.markdown.parser;

import ai.docsite.markdown.ast.Node;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Built trees keyed by the SHA-256 of their normalized source. Entries live until {@link #clear()}.
 */
public class ParseCache {

    private final Map<String, Node.Root> entries = new ConcurrentHashMap<>();

    public Optional<Node.Root> get(String normalizedText) {
        return Optional.ofNullable(entries.get(key(normalizedText)));
    }

    public void put(String normalizedText, Node.Root root) {
        entries.put(key(normalizedText), root);
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    static String key(String normalizedText) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(normalizedText.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }
}
