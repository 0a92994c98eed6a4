package ai.docsite.markdown.plugin;

import ai.docsite.markdown.ast.Node;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named plugins applied in registration order. A plugin that throws or returns {@code null} is
 * logged and skipped; the tree it received is passed on to the next plugin.
 */
public class PluginRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluginRegistry.class);

    private final Map<String, AstPlugin> plugins = new LinkedHashMap<>();

    /**
     * Registers a plugin. Registering an existing name replaces that plugin in place.
     */
    public void register(String name, AstPlugin plugin) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(plugin, "plugin");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Plugin name must not be blank");
        }
        plugins.put(name, plugin);
    }

    public boolean unregister(String name) {
        return plugins.remove(name) != null;
    }

    public List<String> names() {
        return List.copyOf(plugins.keySet());
    }

    public boolean isEmpty() {
        return plugins.isEmpty();
    }

    public Node.Root apply(Node.Root root) {
        Node.Root current = root;
        for (Map.Entry<String, AstPlugin> entry : plugins.entrySet()) {
            try {
                Node.Root result = entry.getValue().apply(current);
                if (result == null) {
                    LOGGER.warn("Plugin {} returned no tree; keeping previous tree", entry.getKey());
                    continue;
                }
                current = result;
            } catch (RuntimeException ex) {
                LOGGER.warn("Plugin {} failed: {}", entry.getKey(), ex.getMessage(), ex);
            }
        }
        return current;
    }
}
