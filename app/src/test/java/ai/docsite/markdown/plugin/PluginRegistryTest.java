package ai.docsite.markdown.plugin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.docsite.markdown.ast.Node;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class PluginRegistryTest {

    private static final Node.Root EMPTY = new Node.Root(List.of(), 0);

    private final Logger logger = (Logger) LoggerFactory.getLogger(PluginRegistry.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attachAppender() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        logger.detachAppender(appender);
    }

    @Test
    void appliesPluginsInRegistrationOrder() {
        List<String> calls = new ArrayList<>();
        PluginRegistry registry = new PluginRegistry();
        registry.register("first", root -> record(calls, "first", root));
        registry.register("second", root -> record(calls, "second", root));
        registry.register("first", root -> record(calls, "first-replaced", root));

        registry.apply(EMPTY);

        assertThat(calls).containsExactly("first-replaced", "second");
        assertThat(registry.names()).containsExactly("first", "second");
    }

    @Test
    void failingPluginIsSkippedAndLogged() {
        PluginRegistry registry = new PluginRegistry();
        Node.Root replacement = new Node.Root(List.of(new Node.ThematicBreak(0)), 1);
        registry.register("broken", root -> {
            throw new IllegalStateException("boom");
        });
        registry.register("empty", root -> null);
        registry.register("working", root -> replacement);

        Node.Root result = registry.apply(EMPTY);

        assertThat(result).isEqualTo(replacement);
        assertThat(appender.list).extracting(ILoggingEvent::getLevel).containsExactly(Level.WARN, Level.WARN);
        assertThat(appender.list.get(0).getFormattedMessage()).isEqualTo("Plugin broken failed: boom");
        assertThat(appender.list.get(0).getThrowableProxy()).isNotNull();
    }

    @Test
    void unregisterReportsWhetherPluginExisted() {
        PluginRegistry registry = new PluginRegistry();
        registry.register("only", root -> root);

        assertThat(registry.unregister("only")).isTrue();
        assertThat(registry.unregister("only")).isFalse();
        assertThat(registry.isEmpty()).isTrue();
        assertThat(registry.apply(EMPTY)).isSameAs(EMPTY);
    }

    @Test
    void rejectsBlankName() {
        assertThatThrownBy(() -> new PluginRegistry().register(" ", root -> root))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Node.Root record(List<String> calls, String name, Node.Root root) {
        calls.add(name);
        return root;
    }
}
