package ai.docsite.markdown.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class NodeTypeTest {

    @Test
    void resolvesWireNames() {
        assertThat(NodeType.fromWireName("hr")).isEqualTo(NodeType.THEMATIC_BREAK);
        assertThat(NodeType.fromWireName("list")).isEqualTo(NodeType.BULLET_LIST);
        for (NodeType type : NodeType.values()) {
            assertThat(NodeType.fromWireName(type.wireName())).isEqualTo(type);
        }
    }

    @Test
    void rejectsUnknownWireName() {
        assertThatThrownBy(() -> NodeType.fromWireName("CODE_BLOCK"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported node type: CODE_BLOCK");
    }
}
