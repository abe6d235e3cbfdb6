package world.willfrog.sentinel.triage.tool;

import org.junit.jupiter.api.Test;
import world.willfrog.sentinel.triage.support.StubTool;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolRegistryTest {

    @Test
    void find_shouldResolveRegisteredTools() {
        ToolRegistry registry = new ToolRegistry(List.of(
                StubTool.returning("dataAccess", "snapshot"),
                StubTool.returning("decide", "decision")));

        assertTrue(registry.find("decide").isPresent());
        assertTrue(registry.find("missing").isEmpty());
        assertThat(registry.names()).containsExactly("dataAccess", "decide");
    }

    @Test
    void constructor_shouldRejectDuplicateNames() {
        assertThatThrownBy(() -> new ToolRegistry(List.of(
                StubTool.returning("decide", "a"),
                StubTool.returning("decide", "b"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("decide");
    }
}
