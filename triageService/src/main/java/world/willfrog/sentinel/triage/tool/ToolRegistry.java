package world.willfrog.sentinel.triage.tool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Component
public class ToolRegistry {

    private final Map<String, TriageTool<?>> tools;

    public ToolRegistry(List<TriageTool<?>> tools) {
        Map<String, TriageTool<?>> byName = new LinkedHashMap<>();
        for (TriageTool<?> tool : tools) {
            TriageTool<?> previous = byName.putIfAbsent(tool.name(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate triage tool name: " + tool.name());
            }
        }
        this.tools = Collections.unmodifiableMap(byName);
        log.info("Triage tools registered: {}", this.tools.keySet());
    }

    public Optional<TriageTool<?>> find(String stepName) {
        return Optional.ofNullable(tools.get(stepName));
    }

    public Set<String> names() {
        return tools.keySet();
    }
}
