package world.willfrog.sentinel.triage.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class TriageResult {
    private String runId;
    private RiskLevel risk;
    @Builder.Default
    private List<String> reasons = new ArrayList<>();
    private RecommendedAction recommendedAction;
    @Builder.Default
    private List<String> plan = new ArrayList<>();
    @Builder.Default
    private List<AgentStep> steps = new ArrayList<>();
    private boolean fallbackUsed;
    private long latencyMs;
}
