package world.willfrog.sentinel.triage.entity;

import lombok.Data;
import world.willfrog.sentinel.triage.model.TriageRunStatus;

import java.time.OffsetDateTime;

@Data
public class TriageRun {
    private String id;
    private String alertId;
    private TriageRunStatus status;
    private OffsetDateTime startedAt;
    private OffsetDateTime endedAt;

    // 小写 wire 值
    private String risk;
    private String recommendedAction;

    // JSON array string
    private String reasonsJson;

    private Boolean fallbackUsed;
    private Long latencyMs;
    private String lastError;
}
