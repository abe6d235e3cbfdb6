package world.willfrog.sentinel.triage.entity;

import lombok.Data;

import java.time.OffsetDateTime;

@Data
public class AgentTrace {
    private Long id;
    private String runId;
    private Integer seq;
    private String step;
    private Boolean ok;
    private Long durationMs;
    private String detailJson;
    private OffsetDateTime createdAt;
}
