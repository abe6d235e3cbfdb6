package world.willfrog.sentinel.triage.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 查询接口返回的 run 详情，trace 按 seq 升序。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriageRunDetail {
    private String runId;
    private String alertId;
    private TriageRunStatus status;
    private OffsetDateTime startedAt;
    private OffsetDateTime endedAt;
    private String risk;
    private String recommendedAction;
    @Builder.Default
    private List<String> reasons = new ArrayList<>();
    private boolean fallbackUsed;
    private Long latencyMs;
    private String lastError;
    @Builder.Default
    private List<TraceEntry> trace = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TraceEntry {
        private int seq;
        private String step;
        private boolean ok;
        private long durationMs;
        private JsonNode detail;
    }
}
