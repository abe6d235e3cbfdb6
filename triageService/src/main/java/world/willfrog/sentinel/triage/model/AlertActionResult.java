package world.willfrog.sentinel.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertActionResult {
    private String alertId;
    private String actionType;
    private String alertStatus;
    private ActionRecord actionResult;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ActionRecord {
        private String actionType;
        private Map<String, Object> params;
        private OffsetDateTime timestamp;
    }
}
