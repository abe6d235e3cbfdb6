package world.willfrog.sentinel.triage.model;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record AlertActionRequest(@NotBlank(message = "alertId is required") String alertId,
                                 @NotBlank(message = "actionType is required") String actionType,
                                 Map<String, Object> actionParams) {
}
