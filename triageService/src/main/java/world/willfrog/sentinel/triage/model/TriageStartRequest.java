package world.willfrog.sentinel.triage.model;

import jakarta.validation.constraints.NotBlank;

public record TriageStartRequest(@NotBlank(message = "alertId is required") String alertId) {
}
