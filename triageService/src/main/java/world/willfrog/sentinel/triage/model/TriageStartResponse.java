package world.willfrog.sentinel.triage.model;

public record TriageStartResponse(String runId, String alertId, String status) {

    public static final String STARTED = "started";

    public static TriageStartResponse started(String runId, String alertId) {
        return new TriageStartResponse(runId, alertId, STARTED);
    }
}
