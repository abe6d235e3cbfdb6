package world.willfrog.sentinel.triage.model;

public enum TriageRunStatus {
    RUNNING,
    COMPLETED,
    FAILED;
}
