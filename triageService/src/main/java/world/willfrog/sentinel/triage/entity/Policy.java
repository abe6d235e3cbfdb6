package world.willfrog.sentinel.triage.entity;

import lombok.Data;

@Data
public class Policy {
    private String id;
    private String code;
    private String title;
    private Boolean requiresApproval;
}
