package world.willfrog.sentinel.triage.entity;

import lombok.Data;

@Data
public class KbDoc {
    private String id;
    private String title;
    private String anchor;
    private String contentText;
}
