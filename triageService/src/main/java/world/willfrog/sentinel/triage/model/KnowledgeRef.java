package world.willfrog.sentinel.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeRef {
    private String docId;
    private String title;
    private String anchor;
    private String extract;
}
