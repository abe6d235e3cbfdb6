package world.willfrog.sentinel.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionOutcome {
    private RecommendedAction recommendedAction;
    private double confidence;
}
