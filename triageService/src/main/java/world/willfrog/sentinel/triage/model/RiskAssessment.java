package world.willfrog.sentinel.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 风险识别步骤的输出，也是降级时的替代值。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskAssessment {

    public static final String FALLBACK_REASON = "Risk assessment unavailable (fallback)";

    private FraudSignals signals;
    private RiskLevel risk;
    @Builder.Default
    private List<String> reasons = new ArrayList<>();
    private RecommendedAction action;
    private Integer score;

    public static RiskAssessment fallback() {
        List<String> reasons = new ArrayList<>();
        reasons.add(FALLBACK_REASON);
        return RiskAssessment.builder()
                .risk(RiskLevel.MEDIUM)
                .reasons(reasons)
                .action(RecommendedAction.FREEZE_CARD)
                .build();
    }
}
