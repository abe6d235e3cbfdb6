package world.willfrog.sentinel.triage.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 最终动作提案，产出前经 Bean Validation 校验。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionProposal {

    @NotNull
    private RecommendedAction action;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidence;

    private boolean requiresApproval;

    private boolean blockedByPolicy;

    public static ActionProposal safeDefault() {
        return ActionProposal.builder()
                .action(RecommendedAction.CONTACT_CUSTOMER)
                .confidence(0.5)
                .requiresApproval(true)
                .blockedByPolicy(false)
                .build();
    }
}
