package world.willfrog.sentinel.triage.tool;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.sentinel.triage.context.AgentContext;
import world.willfrog.sentinel.triage.model.ActionProposal;
import world.willfrog.sentinel.triage.model.ComplianceVerdict;
import world.willfrog.sentinel.triage.model.RecommendedAction;
import world.willfrog.sentinel.triage.model.RiskAssessment;
import world.willfrog.sentinel.triage.model.RiskLevel;

import java.util.Set;

/**
 * 生成最终动作提案。
 * <p>
 * 冻卡且需要 OTP 时要求人工审批；置信度：high 且理由多于 2 条为 0.92，low 为 0.85，其余 0.75。
 * 提案校验失败时退回 {@link ActionProposal#safeDefault()}。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProposeActionTool implements TriageTool<ActionProposal> {

    public static final String NAME = "proposeAction";

    private final Validator validator;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ActionProposal run(AgentContext context) {
        RiskAssessment assessment = context.getRiskAssessment();
        ComplianceVerdict compliance = context.getComplianceVerdict();

        RecommendedAction action = assessment == null || assessment.getAction() == null
                ? RecommendedAction.MARK_FALSE_POSITIVE
                : assessment.getAction();
        boolean requiresApproval = action == RecommendedAction.FREEZE_CARD
                && compliance != null && compliance.isRequiresOtp();

        double confidence = 0.75;
        if (assessment != null && assessment.getRisk() == RiskLevel.HIGH
                && assessment.getReasons() != null && assessment.getReasons().size() > 2) {
            confidence = 0.92;
        } else if (assessment != null && assessment.getRisk() == RiskLevel.LOW) {
            confidence = 0.85;
        }

        ActionProposal proposal = ActionProposal.builder()
                .action(action)
                .confidence(confidence)
                .requiresApproval(requiresApproval)
                .blockedByPolicy(false)
                .build();

        Set<ConstraintViolation<ActionProposal>> violations = validator.validate(proposal);
        if (!violations.isEmpty()) {
            log.error("Action proposal validation failed: runId={}, violations={}", context.getRunId(), violations);
            return ActionProposal.safeDefault();
        }
        return proposal;
    }

    @Override
    public void contribute(AgentContext context, ActionProposal data) {
        context.setProposal(data);
    }
}
