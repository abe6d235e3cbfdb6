package world.willfrog.sentinel.triage.tool;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.sentinel.triage.context.AgentContext;
import world.willfrog.sentinel.triage.model.CustomerSummary;
import world.willfrog.sentinel.triage.model.RiskAssessment;
import world.willfrog.sentinel.triage.model.RiskLevel;

import java.util.List;
import java.util.Set;

/**
 * 按风险等级套用模板生成客户话术与内部备注。模板结果校验不通过时退回通用话术。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SummarizerTool implements TriageTool<CustomerSummary> {

    public static final String NAME = "summarizer";

    private final Validator validator;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CustomerSummary run(AgentContext context) {
        RiskAssessment assessment = context.getRiskAssessment();
        RiskLevel risk = assessment == null || assessment.getRisk() == null ? RiskLevel.MEDIUM : assessment.getRisk();
        List<String> reasons = assessment == null || assessment.getReasons() == null ? List.of() : assessment.getReasons();

        CustomerSummary summary = template(risk, String.join("; ", reasons));
        Set<ConstraintViolation<CustomerSummary>> violations = validator.validate(summary);
        if (!violations.isEmpty()) {
            log.warn("Summary template rejected, using generic message: runId={}, violations={}", context.getRunId(), violations.size());
            return CustomerSummary.builder()
                    .customerMessage("We detected unusual activity on your account and are reviewing it for your protection.")
                    .internalNote("Triage completed with " + risk.wireName() + " risk. Schema validation failed, using fallback message.")
                    .tone("standard")
                    .build();
        }
        return summary;
    }

    @Override
    public void contribute(AgentContext context, CustomerSummary data) {
        context.setSummary(data);
    }

    static CustomerSummary template(RiskLevel risk, String reasonText) {
        return switch (risk) {
            case HIGH -> CustomerSummary.builder()
                    .customerMessage("We detected suspicious activity on your account and have temporarily frozen your card "
                            + "for your protection. Please contact us immediately at 1-800-SENTINEL.")
                    .internalNote("HIGH RISK ALERT: " + reasonText + ". Card freeze recommended. Immediate customer contact required.")
                    .tone("urgent")
                    .build();
            case MEDIUM -> CustomerSummary.builder()
                    .customerMessage("We noticed some unusual activity on your account. Please review your recent transactions "
                            + "and contact us if you see anything unfamiliar.")
                    .internalNote("MEDIUM RISK: " + reasonText + ". Customer verification recommended. Monitor for additional signals.")
                    .tone("standard")
                    .build();
            case LOW -> CustomerSummary.builder()
                    .customerMessage("We completed a routine security review of your account. No action is needed from you at this time.")
                    .internalNote("LOW RISK: " + reasonText + ". Routine review completed. No immediate action required.")
                    .tone("reassuring")
                    .build();
        };
    }
}
