package world.willfrog.sentinel.triage.tool;

import org.springframework.stereotype.Component;
import world.willfrog.sentinel.triage.context.AgentContext;
import world.willfrog.sentinel.triage.model.DecisionOutcome;
import world.willfrog.sentinel.triage.model.RecommendedAction;
import world.willfrog.sentinel.triage.model.RiskAssessment;

@Component
public class DecisionTool implements TriageTool<DecisionOutcome> {

    public static final String NAME = "decide";

    static final double CONFIDENCE = 0.85;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public DecisionOutcome run(AgentContext context) {
        RiskAssessment assessment = context.getRiskAssessment();
        RecommendedAction action = assessment == null || assessment.getAction() == null
                ? RecommendedAction.MARK_FALSE_POSITIVE
                : assessment.getAction();
        return DecisionOutcome.builder()
                .recommendedAction(action)
                .confidence(CONFIDENCE)
                .build();
    }

    @Override
    public void contribute(AgentContext context, DecisionOutcome data) {
        context.setDecision(data);
    }
}
