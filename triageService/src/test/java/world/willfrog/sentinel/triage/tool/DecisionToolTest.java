package world.willfrog.sentinel.triage.tool;

import org.junit.jupiter.api.Test;
import world.willfrog.sentinel.triage.context.AgentContext;
import world.willfrog.sentinel.triage.model.DecisionOutcome;
import world.willfrog.sentinel.triage.model.RecommendedAction;
import world.willfrog.sentinel.triage.model.RiskAssessment;
import world.willfrog.sentinel.triage.support.TriageFixtures;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class DecisionToolTest {

    private final DecisionTool tool = new DecisionTool();

    @Test
    void run_shouldFollowRiskAssessmentAction() {
        AgentContext context = new AgentContext("run_1", TriageFixtures.alert("alert_1", "cust_1", "high"));
        context.setRiskAssessment(RiskAssessment.fallback());

        DecisionOutcome outcome = tool.run(context);

        assertEquals(RecommendedAction.FREEZE_CARD, outcome.getRecommendedAction());
        assertEquals(0.85, outcome.getConfidence());

        tool.contribute(context, outcome);
        assertSame(outcome, context.getDecision());
    }

    @Test
    void run_shouldDefaultToFalsePositiveWithoutAssessment() {
        AgentContext context = new AgentContext("run_1", TriageFixtures.alert("alert_1", "cust_1", "low"));

        assertEquals(RecommendedAction.MARK_FALSE_POSITIVE, tool.run(context).getRecommendedAction());
    }
}
