package world.willfrog.sentinel.triage.workflow;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.sentinel.common.dto.ResponseCode;
import world.willfrog.sentinel.triage.config.TriageProperties;
import world.willfrog.sentinel.triage.context.AgentContext;
import world.willfrog.sentinel.triage.entity.TriageRun;
import world.willfrog.sentinel.triage.exception.BizException;
import world.willfrog.sentinel.triage.mapper.AlertMapper;
import world.willfrog.sentinel.triage.model.ActionProposal;
import world.willfrog.sentinel.triage.model.AgentStep;
import world.willfrog.sentinel.triage.model.ComplianceVerdict;
import world.willfrog.sentinel.triage.model.DecisionOutcome;
import world.willfrog.sentinel.triage.model.KnowledgeRef;
import world.willfrog.sentinel.triage.model.RecommendedAction;
import world.willfrog.sentinel.triage.model.RedactionReport;
import world.willfrog.sentinel.triage.model.RiskAssessment;
import world.willfrog.sentinel.triage.model.RiskLevel;
import world.willfrog.sentinel.triage.model.SpendInsights;
import world.willfrog.sentinel.triage.model.TriageEvent;
import world.willfrog.sentinel.triage.model.TriageResult;
import world.willfrog.sentinel.triage.resilience.ResilientToolExecutor;
import world.willfrog.sentinel.triage.resilience.ToolCircuitBreaker;
import world.willfrog.sentinel.triage.service.TriageMetrics;
import world.willfrog.sentinel.triage.service.TriageRunService;
import world.willfrog.sentinel.triage.stream.TriageEventSink;
import world.willfrog.sentinel.triage.support.MutableClock;
import world.willfrog.sentinel.triage.support.StubTool;
import world.willfrog.sentinel.triage.support.TriageFixtures;
import world.willfrog.sentinel.triage.tool.ProposeActionTool;
import world.willfrog.sentinel.triage.tool.ToolRegistry;
import world.willfrog.sentinel.triage.tool.TriageTool;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TriageOrchestratorTest {

    private static final String RUN_ID = "run_1";
    private static final String ALERT_ID = "alert_1";

    @Mock
    private AlertMapper alertMapper;
    @Mock
    private TriageRunService runService;

    private ExecutorService toolPool;
    private SimpleMeterRegistry meterRegistry;
    private TriageMetrics metrics;
    private TriageProperties properties;
    private MutableClock clock;
    private List<TriageEvent> events;

    @BeforeEach
    void setUp() {
        toolPool = Executors.newFixedThreadPool(4);
        meterRegistry = new SimpleMeterRegistry();
        metrics = new TriageMetrics(meterRegistry);
        properties = TriageFixtures.fastProperties();
        clock = new MutableClock(1_700_000_000_000L);
        events = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        toolPool.shutdownNow();
    }

    @Test
    void executeTriage_shouldRunPlanAndEmitEventsInOrder() {
        givenAlertAndRun();

        TriageResult result = orchestrator(defaultTools()).executeTriage(ALERT_ID, events::add);

        assertEquals(RUN_ID, result.getRunId());
        assertEquals(RiskLevel.HIGH, result.getRisk());
        assertEquals(RecommendedAction.FREEZE_CARD, result.getRecommendedAction());
        assertFalse(result.isFallbackUsed());
        assertThat(result.getReasons()).containsExactly("High velocity: 12 transactions in 24h", "KB refs: Card freeze");
        assertThat(result.getSteps()).extracting(AgentStep::step)
                .containsExactly("dataAccess", "riskSignals", "kbLookup", "decide", "proposeAction");

        assertThat(events).extracting(TriageEvent::type).containsExactly(
                TriageEvent.PLAN_BUILT,
                TriageEvent.TOOL_UPDATE, TriageEvent.TOOL_UPDATE,
                TriageEvent.TOOL_UPDATE, TriageEvent.TOOL_UPDATE,
                TriageEvent.TOOL_UPDATE, TriageEvent.TOOL_UPDATE,
                TriageEvent.TOOL_UPDATE, TriageEvent.TOOL_UPDATE,
                TriageEvent.TOOL_UPDATE, TriageEvent.TOOL_UPDATE,
                TriageEvent.DECISION_FINALIZED,
                TriageEvent.COMPLETED);
        assertEquals("running", events.get(1).payload().get("status"));
        assertEquals("completed", events.get(2).payload().get("status"));
        assertEquals(RUN_ID, events.get(0).payload().get("runId"));

        for (int seq = 1; seq <= 5; seq++) {
            verify(runService).appendTrace(eq(RUN_ID), eq(seq), any(AgentStep.class));
        }
        verify(runService).finalizeRun(eq(RUN_ID), eq(RiskLevel.HIGH), anyList(),
                eq(RecommendedAction.FREEZE_CARD), eq(false), anyLong());
    }

    @Test
    void executeTriage_shouldApplyRiskFallbackWhenSignalsFail() {
        givenAlertAndRun();
        List<TriageTool<?>> tools = defaultTools();
        tools.set(1, new StubTool<RiskAssessment>(
                "riskSignals",
                ctx -> {
                    throw new IllegalStateException("signals down");
                },
                AgentContext::setRiskAssessment,
                RiskAssessment.fallback()));
        tools.set(4, new ProposeActionTool(Validation.buildDefaultValidatorFactory().getValidator()));

        TriageResult result = orchestrator(tools).executeTriage(ALERT_ID, events::add);

        assertEquals(RiskLevel.MEDIUM, result.getRisk());
        assertEquals(RecommendedAction.FREEZE_CARD, result.getRecommendedAction());
        assertTrue(result.isFallbackUsed());
        assertThat(result.getReasons()).contains(RiskAssessment.FALLBACK_REASON);

        AgentStep failed = result.getSteps().get(1);
        assertFalse(failed.ok());
        assertTrue(failed.fallbackUsed());
        assertEquals(Map.of("error", "signals down"), failed.detail());
        assertEquals(3, ((StubTool<?>) tools.get(1)).invocations());

        assertThat(events).filteredOn(e -> TriageEvent.FALLBACK_TRIGGERED.equals(e.type()))
                .singleElement()
                .satisfies(e -> assertEquals("riskSignals", e.payload().get("step")));
        assertEquals(1.0, meterRegistry.get(TriageMetrics.AGENT_FALLBACK_TOTAL).tag("tool", "riskSignals").counter().count());
        verify(runService).appendTrace(eq(RUN_ID), eq(2), argThat(step -> !step.ok()));
    }

    @Test
    void executeTriage_shouldFallBackWhenToolThrowsError() {
        givenAlertAndRun();
        List<TriageTool<?>> tools = defaultTools();
        tools.set(1, new StubTool<RiskAssessment>(
                "riskSignals",
                ctx -> {
                    throw new AssertionError("scorer crashed");
                },
                AgentContext::setRiskAssessment,
                RiskAssessment.fallback()));

        TriageResult result = orchestrator(tools).executeTriage(ALERT_ID, events::add);

        assertEquals(RiskLevel.MEDIUM, result.getRisk());
        assertTrue(result.isFallbackUsed());
        assertEquals(Map.of("error", "scorer crashed"), result.getSteps().get(1).detail());
        assertEquals(TriageEvent.COMPLETED, events.get(events.size() - 1).type());
    }

    @Test
    void executeTriage_shouldContinueWhenFallbackMergeFails() {
        givenAlertAndRun();
        properties.getFlow().setPlan(List.of("riskSignals", "decide"));
        List<TriageTool<?>> tools = List.of(
                new StubTool<RiskAssessment>("riskSignals",
                        ctx -> {
                            throw new IllegalStateException("signals down");
                        },
                        (ctx, v) -> {
                            throw new IllegalStateException("merge failed");
                        },
                        RiskAssessment.fallback()),
                StubTool.returning("decide", "decision"));

        TriageResult result = orchestrator(tools).executeTriage(ALERT_ID, events::add);

        assertThat(result.getSteps()).extracting(AgentStep::ok).containsExactly(false, true);
        assertEquals(Map.of("error", "signals down"), result.getSteps().get(0).detail());
        assertEquals(RiskLevel.MEDIUM, result.getRisk());
        assertThat(result.getReasons()).containsExactly(RiskAssessment.FALLBACK_REASON);
        assertThat(events).filteredOn(e -> TriageEvent.FALLBACK_TRIGGERED.equals(e.type())).hasSize(1);
        verify(runService, never()).markFailed(anyString(), anyString(), anyLong());
    }

    @Test
    void executeTriage_shouldShareOpenCircuitAcrossRuns() {
        givenAlertAndRun();
        properties.getFlow().setPlan(List.of("riskSignals"));
        properties.getTool().getCircuit().setFailureThreshold(1);
        StubTool<RiskAssessment> signals = new StubTool<>("riskSignals",
                ctx -> {
                    throw new IllegalStateException("signals down");
                },
                AgentContext::setRiskAssessment,
                RiskAssessment.fallback());
        ResilientToolExecutor shared = toolExecutor();

        TriageResult first = orchestrator(List.of(signals), shared).executeTriage(ALERT_ID, TriageEventSink.NOOP);
        int invocationsAfterFirst = signals.invocations();
        TriageResult second = orchestrator(List.of(signals), shared).executeTriage(ALERT_ID, TriageEventSink.NOOP);

        assertEquals(3, invocationsAfterFirst);
        assertEquals(Map.of("error", "signals down"), first.getSteps().get(0).detail());
        assertEquals(invocationsAfterFirst, signals.invocations());
        assertEquals(Map.of("error", "Circuit breaker open for riskSignals"), second.getSteps().get(0).detail());
        assertEquals(RecommendedAction.FREEZE_CARD, second.getRecommendedAction());
    }

    @Test
    void executeTriage_shouldSkipUnregisteredStepWithoutTrace() {
        givenAlertAndRun();
        properties.getFlow().setPlan(List.of("dataAccess", "ghost", "decide"));

        TriageResult result = orchestrator(defaultTools()).executeTriage(ALERT_ID, events::add);

        assertThat(result.getSteps()).extracting(AgentStep::step).containsExactly("dataAccess", "decide");
        assertThat(result.getPlan()).containsExactly("dataAccess", "ghost", "decide");
        verify(runService, times(2)).appendTrace(eq(RUN_ID), anyInt(), any(AgentStep.class));
        verify(runService).appendTrace(eq(RUN_ID), eq(2), argThat(step -> "decide".equals(step.step())));
        assertEquals(RecommendedAction.CONTACT_CUSTOMER, result.getRecommendedAction());
    }

    @Test
    void executeTriage_shouldStopWhenBudgetExhausted() {
        givenAlertAndRun();
        properties.getFlow().setBudgetMs(5_000);
        List<TriageTool<?>> tools = defaultTools();
        tools.set(0, new StubTool<String>("dataAccess", ctx -> {
            clock.advance(Duration.ofSeconds(6));
            return "snapshot";
        }, (ctx, v) -> {
        }));

        TriageResult result = orchestrator(tools).executeTriage(ALERT_ID, events::add);

        assertEquals(1, result.getSteps().size());
        assertEquals(RiskLevel.MEDIUM, result.getRisk());
        assertEquals(RecommendedAction.CONTACT_CUSTOMER, result.getRecommendedAction());
        assertThat(result.getReasons()).containsExactly(RiskAssessment.FALLBACK_REASON);
        assertTrue(result.getLatencyMs() >= 6_000);
        verify(runService, times(1)).appendTrace(eq(RUN_ID), anyInt(), any(AgentStep.class));
        assertEquals(TriageEvent.COMPLETED, events.get(events.size() - 1).type());
    }

    @Test
    void executeTriage_shouldRecordFailedStepWhenMergeThrows() {
        givenAlertAndRun();
        properties.getFlow().setPlan(List.of("kbLookup", "decide"));
        List<TriageTool<?>> tools = List.of(
                new StubTool<String>("kbLookup", ctx -> "refs", (ctx, v) -> {
                    throw new IllegalStateException("merge failed");
                }),
                StubTool.returning("decide", "decision"));

        TriageResult result = orchestrator(tools).executeTriage(ALERT_ID, events::add);

        assertTrue(result.isFallbackUsed());
        AgentStep step = result.getSteps().get(0);
        assertFalse(step.ok());
        assertEquals(Map.of("error", "merge failed"), step.detail());
        assertTrue(result.getSteps().get(1).ok());
        assertThat(events).extracting(TriageEvent::type).contains(TriageEvent.FALLBACK_TRIGGERED);
    }

    @Test
    void executeTriage_shouldCompleteWhenSinkFails() {
        givenAlertAndRun();
        TriageEventSink broken = event -> {
            throw new IllegalStateException("client gone");
        };

        TriageResult result = orchestrator(defaultTools()).executeTriage(ALERT_ID, broken);

        assertEquals(RiskLevel.HIGH, result.getRisk());
        verify(runService).finalizeRun(eq(RUN_ID), any(), anyList(), any(), anyBoolean(), anyLong());
    }

    @Test
    void beginRun_shouldRejectMissingAlert() {
        when(alertMapper.findAggregateById("missing")).thenReturn(null);

        BizException ex = assertThrows(BizException.class,
                () -> orchestrator(defaultTools()).beginRun("missing"));

        assertEquals(ResponseCode.DATA_NOT_FOUND, ex.getCode());
        verify(runService, never()).createRun(anyString());
    }

    @Test
    void executeRun_shouldMarkRunFailedWhenFinalizeFails() {
        givenAlertAndRun();
        doThrow(new IllegalStateException("db down")).when(runService)
                .finalizeRun(anyString(), any(), anyList(), any(), anyBoolean(), anyLong());
        TriageOrchestrator orchestrator = orchestrator(defaultTools());
        TriageRunHandle handle = orchestrator.beginRun(ALERT_ID);

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> orchestrator.executeRun(handle, events::add));

        assertEquals("db down", ex.getMessage());
        verify(runService).markFailed(eq(RUN_ID), eq("db down"), anyLong());
        assertThat(events).extracting(TriageEvent::type).doesNotContain(TriageEvent.COMPLETED);
    }

    @Test
    void executeRun_shouldMarkRunFailedWhenErrorEscapes() {
        givenAlertAndRun();
        doThrow(new AssertionError("boom")).when(runService)
                .finalizeRun(anyString(), any(), anyList(), any(), anyBoolean(), anyLong());
        TriageOrchestrator orchestrator = orchestrator(defaultTools());
        TriageRunHandle handle = orchestrator.beginRun(ALERT_ID);

        assertThrows(AssertionError.class, () -> orchestrator.executeRun(handle, events::add));

        verify(runService).markFailed(eq(RUN_ID), eq("boom"), anyLong());
    }

    @Test
    void executeTriage_shouldAppendContextReasons() {
        givenAlertAndRun();
        properties.getFlow().setPlan(List.of("riskSignals", "compliance", "kbLookup", "insights", "redactor"));
        List<TriageTool<?>> tools = defaultTools();
        tools.add(new StubTool<ComplianceVerdict>("compliance",
                ctx -> ComplianceVerdict.builder().requiresOtp(true).build(),
                AgentContext::setComplianceVerdict));
        tools.add(new StubTool<SpendInsights>("insights",
                ctx -> SpendInsights.builder().spendPattern(SpendInsights.PATTERN_VARIABLE).build(),
                AgentContext::setSpendInsights));
        tools.add(new StubTool<RedactionReport>("redactor",
                ctx -> RedactionReport.builder().piiFound(true).build(),
                AgentContext::setRedaction));

        TriageResult result = orchestrator(tools).executeTriage(ALERT_ID, TriageEventSink.NOOP);

        assertThat(result.getReasons()).containsExactly(
                "High velocity: 12 transactions in 24h",
                TriageOrchestrator.OTP_REASON,
                "KB refs: Card freeze",
                "Spend pattern: variable",
                TriageOrchestrator.PII_REASON);
        assertEquals(RecommendedAction.FREEZE_CARD, result.getRecommendedAction());
    }

    @Test
    void resolveAction_shouldPreferProposalThenAssessment() {
        ActionProposal proposal = ActionProposal.builder().action(RecommendedAction.OPEN_DISPUTE).build();
        RiskAssessment assessment = RiskAssessment.fallback();

        assertSame(RecommendedAction.OPEN_DISPUTE, TriageOrchestrator.resolveAction(proposal, assessment));
        assertSame(RecommendedAction.FREEZE_CARD, TriageOrchestrator.resolveAction(null, assessment));
        assertSame(RecommendedAction.CONTACT_CUSTOMER, TriageOrchestrator.resolveAction(new ActionProposal(), null));
    }

    private void givenAlertAndRun() {
        when(alertMapper.findAggregateById(ALERT_ID)).thenReturn(TriageFixtures.alert(ALERT_ID, "cust_1", "high"));
        TriageRun run = new TriageRun();
        run.setId(RUN_ID);
        run.setAlertId(ALERT_ID);
        when(runService.createRun(ALERT_ID)).thenReturn(run);
    }

    private TriageOrchestrator orchestrator(List<TriageTool<?>> tools) {
        return orchestrator(tools, toolExecutor());
    }

    private TriageOrchestrator orchestrator(List<TriageTool<?>> tools, ResilientToolExecutor executor) {
        return new TriageOrchestrator(alertMapper, runService, new ToolRegistry(tools), executor, metrics, properties, clock);
    }

    private ResilientToolExecutor toolExecutor() {
        ToolCircuitBreaker breaker = new ToolCircuitBreaker(properties, Clock.systemUTC());
        return new ResilientToolExecutor(breaker, toolPool, metrics, properties, Clock.systemUTC());
    }

    private static List<TriageTool<?>> defaultTools() {
        List<TriageTool<?>> tools = new ArrayList<>();
        tools.add(StubTool.returning("dataAccess", "snapshot"));
        tools.add(new StubTool<RiskAssessment>("riskSignals",
                ctx -> RiskAssessment.builder()
                        .risk(RiskLevel.HIGH)
                        .reasons(List.of("High velocity: 12 transactions in 24h"))
                        .action(RecommendedAction.FREEZE_CARD)
                        .build(),
                AgentContext::setRiskAssessment,
                RiskAssessment.fallback()));
        tools.add(new StubTool<List<KnowledgeRef>>("kbLookup",
                ctx -> List.of(KnowledgeRef.builder().docId("kb_1").title("Card freeze").anchor("#freeze").build()),
                AgentContext::setKnowledgeRefs));
        tools.add(new StubTool<DecisionOutcome>("decide",
                ctx -> DecisionOutcome.builder().recommendedAction(RecommendedAction.FREEZE_CARD).confidence(0.85).build(),
                AgentContext::setDecision));
        tools.add(new StubTool<ActionProposal>("proposeAction",
                ctx -> ActionProposal.builder()
                        .action(ctx.getRiskAssessment() == null ? null : ctx.getRiskAssessment().getAction())
                        .confidence(0.75)
                        .build(),
                AgentContext::setProposal));
        return tools;
    }
}
