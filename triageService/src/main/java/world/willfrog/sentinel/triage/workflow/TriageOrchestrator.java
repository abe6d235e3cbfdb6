package world.willfrog.sentinel.triage.workflow;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import world.willfrog.sentinel.common.dto.ResponseCode;
import world.willfrog.sentinel.common.pojo.triage.Alert;
import world.willfrog.sentinel.triage.config.TriageProperties;
import world.willfrog.sentinel.triage.context.AgentContext;
import world.willfrog.sentinel.triage.entity.TriageRun;
import world.willfrog.sentinel.triage.exception.BizException;
import world.willfrog.sentinel.triage.mapper.AlertMapper;
import world.willfrog.sentinel.triage.model.ActionProposal;
import world.willfrog.sentinel.triage.model.AgentStep;
import world.willfrog.sentinel.triage.model.KnowledgeRef;
import world.willfrog.sentinel.triage.model.RecommendedAction;
import world.willfrog.sentinel.triage.model.RiskAssessment;
import world.willfrog.sentinel.triage.model.RiskLevel;
import world.willfrog.sentinel.triage.model.ToolResult;
import world.willfrog.sentinel.triage.model.TriageEvent;
import world.willfrog.sentinel.triage.model.TriageResult;
import world.willfrog.sentinel.triage.resilience.ResilientToolExecutor;
import world.willfrog.sentinel.triage.service.TriageMetrics;
import world.willfrog.sentinel.triage.service.TriageRunService;
import world.willfrog.sentinel.triage.stream.TriageEventSink;
import world.willfrog.sentinel.triage.tool.ToolRegistry;
import world.willfrog.sentinel.triage.tool.TriageTool;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 分诊编排器：按固定计划顺序执行步骤，单步失败走降级，不影响整个 run。
 * <p>
 * 执行流程：
 * <ol>
 *   <li>加载告警聚合，不存在直接抛出（不重试）</li>
 *   <li>创建 run 记录</li>
 *   <li>推送 plan_built，然后逐步执行：解析工具、检查总预算、调用包装层、合并结果、写 trace</li>
 *   <li>汇总最终决策，落库后推送 decision_finalized 与 completed</li>
 * </ol>
 * 未注册的步骤只记日志并跳过，不写 trace；总预算耗尽后停止后续步骤，照常给出决策。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TriageOrchestrator {

    static final String OTP_REASON = "OTP verification required";
    static final String PII_REASON = "PII redacted from logs";

    private final AlertMapper alertMapper;
    private final TriageRunService runService;
    private final ToolRegistry toolRegistry;
    private final ResilientToolExecutor toolExecutor;
    private final TriageMetrics metrics;
    private final TriageProperties properties;
    private final Clock clock;

    public TriageResult executeTriage(String alertId, TriageEventSink sink) {
        return executeRun(beginRun(alertId), sink);
    }

    /**
     * 加载告警并创建 run 记录，此时还没有任何步骤执行。
     *
     * @param alertId 告警 ID
     * @return run 句柄
     * @throws BizException 告警不存在
     */
    public TriageRunHandle beginRun(String alertId) {
        Alert alert = alertMapper.findAggregateById(alertId);
        if (alert == null) {
            throw new BizException(ResponseCode.DATA_NOT_FOUND, "Alert not found");
        }
        TriageRun run = runService.createRun(alertId);
        return new TriageRunHandle(run.getId(), alert);
    }

    /**
     * 执行计划并落库最终决策。意料之外的异常会把 run 标记为 FAILED 后继续抛出。
     */
    public TriageResult executeRun(TriageRunHandle handle, TriageEventSink sink) {
        long start = clock.millis();
        try {
            return doExecute(handle, sink, start);
        } catch (RuntimeException | Error e) {
            long latencyMs = clock.millis() - start;
            log.error("Triage run failed: runId={}, alertId={}", handle.runId(), handle.alert().getId(), e);
            runService.markFailed(handle.runId(), describe(e), latencyMs);
            throw e;
        }
    }

    private TriageResult doExecute(TriageRunHandle handle, TriageEventSink sink, long start) {
        String runId = handle.runId();
        AgentContext context = new AgentContext(runId, handle.alert());
        List<String> plan = List.copyOf(properties.getFlow().getPlan());
        long budgetMs = properties.getFlow().getBudgetMs();
        List<AgentStep> steps = new ArrayList<>();
        boolean fallbackUsed = false;

        emit(sink, TriageEvent.planBuilt(runId, plan));
        log.info("Triage plan built: runId={}, alertId={}, plan={}", runId, context.getAlertId(), plan);

        for (String stepName : plan) {
            long stepStart = clock.millis();
            Optional<TriageTool<?>> tool = toolRegistry.find(stepName);
            if (tool.isEmpty()) {
                log.error("Triage tool not found: runId={}, step={}", runId, stepName);
                continue;
            }
            if (clock.millis() - start > budgetMs) {
                log.warn("Flow budget exceeded: runId={}, step={}, budgetMs={}", runId, stepName, budgetMs);
                break;
            }

            AgentStep step;
            try {
                emit(sink, TriageEvent.stepRunning(runId, stepName));
                step = runStep(tool.get(), context, sink, stepStart);
            } catch (RuntimeException e) {
                log.error("Triage step failed outside tool wrapper: runId={}, step={}", runId, stepName, e);
                step = new AgentStep(stepName, false, clock.millis() - stepStart, Map.of("error", describe(e)), true);
                metrics.recordFallback(stepName);
                emit(sink, TriageEvent.fallbackTriggered(runId, stepName, describe(e)));
                applyFallback(tool.get(), context);
            }

            steps.add(step);
            runService.appendTrace(runId, steps.size(), step);
            if (!step.ok()) {
                fallbackUsed = true;
            }
        }

        RiskAssessment assessment = context.getRiskAssessment();
        RiskLevel risk = assessment != null && assessment.getRisk() != null ? assessment.getRisk() : RiskLevel.MEDIUM;
        List<String> reasons = assessment != null && assessment.getReasons() != null
                ? new ArrayList<>(assessment.getReasons())
                : new ArrayList<>(List.of(RiskAssessment.FALLBACK_REASON));
        RecommendedAction recommendedAction = resolveAction(context.getProposal(), assessment);
        appendContextReasons(context, reasons);

        long latencyMs = clock.millis() - start;
        runService.finalizeRun(runId, risk, reasons, recommendedAction, fallbackUsed, latencyMs);

        emit(sink, TriageEvent.decisionFinalized(runId, risk, reasons, recommendedAction, latencyMs));
        log.info("Triage decision finalized: runId={}, risk={}, action={}, fallbackUsed={}, latencyMs={}",
                runId, risk.wireName(), recommendedAction.wireName(), fallbackUsed, latencyMs);
        emit(sink, TriageEvent.completed(runId));

        return TriageResult.builder()
                .runId(runId)
                .risk(risk)
                .reasons(reasons)
                .recommendedAction(recommendedAction)
                .plan(plan)
                .steps(steps)
                .fallbackUsed(fallbackUsed)
                .latencyMs(latencyMs)
                .build();
    }

    private <T> AgentStep runStep(TriageTool<T> tool, AgentContext context, TriageEventSink sink, long stepStart) {
        String runId = context.getRunId();
        ToolResult<T> result = toolExecutor.execute(tool, context);
        long durationMs = clock.millis() - stepStart;

        if (result.isOk()) {
            tool.contribute(context, result.getData());
            emit(sink, TriageEvent.stepCompleted(runId, tool.name(), durationMs));
            log.info("Triage step completed: runId={}, step={}, durationMs={}", runId, tool.name(), durationMs);
            return new AgentStep(tool.name(), true, durationMs, result.getData(), false);
        }

        metrics.recordFallback(tool.name());
        emit(sink, TriageEvent.fallbackTriggered(runId, tool.name(), result.getError()));
        log.warn("Fallback triggered: runId={}, step={}, reason={}", runId, tool.name(), result.getError());
        applyFallback(tool, context);
        return new AgentStep(tool.name(), false, durationMs, Map.of("error", result.getError()), true);
    }

    private <T> void applyFallback(TriageTool<T> tool, AgentContext context) {
        try {
            tool.fallback().ifPresent(value -> tool.contribute(context, value));
        } catch (RuntimeException e) {
            log.error("Triage fallback merge failed: runId={}, step={}", context.getRunId(), tool.name(), e);
        }
    }

    static RecommendedAction resolveAction(ActionProposal proposal, RiskAssessment assessment) {
        if (proposal != null && proposal.getAction() != null) {
            return proposal.getAction();
        }
        if (assessment != null && assessment.getAction() != null) {
            return assessment.getAction();
        }
        return RecommendedAction.CONTACT_CUSTOMER;
    }

    private static void appendContextReasons(AgentContext context, List<String> reasons) {
        if (context.getComplianceVerdict() != null && context.getComplianceVerdict().isRequiresOtp()) {
            reasons.add(OTP_REASON);
        }
        List<KnowledgeRef> refs = context.getKnowledgeRefs();
        if (refs != null && !refs.isEmpty()) {
            reasons.add("KB refs: " + refs.stream().map(KnowledgeRef::getTitle).collect(Collectors.joining(", ")));
        }
        if (context.getSpendInsights() != null) {
            reasons.add("Spend pattern: " + context.getSpendInsights().getSpendPattern());
        }
        if (context.getRedaction() != null && context.getRedaction().isPiiFound()) {
            reasons.add(PII_REASON);
        }
    }

    private void emit(TriageEventSink sink, TriageEvent event) {
        if (sink == null) {
            return;
        }
        try {
            sink.publish(event);
        } catch (RuntimeException e) {
            log.warn("Triage event delivery failed: type={}, runId={}, error={}",
                    event.type(), event.payload().get("runId"), e.getMessage());
        }
    }

    private static String describe(Throwable e) {
        return StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getSimpleName());
    }
}
