package world.willfrog.sentinel.triage.tool;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.sentinel.common.pojo.triage.Transaction;
import world.willfrog.sentinel.triage.context.AgentContext;
import world.willfrog.sentinel.triage.mapper.CaseMapper;
import world.willfrog.sentinel.triage.model.FraudSignals;
import world.willfrog.sentinel.triage.model.RecommendedAction;
import world.willfrog.sentinel.triage.model.RiskAssessment;
import world.willfrog.sentinel.triage.model.RiskLevel;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 欺诈信号识别：交易频率、设备变化、MCC 罕见度与历史拒付。
 * <p>
 * 判定规则：
 * <ul>
 *   <li>high：24h 交易数 &gt; 10 或存在拒付，建议冻卡</li>
 *   <li>medium：24h 交易数 &gt; 5、多设备或 MCC 罕见度 &lt; 0.1，建议冻卡</li>
 *   <li>low：其余情况，建议标记误报</li>
 * </ul>
 * 这是计划中唯一声明降级值的步骤。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RiskSignalTool implements TriageTool<RiskAssessment> {

    public static final String NAME = "riskSignals";

    static final String CHARGEBACK_CASE_TYPE = "chargeback";

    private final CaseMapper caseMapper;
    private final Clock clock;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RiskAssessment run(AgentContext context) {
        List<Transaction> transactions = context.getTransactions();
        FraudSignals signals = FraudSignals.builder()
                .velocityScore(velocity(transactions))
                .deviceChange(deviceChange(transactions))
                .mccRarity(mccRarity(transactions))
                .priorChargebacks(chargebackCount(context.getCustomerId()))
                .build();

        List<String> reasons = new ArrayList<>();
        RiskLevel risk;
        RecommendedAction action;
        if (signals.getVelocityScore() > 10 || signals.getPriorChargebacks() > 0) {
            risk = RiskLevel.HIGH;
            if (signals.getVelocityScore() > 10) {
                reasons.add("High velocity: " + signals.getVelocityScore() + " transactions in 24h");
            }
            if (signals.getPriorChargebacks() > 0) {
                reasons.add("Prior chargebacks: " + signals.getPriorChargebacks());
            }
            action = RecommendedAction.FREEZE_CARD;
        } else if (signals.getVelocityScore() > 5 || signals.isDeviceChange() || signals.getMccRarity() < 0.1) {
            risk = RiskLevel.MEDIUM;
            if (signals.getVelocityScore() > 5) {
                reasons.add("Elevated velocity: " + signals.getVelocityScore() + " transactions in 24h");
            }
            if (signals.isDeviceChange()) {
                reasons.add("Multiple devices detected");
            }
            if (signals.getMccRarity() < 0.1) {
                reasons.add("Unusual merchant category");
            }
            action = RecommendedAction.FREEZE_CARD;
        } else {
            risk = RiskLevel.LOW;
            reasons.add("No significant fraud signals detected");
            action = RecommendedAction.MARK_FALSE_POSITIVE;
        }

        return RiskAssessment.builder()
                .signals(signals)
                .risk(risk)
                .reasons(reasons)
                .action(action)
                .score(score(signals))
                .build();
    }

    @Override
    public void contribute(AgentContext context, RiskAssessment data) {
        context.setRiskAssessment(data);
    }

    @Override
    public Optional<RiskAssessment> fallback() {
        return Optional.of(RiskAssessment.fallback());
    }

    int velocity(List<Transaction> transactions) {
        if (transactions == null || transactions.isEmpty()) {
            return 0;
        }
        OffsetDateTime dayAgo = OffsetDateTime.now(clock).minus(Duration.ofDays(1));
        return (int) transactions.stream()
                .map(Transaction::getTs)
                .filter(Objects::nonNull)
                .filter(ts -> !ts.isBefore(dayAgo))
                .count();
    }

    boolean deviceChange(List<Transaction> transactions) {
        if (transactions == null || transactions.isEmpty()) {
            return false;
        }
        Set<String> devices = new HashSet<>();
        for (Transaction txn : transactions) {
            if (txn.getDeviceId() != null && !txn.getDeviceId().isEmpty()) {
                devices.add(txn.getDeviceId());
            }
        }
        return devices.size() > 1;
    }

    /**
     * 最近一笔交易的 MCC 在窗口内的占比；无交易或最近一笔无 MCC 时视为常见（1.0）。
     */
    double mccRarity(List<Transaction> transactions) {
        if (transactions == null || transactions.isEmpty()) {
            return 1.0;
        }
        Map<String, Integer> counts = new HashMap<>();
        for (Transaction txn : transactions) {
            String mcc = txn.getMcc() == null ? "unknown" : txn.getMcc();
            counts.merge(mcc, 1, Integer::sum);
        }
        String recentMcc = transactions.get(0).getMcc();
        if (recentMcc == null || recentMcc.isEmpty()) {
            return 1.0;
        }
        return (double) counts.getOrDefault(recentMcc, 0) / transactions.size();
    }

    private long chargebackCount(String customerId) {
        try {
            return caseMapper.countByCustomerAndType(customerId, CHARGEBACK_CASE_TYPE);
        } catch (RuntimeException e) {
            log.warn("Chargeback lookup failed, treating as none: customerId={}, error={}", customerId, e.getMessage());
            return 0L;
        }
    }

    static int score(FraudSignals signals) {
        double score = Math.min(signals.getVelocityScore() * 4, 40);
        if (signals.isDeviceChange()) {
            score += 20;
        }
        score += (1 - signals.getMccRarity()) * 20;
        if (signals.getPriorChargebacks() > 0) {
            score += 20;
        }
        return (int) Math.min(Math.round(score), 100);
    }
}
