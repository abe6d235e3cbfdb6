package world.willfrog.sentinel.triage.tool;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.sentinel.common.pojo.triage.Customer;
import world.willfrog.sentinel.triage.context.AgentContext;
import world.willfrog.sentinel.triage.entity.Policy;
import world.willfrog.sentinel.triage.mapper.CaseMapper;
import world.willfrog.sentinel.triage.mapper.PolicyMapper;
import world.willfrog.sentinel.triage.model.ComplianceVerdict;

import java.util.ArrayList;
import java.util.List;

/**
 * 合规检查：KYC 不是 full 时敏感动作需要 OTP；进行中的调查案件会阻止冻卡。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ComplianceTool implements TriageTool<ComplianceVerdict> {

    public static final String NAME = "compliance";

    static final String FULL_KYC = "full";
    static final List<String> POLICY_CODES = List.of("freeze_card", "dispute_creation", "high_risk_action");
    static final List<String> ACTIVE_CASE_STATUSES = List.of("OPEN", "PENDING");
    static final List<String> BLOCKING_CASE_TYPES = List.of("fraud_investigation", "account_review");
    static final int POLICY_LIMIT = 10;

    private final PolicyMapper policyMapper;
    private final CaseMapper caseMapper;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ComplianceVerdict run(AgentContext context) {
        Customer customer = context.getCustomer();
        if (customer == null) {
            throw new IllegalStateException("Customer profile unavailable for compliance check");
        }
        boolean requiresOtp = !FULL_KYC.equals(customer.getKycLevel());
        List<ComplianceVerdict.PolicyRef> policies = policies();
        ComplianceVerdict.Restrictions restrictions = restrictions(customer.getId());

        return ComplianceVerdict.builder()
                .requiresOtp(requiresOtp)
                .kycLevel(customer.getKycLevel())
                .policies(policies)
                .restrictions(restrictions)
                .canFreeze(!restrictions.isFreezeBlocked())
                .canDispute(!restrictions.isDisputeBlocked())
                .complianceNotes(notes(requiresOtp, policies, restrictions))
                .build();
    }

    @Override
    public void contribute(AgentContext context, ComplianceVerdict data) {
        context.setComplianceVerdict(data);
    }

    private List<ComplianceVerdict.PolicyRef> policies() {
        List<Policy> rows;
        try {
            rows = policyMapper.listByCodes(POLICY_CODES, POLICY_LIMIT);
        } catch (RuntimeException e) {
            log.warn("Policy lookup failed, continuing without policies: error={}", e.getMessage());
            return new ArrayList<>();
        }
        List<ComplianceVerdict.PolicyRef> refs = new ArrayList<>();
        if (rows == null) {
            return refs;
        }
        for (Policy policy : rows) {
            refs.add(ComplianceVerdict.PolicyRef.builder()
                    .code(policy.getCode())
                    .title(policy.getTitle())
                    .requiresApproval(Boolean.TRUE.equals(policy.getRequiresApproval()))
                    .build());
        }
        return refs;
    }

    private ComplianceVerdict.Restrictions restrictions(String customerId) {
        long activeCases;
        try {
            activeCases = caseMapper.countActive(customerId, ACTIVE_CASE_STATUSES, BLOCKING_CASE_TYPES);
        } catch (RuntimeException e) {
            log.warn("Active case lookup failed, assuming no restrictions: customerId={}, error={}", customerId, e.getMessage());
            return ComplianceVerdict.Restrictions.none();
        }
        return ComplianceVerdict.Restrictions.builder()
                .freezeBlocked(activeCases > 0)
                .disputeBlocked(false)
                .hasActiveCases(activeCases > 0)
                .caseCount(activeCases)
                .build();
    }

    private static List<String> notes(boolean requiresOtp,
                                      List<ComplianceVerdict.PolicyRef> policies,
                                      ComplianceVerdict.Restrictions restrictions) {
        List<String> notes = new ArrayList<>();
        if (requiresOtp) {
            notes.add("OTP verification required for sensitive actions");
        }
        if (!policies.isEmpty()) {
            notes.add(policies.size() + " active compliance policies");
        }
        if (restrictions.isHasActiveCases()) {
            notes.add(restrictions.getCaseCount() + " active investigation(s)");
        }
        if (restrictions.isFreezeBlocked()) {
            notes.add("Card freeze restricted due to active investigation");
        }
        return notes;
    }
}
