package world.willfrog.sentinel.triage.context;

import lombok.Getter;
import lombok.Setter;
import world.willfrog.sentinel.common.pojo.triage.Alert;
import world.willfrog.sentinel.common.pojo.triage.Customer;
import world.willfrog.sentinel.common.pojo.triage.Transaction;
import world.willfrog.sentinel.triage.model.ActionProposal;
import world.willfrog.sentinel.triage.model.ComplianceVerdict;
import world.willfrog.sentinel.triage.model.CustomerSummary;
import world.willfrog.sentinel.triage.model.DecisionOutcome;
import world.willfrog.sentinel.triage.model.KnowledgeRef;
import world.willfrog.sentinel.triage.model.RedactionReport;
import world.willfrog.sentinel.triage.model.RiskAssessment;
import world.willfrog.sentinel.triage.model.SpendInsights;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个分诊 run 的共享上下文。
 * <p>
 * 一个 run 只有一个实例，步骤之间由编排器写入；工具在执行期间只读，产出通过
 * {@code TriageTool#contribute} 合并回来。工具在独立线程执行，因此这里不使用 ThreadLocal。
 */
@Getter
@Setter
public class AgentContext {

    private final String runId;
    private final String alertId;
    private final String customerId;
    private final Alert alert;

    private Customer customer;
    private List<Transaction> transactions = new ArrayList<>();

    // 各步骤写入的结果槽位，未执行或失败时为 null
    private RiskAssessment riskAssessment;
    private ComplianceVerdict complianceVerdict;
    private List<KnowledgeRef> knowledgeRefs;
    private SpendInsights spendInsights;
    private RedactionReport redaction;
    private CustomerSummary summary;
    private DecisionOutcome decision;
    private ActionProposal proposal;

    public AgentContext(String runId, Alert alert) {
        this.runId = runId;
        this.alert = alert;
        this.alertId = alert.getId();
        this.customerId = alert.getCustomerId();
        this.customer = alert.getCustomer();
    }

    public void setTransactions(List<Transaction> transactions) {
        this.transactions = transactions == null ? new ArrayList<>() : new ArrayList<>(transactions);
    }
}
