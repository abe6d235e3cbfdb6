package world.willfrog.sentinel.triage.tool;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import world.willfrog.sentinel.common.pojo.triage.Customer;
import world.willfrog.sentinel.common.pojo.triage.Transaction;
import world.willfrog.sentinel.triage.context.AgentContext;
import world.willfrog.sentinel.triage.mapper.CustomerMapper;
import world.willfrog.sentinel.triage.mapper.TransactionMapper;
import world.willfrog.sentinel.triage.model.CustomerSnapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * 拉取客户画像（卡、账户）与近 30 天交易，最多 100 条，按时间倒序。
 */
@Component
@RequiredArgsConstructor
public class DataAccessTool implements TriageTool<CustomerSnapshot> {

    public static final String NAME = "dataAccess";

    static final Duration LOOKBACK = Duration.ofDays(30);
    static final int MAX_TRANSACTIONS = 100;

    private final CustomerMapper customerMapper;
    private final TransactionMapper transactionMapper;
    private final Clock clock;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CustomerSnapshot run(AgentContext context) {
        Customer customer = customerMapper.findProfileById(context.getCustomerId());
        OffsetDateTime since = OffsetDateTime.now(clock).minus(LOOKBACK);
        List<Transaction> transactions = transactionMapper.listRecentByCustomer(context.getCustomerId(), since, MAX_TRANSACTIONS);
        return CustomerSnapshot.builder()
                .customer(customer)
                .transactions(transactions == null ? List.of() : transactions)
                .build();
    }

    @Override
    public void contribute(AgentContext context, CustomerSnapshot data) {
        if (data.getCustomer() != null) {
            context.setCustomer(data.getCustomer());
        }
        context.setTransactions(data.getTransactions());
    }
}
