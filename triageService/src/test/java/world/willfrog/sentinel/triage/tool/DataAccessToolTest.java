package world.willfrog.sentinel.triage.tool;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.sentinel.common.pojo.triage.Customer;
import world.willfrog.sentinel.common.pojo.triage.Transaction;
import world.willfrog.sentinel.triage.context.AgentContext;
import world.willfrog.sentinel.triage.mapper.CustomerMapper;
import world.willfrog.sentinel.triage.mapper.TransactionMapper;
import world.willfrog.sentinel.triage.model.CustomerSnapshot;
import world.willfrog.sentinel.triage.support.MutableClock;
import world.willfrog.sentinel.triage.support.TriageFixtures;

import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DataAccessToolTest {

    @Mock
    private CustomerMapper customerMapper;
    @Mock
    private TransactionMapper transactionMapper;

    private MutableClock clock;
    private DataAccessTool tool;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        tool = new DataAccessTool(customerMapper, transactionMapper, clock);
    }

    @Test
    void run_shouldLoadProfileAndThirtyDaysOfTransactions() {
        Customer customer = TriageFixtures.customer("cust_1", "full", "jane@example.com");
        Transaction txn = TriageFixtures.txn("t1", OffsetDateTime.now(clock), "5411", "Grocer", 1_000, "dev-1");
        OffsetDateTime since = OffsetDateTime.now(clock).minusDays(30);
        when(customerMapper.findProfileById("cust_1")).thenReturn(customer);
        when(transactionMapper.listRecentByCustomer("cust_1", since, 100)).thenReturn(List.of(txn));

        CustomerSnapshot snapshot = tool.run(context());

        assertSame(customer, snapshot.getCustomer());
        assertEquals(1, snapshot.getTransactions().size());
        verify(transactionMapper).listRecentByCustomer(eq("cust_1"), eq(since), eq(DataAccessTool.MAX_TRANSACTIONS));
    }

    @Test
    void run_shouldTreatMissingTransactionsAsEmpty() {
        when(transactionMapper.listRecentByCustomer(eq("cust_1"), any(), anyInt())).thenReturn(null);

        CustomerSnapshot snapshot = tool.run(context());

        assertTrue(snapshot.getTransactions().isEmpty());
    }

    @Test
    void contribute_shouldKeepAlertCustomerWhenProfileMissing() {
        AgentContext context = context();
        Customer original = context.getCustomer();

        tool.contribute(context, CustomerSnapshot.builder().customer(null).build());

        assertSame(original, context.getCustomer());
        assertTrue(context.getTransactions().isEmpty());
    }

    private static AgentContext context() {
        return new AgentContext("run_1", TriageFixtures.alert("alert_1", "cust_1", "high"));
    }
}
