package world.willfrog.sentinel.triage.tool;

import org.junit.jupiter.api.Test;
import world.willfrog.sentinel.common.pojo.triage.Alert;
import world.willfrog.sentinel.triage.context.AgentContext;
import world.willfrog.sentinel.triage.model.RedactionReport;
import world.willfrog.sentinel.triage.support.MutableClock;
import world.willfrog.sentinel.triage.support.TriageFixtures;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RedactorToolTest {

    private final MutableClock clock = new MutableClock(1_700_000_000_000L);
    private final RedactorTool tool = new RedactorTool(clock);

    @Test
    void redactPan_shouldMaskCardNumbers() {
        assertEquals("card ****REDACTED**** used", RedactorTool.redactPan("card 4111111111111111 used"));
        assertEquals("ref 123456", RedactorTool.redactPan("ref 123456"));
        assertNull(RedactorTool.redactPan(null));
    }

    @Test
    void maskEmail_shouldKeepFirstCharacterAndDomain() {
        assertEquals("j***@example.com", RedactorTool.maskEmail("john.doe@example.com"));
        assertEquals("a@b.io", RedactorTool.maskEmail("a@b.io"));
        assertEquals("not an email", RedactorTool.maskEmail("not an email"));
    }

    @Test
    void run_shouldFlagPanAndEmail() {
        Alert alert = TriageFixtures.alert("alert_1", "cust_1", "high");
        alert.setDescription("Charge on 4111111111111111 flagged");
        AgentContext context = new AgentContext("run_1", alert);
        context.setCustomer(TriageFixtures.customer("cust_1", "full", "jane@example.com"));

        RedactionReport report = tool.run(context);

        assertTrue(report.isPiiFound());
        assertTrue(report.isPanDetected());
        assertTrue(report.isEmailDetected());
        assertEquals("j***@example.com", report.getCustomerEmail());
        assertEquals("cust_1", report.getCustomerId());
        assertEquals(Instant.ofEpochMilli(1_700_000_000_000L), report.getRedactedAt().toInstant());
    }

    @Test
    void run_shouldReportNoPiiForCleanContext() {
        AgentContext context = new AgentContext("run_1", TriageFixtures.alert("alert_1", "cust_1", "low"));

        RedactionReport report = tool.run(context);

        assertFalse(report.isPiiFound());
        assertFalse(report.isPanDetected());
        assertFalse(report.isEmailDetected());
    }
}
