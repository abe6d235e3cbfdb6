package world.willfrog.sentinel.triage.tool;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import world.willfrog.sentinel.common.pojo.triage.Alert;
import world.willfrog.sentinel.common.pojo.triage.Customer;
import world.willfrog.sentinel.triage.context.AgentContext;
import world.willfrog.sentinel.triage.model.RedactionReport;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PII 脱敏：13-19 位连续数字按卡号处理，邮箱保留首字符与域名。
 */
@Component
@RequiredArgsConstructor
public class RedactorTool implements TriageTool<RedactionReport> {

    public static final String NAME = "redactor";

    static final String PAN_MASK = "****REDACTED****";
    private static final Pattern PAN_PATTERN = Pattern.compile("\\b\\d{13,19}\\b");
    private static final Pattern EMAIL_PATTERN = Pattern.compile("([a-zA-Z0-9._%+-]+)@([a-zA-Z0-9.-]+\\.[a-zA-Z]{2,})");

    private final Clock clock;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RedactionReport run(AgentContext context) {
        Alert alert = context.getAlert();
        Customer customer = context.getCustomer();
        String customerId = context.getCustomerId();
        String email = customer == null ? null : customer.getEmail();
        String description = alert == null ? null : alert.getDescription();

        String redactedCustomerId = redactPan(customerId);
        String maskedEmail = maskEmail(email);
        boolean piiFound = !Objects.equals(redactedCustomerId, customerId)
                || !Objects.equals(maskedEmail, email)
                || !Objects.equals(redactPan(description), description);

        return RedactionReport.builder()
                .alertId(context.getAlertId())
                .customerId(redactedCustomerId)
                .customerEmail(maskedEmail)
                .redactedAt(OffsetDateTime.now(clock))
                .piiFound(piiFound)
                .panDetected(containsPan(customerId) || containsPan(description))
                .emailDetected(email != null && EMAIL_PATTERN.matcher(email).find())
                .build();
    }

    @Override
    public void contribute(AgentContext context, RedactionReport data) {
        context.setRedaction(data);
    }

    static String redactPan(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return PAN_PATTERN.matcher(text).replaceAll(PAN_MASK);
    }

    static String maskEmail(String email) {
        if (email == null || email.isEmpty()) {
            return email;
        }
        Matcher matcher = EMAIL_PATTERN.matcher(email);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String local = matcher.group(1);
            String domain = matcher.group(2);
            String masked = local.length() <= 1
                    ? local + "@" + domain
                    : local.charAt(0) + "*".repeat(Math.min(local.length() - 1, 3)) + "@" + domain;
            matcher.appendReplacement(sb, Matcher.quoteReplacement(masked));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static boolean containsPan(String text) {
        return text != null && PAN_PATTERN.matcher(text).find();
    }
}
