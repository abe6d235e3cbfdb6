package world.willfrog.sentinel.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RedactionReport {
    private String alertId;
    private String customerId;
    private String customerEmail;
    private OffsetDateTime redactedAt;
    private boolean piiFound;
    private boolean panDetected;
    private boolean emailDetected;
}
