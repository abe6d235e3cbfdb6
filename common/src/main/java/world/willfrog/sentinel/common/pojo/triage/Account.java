package world.willfrog.sentinel.common.pojo.triage;

import lombok.Data;

import java.time.OffsetDateTime;

@Data
public class Account {
    private String id;
    private String customerId;
    private Long balanceCents;
    private String currency;
    private OffsetDateTime createdAt;
}
