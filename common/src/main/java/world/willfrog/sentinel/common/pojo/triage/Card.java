package world.willfrog.sentinel.common.pojo.triage;

import lombok.Data;

import java.time.OffsetDateTime;

@Data
public class Card {
    private String id;
    private String customerId;
    private String last4;
    private String network;
    private String status;
    private OffsetDateTime createdAt;
}
