package world.willfrog.sentinel.common.pojo.triage;

import lombok.Data;

import java.time.OffsetDateTime;

@Data
public class Transaction {
    private String id;
    private String customerId;
    private String cardId;
    private String mcc;
    private String merchant;
    private Long amountCents;
    private String currency;
    private String deviceId;
    private String country;
    private String city;
    private OffsetDateTime ts;
}
