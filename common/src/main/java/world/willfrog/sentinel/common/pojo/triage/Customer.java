package world.willfrog.sentinel.common.pojo.triage;

import lombok.Data;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
public class Customer {
    private String id;
    private String name;
    private String email;
    private String kycLevel;
    private OffsetDateTime createdAt;

    private List<Card> cards = new ArrayList<>();
    private List<Account> accounts = new ArrayList<>();
}
