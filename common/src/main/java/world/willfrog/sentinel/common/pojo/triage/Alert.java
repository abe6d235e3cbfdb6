package world.willfrog.sentinel.common.pojo.triage;

import lombok.Data;

import java.time.OffsetDateTime;

/**
 * 风控告警。查询聚合时会同时带出关联的客户与交易。
 */
@Data
public class Alert {
    private String id;
    private String customerId;
    private String suspectTxnId;
    private String severity;
    private String status;
    private String description;
    private Integer riskScore;
    private OffsetDateTime createdAt;

    private Customer customer;
    private Transaction transaction;
}
