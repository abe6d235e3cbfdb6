package world.willfrog.sentinel.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import world.willfrog.sentinel.common.pojo.triage.Customer;
import world.willfrog.sentinel.common.pojo.triage.Transaction;

import java.util.ArrayList;
import java.util.List;

/**
 * dataAccess 步骤的输出：客户画像与近 30 天交易（按时间倒序）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerSnapshot {
    private Customer customer;
    @Builder.Default
    private List<Transaction> transactions = new ArrayList<>();
}
