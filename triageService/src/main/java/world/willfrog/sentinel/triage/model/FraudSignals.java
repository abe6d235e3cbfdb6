package world.willfrog.sentinel.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FraudSignals {
    /** 24 小时内交易笔数 */
    private int velocityScore;
    private boolean deviceChange;
    /** 最近一笔交易 MCC 在窗口内的占比，越小越罕见 */
    private double mccRarity;
    private long priorChargebacks;
}
