package world.willfrog.sentinel.triage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpendInsights {

    public static final String PATTERN_UNKNOWN = "unknown";
    public static final String PATTERN_CONSISTENT = "consistent";
    public static final String PATTERN_VARIABLE = "variable";
    public static final String PATTERN_HIGHLY_VARIABLE = "highly_variable";

    @Builder.Default
    private List<CategoryShare> categories = new ArrayList<>();
    /** Herfindahl 指数，保留两位小数 */
    private double merchantConcentration;
    private String spendPattern;
    private long avgTransactionAmount;
    private long totalSpend;
    private int transactionCount;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CategoryShare {
        private String name;
        private int count;
        private double pct;
    }
}
