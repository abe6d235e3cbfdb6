package world.willfrog.sentinel.triage.tool;

import org.springframework.stereotype.Component;
import world.willfrog.sentinel.common.pojo.triage.Transaction;
import world.willfrog.sentinel.triage.context.AgentContext;
import world.willfrog.sentinel.triage.model.SpendInsights;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 消费画像：MCC 类别分布、商户集中度（Herfindahl）与金额波动（变异系数）。
 */
@Component
public class InsightsTool implements TriageTool<SpendInsights> {

    public static final String NAME = "insights";

    static final int TOP_CATEGORIES = 5;

    private static final Map<String, String> MCC_CATEGORIES = Map.of(
            "4111", "Transport",
            "5411", "Retail",
            "5812", "Food & Dining",
            "7011", "Services",
            "8011", "Healthcare",
            "4900", "Utilities");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SpendInsights run(AgentContext context) {
        List<Transaction> transactions = context.getTransactions();
        if (transactions == null || transactions.isEmpty()) {
            return SpendInsights.builder()
                    .spendPattern(SpendInsights.PATTERN_UNKNOWN)
                    .build();
        }

        Map<String, Integer> mccCounts = new LinkedHashMap<>();
        Map<String, Long> merchantSpend = new LinkedHashMap<>();
        long totalSpend = 0L;
        for (Transaction txn : transactions) {
            String mcc = txn.getMcc() == null ? "unknown" : txn.getMcc();
            String merchant = txn.getMerchant() == null ? "unknown" : txn.getMerchant();
            long amount = absAmount(txn);
            mccCounts.merge(mcc, 1, Integer::sum);
            merchantSpend.merge(merchant, amount, Long::sum);
            totalSpend += amount;
        }

        int count = transactions.size();
        List<SpendInsights.CategoryShare> categories = new ArrayList<>();
        mccCounts.forEach((mcc, n) -> categories.add(
                new SpendInsights.CategoryShare(categoryName(mcc), n, n * 100.0 / count)));
        categories.sort(Comparator.comparingInt(SpendInsights.CategoryShare::getCount).reversed());

        double concentration = 0.0;
        if (totalSpend > 0) {
            for (long amount : merchantSpend.values()) {
                double share = (double) amount / totalSpend;
                concentration += share * share;
            }
        }

        double avg = (double) totalSpend / count;
        double variance = 0.0;
        for (Transaction txn : transactions) {
            double diff = absAmount(txn) - avg;
            variance += diff * diff;
        }
        variance /= count;
        double cv = avg == 0.0 ? 0.0 : Math.sqrt(variance) / avg;

        return SpendInsights.builder()
                .categories(new ArrayList<>(categories.subList(0, Math.min(TOP_CATEGORIES, categories.size()))))
                .merchantConcentration(Math.round(concentration * 100) / 100.0)
                .spendPattern(pattern(cv))
                .avgTransactionAmount(Math.round(avg))
                .totalSpend(totalSpend)
                .transactionCount(count)
                .build();
    }

    @Override
    public void contribute(AgentContext context, SpendInsights data) {
        context.setSpendInsights(data);
    }

    static String pattern(double coefficientOfVariation) {
        if (coefficientOfVariation < 0.3) {
            return SpendInsights.PATTERN_CONSISTENT;
        }
        if (coefficientOfVariation < 0.7) {
            return SpendInsights.PATTERN_VARIABLE;
        }
        return SpendInsights.PATTERN_HIGHLY_VARIABLE;
    }

    static String categoryName(String mcc) {
        return MCC_CATEGORIES.getOrDefault(mcc, mcc);
    }

    private static long absAmount(Transaction txn) {
        return txn.getAmountCents() == null ? 0L : Math.abs(txn.getAmountCents());
    }
}
