package com.stockfusion.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-category sub-scores of one stock plus the weighted contributions of ungrouped
 * factors. {@link #total()} is the sum of both, summed in a fixed order.
 */
public final class ScoreBreakdown {
    private static final String NO_POSITIVE_CATEGORY = "overall performance average";

    public final String stockId;
    private final Map<String, CategoryScore> categories;
    private final Map<String, Double> residualContributions;

    public ScoreBreakdown(
            String stockId,
            Map<String, CategoryScore> categories,
            Map<String, Double> residualContributions
    ) {
        this.stockId = stockId;
        this.categories = categories == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(categories));
        this.residualContributions = residualContributions == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(residualContributions));
    }

    public ScoreBreakdown withResidual(Map<String, Double> residual) {
        return new ScoreBreakdown(stockId, categories, residual);
    }

    public Map<String, CategoryScore> categories() {
        return categories;
    }

    public CategoryScore category(String name) {
        return categories.get(name);
    }

    public Map<String, Double> residualContributions() {
        return residualContributions;
    }

    public double categoryTotal() {
        double sum = 0.0;
        for (CategoryScore score : categories.values()) {
            sum += score.subScore;
        }
        return sum;
    }

    public double residualTotal() {
        double sum = 0.0;
        for (double contribution : residualContributions.values()) {
            sum += contribution;
        }
        return sum;
    }

    public double total() {
        return categoryTotal() + residualTotal();
    }

    /**
     * Rationale of every category with a positive sub-score, joined with "; ".
     */
    public String summaryRationale() {
        List<String> parts = new ArrayList<>();
        for (CategoryScore score : categories.values()) {
            if (score.subScore > 0.0 && score.hasContributors()) {
                parts.add(score.rationale());
            }
        }
        return parts.isEmpty() ? NO_POSITIVE_CATEGORY : String.join("; ", parts);
    }
}
