package com.stockfusion.model;

import java.util.ArrayList;
import java.util.List;

public final class CategoryScore {
    public final String category;
    public final double subScore;
    public final List<String> contributingFactors;
    public final String headline;
    public final List<RationaleItem> items;

    public CategoryScore(
            String category,
            double subScore,
            List<String> contributingFactors,
            String headline,
            List<RationaleItem> items
    ) {
        this.category = category;
        this.subScore = subScore;
        this.contributingFactors = contributingFactors == null ? List.of() : List.copyOf(contributingFactors);
        this.headline = headline == null ? "" : headline;
        this.items = items == null ? List.of() : List.copyOf(items);
    }

    public static CategoryScore empty(String category) {
        return new CategoryScore(category, 0.0, List.of(), "", List.of());
    }

    public boolean hasContributors() {
        return !contributingFactors.isEmpty();
    }

    /**
     * Renders e.g. {@code "momentum good (RSI overbought, momentum_5d strong uptrend)"};
     * empty when no factor contributed.
     */
    public String rationale() {
        if (!hasContributors()) {
            return "";
        }
        if (items.isEmpty()) {
            return headline;
        }
        List<String> messages = new ArrayList<>(items.size());
        for (RationaleItem item : items) {
            messages.add(item.message);
        }
        return headline + " (" + String.join(", ", messages) + ")";
    }
}
