package com.stockfusion.scoring;

import com.stockfusion.config.CategoryWeightTable;
import com.stockfusion.model.CategoryScore;
import com.stockfusion.model.FactorSet;
import com.stockfusion.model.NormalizedFactorSet;
import com.stockfusion.model.RationaleItem;
import com.stockfusion.model.ScoreBreakdown;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted sub-score and rationale per category. The sub-score only sees normalized
 * values; the rationale only sees raw values.
 */
public final class CategoryScorer {
    private static final Map<String, String[]> HEADLINES = Map.of(
            CategoryWeightTable.MOMENTUM, new String[]{"momentum good", "momentum average"},
            CategoryWeightTable.VOLUME, new String[]{"volume active", "volume flat"},
            CategoryWeightTable.CAPITAL_FLOW, new String[]{"capital flow positive", "capital flow negative"},
            CategoryWeightTable.SENTIMENT, new String[]{"sentiment optimistic", "sentiment cautious"},
            CategoryWeightTable.RISK, new String[]{"risk low", "risk elevated"},
            CategoryWeightTable.TECHNICAL, new String[]{"technicals constructive", "technicals weak"}
    );

    private final Map<String, List<RationaleRule>> rulesByFactor;
    private final ContributionBasis basis;

    public CategoryScorer() {
        this(RationaleRule.defaults(), ContributionBasis.CENTERED);
    }

    public CategoryScorer(ContributionBasis basis) {
        this(RationaleRule.defaults(), basis);
    }

    public CategoryScorer(List<RationaleRule> rules, ContributionBasis basis) {
        Map<String, List<RationaleRule>> byFactor = new LinkedHashMap<>();
        for (RationaleRule rule : rules) {
            byFactor.computeIfAbsent(rule.factor, ignored -> new ArrayList<>()).add(rule);
        }
        this.rulesByFactor = byFactor;
        this.basis = basis == null ? ContributionBasis.CENTERED : basis;
    }

    public ContributionBasis basis() {
        return basis;
    }

    /**
     * One {@link CategoryScore} per category of {@code weights}, each with its headline
     * and rule messages. Residual factors are left to {@link WeightedScorer}.
     */
    public ScoreBreakdown scoreCategories(NormalizedFactorSet normalized, CategoryWeightTable weights) {
        Map<String, CategoryScore> out = new LinkedHashMap<>();
        for (String category : weights.categories()) {
            out.put(category, scoreCategory(category, normalized, weights.members(category)));
        }
        return new ScoreBreakdown(normalized.stockId, out, Map.of());
    }

    CategoryScore scoreCategory(String category, NormalizedFactorSet normalized, Map<String, Double> members) {
        double subScore = 0.0;
        List<String> contributing = new ArrayList<>();
        for (Map.Entry<String, Double> member : members.entrySet()) {
            Double value = normalized.value(member.getKey());
            if (value == null) {
                continue;
            }
            subScore += member.getValue() * basis.apply(value);
            contributing.add(member.getKey());
        }
        if (contributing.isEmpty()) {
            return CategoryScore.empty(category);
        }
        List<RationaleItem> items = evaluateRules(category, normalized.raw(), contributing);
        return new CategoryScore(category, subScore, contributing, headline(category, subScore), items);
    }

    private List<RationaleItem> evaluateRules(String category, FactorSet raw, List<String> contributing) {
        List<RationaleItem> items = new ArrayList<>();
        for (String factor : contributing) {
            Double rawValue = raw.raw(factor);
            if (rawValue == null) {
                continue;
            }
            for (RationaleRule rule : rulesByFactor.getOrDefault(factor, List.of())) {
                if (rule.matches(rawValue)) {
                    items.add(rule.toItem(category, rawValue));
                }
            }
        }
        return items;
    }

    private String headline(String category, double subScore) {
        String[] pair = HEADLINES.get(category);
        if (pair == null) {
            return category + (subScore > 0.0 ? " positive" : " negative");
        }
        return subScore > 0.0 ? pair[0] : pair[1];
    }
}
