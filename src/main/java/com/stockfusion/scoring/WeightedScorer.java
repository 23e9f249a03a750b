package com.stockfusion.scoring;

import com.stockfusion.config.CategoryWeightTable;
import com.stockfusion.model.NormalizedFactorSet;
import com.stockfusion.model.ScoreBreakdown;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rule-based total score of one stock: category sub-scores plus the weighted
 * contribution of residual (ungrouped) factors. No bound; the sign is the direction.
 */
public final class WeightedScorer {
    private final CategoryScorer categoryScorer;

    public WeightedScorer(CategoryScorer categoryScorer) {
        this.categoryScorer = categoryScorer;
    }

    /**
     * Scores one normalized stock against {@code weights}: category sub-scores from the
     * {@link CategoryScorer}, then residual factors on the same contribution basis.
     */
    public ScoredStock score(NormalizedFactorSet normalized, CategoryWeightTable weights) {
        ScoreBreakdown categories = categoryScorer.scoreCategories(normalized, weights);
        ScoreBreakdown full = categories.withResidual(residualContributions(normalized, weights));
        return new ScoredStock(normalized.stockId, totalScore(full), full);
    }

    /**
     * Sum of every category sub-score plus every residual contribution.
     */
    public double totalScore(ScoreBreakdown breakdown) {
        return breakdown.total();
    }

    /**
     * Computes residual contributions for {@code residualFactors} and adds them to the
     * category sub-scores of {@code breakdown}.
     */
    public double totalScore(ScoreBreakdown breakdown, NormalizedFactorSet residualFactors, CategoryWeightTable weights) {
        return breakdown.withResidual(residualContributions(residualFactors, weights)).total();
    }

    Map<String, Double> residualContributions(NormalizedFactorSet normalized, CategoryWeightTable weights) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : weights.residual().entrySet()) {
            Double value = normalized.value(entry.getKey());
            if (value != null) {
                out.put(entry.getKey(), entry.getValue() * categoryScorer.basis().apply(value));
            }
        }
        return out;
    }
}
