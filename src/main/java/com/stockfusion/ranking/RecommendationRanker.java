package com.stockfusion.ranking;

import com.stockfusion.config.ValidityRules;
import com.stockfusion.core.diagnostics.CauseCode;
import com.stockfusion.model.FusionResult;
import com.stockfusion.model.Recommendation;
import com.stockfusion.model.StockSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates, orders, deduplicates and truncates fused results into the final list.
 */
public final class RecommendationRanker {
    /**
     * final score desc, ML probability desc (missing last), stock id asc.
     */
    public static final Comparator<FusionResult> ORDER = Comparator
            .comparingDouble((FusionResult r) -> r.finalScore).reversed()
            .thenComparing(Comparator.comparingDouble(RecommendationRanker::mlOrMin).reversed())
            .thenComparing(r -> r.stockId);

    /**
     * Builds the final list from fused results.
     *
     * <p>Results failing a validity rule are dropped with their cause. Survivors are
     * sorted by {@link #ORDER}; a repeated id keeps only its first entry in that order.
     * The list is cut at {@code topN} and ranked 1..n without gaps.
     *
     * @param results fused results, in any order
     * @param snapshots price snapshot per stock id; a missing one fails the price check when
     *                  a valid price is required
     * @param topN maximum list length, at least 1
     * @param rules validity rules
     * @param generatedAt timestamp stamped on every recommendation
     * @return ranked recommendations plus what was dropped and why
     */
    public RankedList rank(
            List<FusionResult> results,
            Map<String, StockSnapshot> snapshots,
            int topN,
            ValidityRules rules,
            Instant generatedAt
    ) {
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be >= 1: " + topN);
        }
        Map<String, StockSnapshot> safeSnapshots = snapshots == null ? Map.of() : snapshots;
        Map<String, CauseCode> dropped = new LinkedHashMap<>();
        List<FusionResult> valid = new ArrayList<>();
        for (FusionResult result : results == null ? List.<FusionResult>of() : results) {
            if (result == null) {
                continue;
            }
            CauseCode cause = check(result, safeSnapshots.get(result.stockId), rules);
            if (cause == CauseCode.NONE) {
                valid.add(result);
            } else {
                dropped.putIfAbsent(result.stockId, cause);
            }
        }

        valid.sort(ORDER);

        List<Recommendation> out = new ArrayList<>();
        List<String> duplicates = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (FusionResult result : valid) {
            if (!seen.add(result.stockId)) {
                duplicates.add(result.stockId);
                continue;
            }
            if (out.size() < topN) {
                out.add(new Recommendation(out.size() + 1, result, safeSnapshots.get(result.stockId), generatedAt));
            }
        }
        return new RankedList(out, dropped, duplicates);
    }

    CauseCode check(FusionResult result, StockSnapshot snapshot, ValidityRules rules) {
        double score = rules.scoreField == ValidityRules.ScoreField.FINAL ? result.finalScore : result.totalScore;
        if (!Double.isFinite(score) || !Double.isFinite(result.finalScore)) {
            return CauseCode.NON_FINITE_SCORE;
        }
        if (rules.requirePositiveScore && score <= 0.0) {
            return CauseCode.SCORE_NOT_POSITIVE;
        }
        if (snapshot == null) {
            return rules.requireValidPrice ? CauseCode.PRICE_INVALID : CauseCode.NONE;
        }
        if (rules.requireValidPrice && !(Double.isFinite(snapshot.lastPrice) && snapshot.lastPrice > 0.0)) {
            return CauseCode.PRICE_INVALID;
        }
        if (!Double.isFinite(snapshot.changePct) || Math.abs(snapshot.changePct) >= rules.maxAbsChangePct) {
            return CauseCode.CHANGE_OUT_OF_RANGE;
        }
        return CauseCode.NONE;
    }

    private static double mlOrMin(FusionResult result) {
        return result.mlProbability == null ? Double.NEGATIVE_INFINITY : result.mlProbability;
    }
}
