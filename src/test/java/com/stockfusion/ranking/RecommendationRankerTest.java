package com.stockfusion.ranking;

import com.stockfusion.config.ValidityRules;
import com.stockfusion.core.diagnostics.CauseCode;
import com.stockfusion.model.ConfidenceLevel;
import com.stockfusion.model.FusionMethod;
import com.stockfusion.model.FusionResult;
import com.stockfusion.model.Recommendation;
import com.stockfusion.model.StockSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecommendationRankerTest {
    private static final Instant NOW = Instant.parse("2026-03-02T07:00:00Z");

    private final RecommendationRanker ranker = new RecommendationRanker();

    @Test
    void equalScoresShouldBreakTiesByStockCode() {
        List<FusionResult> results = List.of(
                result("000002", 0.700000, 0.5, 0.70),
                result("000001", 0.700000, 0.5, 0.70)
        );

        RankedList ranked = ranker.rank(results, snapshots(results), 10, ValidityRules.defaults(), NOW);

        assertEquals("000001", ranked.recommendations.get(0).stockId());
        assertEquals(1, ranked.recommendations.get(0).rank);
        assertEquals("000002", ranked.recommendations.get(1).stockId());
        assertEquals(2, ranked.recommendations.get(1).rank);
    }

    @Test
    void higherProbabilityShouldWinEqualFinalScores() {
        List<FusionResult> results = List.of(
                result("000001", 0.6, 0.5, 0.61),
                result("000003", 0.6, 0.5, 0.72),
                result("000002", 0.6, 0.5, null)
        );

        RankedList ranked = ranker.rank(results, snapshots(results), 10, ValidityRules.defaults(), NOW);

        assertEquals(List.of("000003", "000001", "000002"), ids(ranked.recommendations));
    }

    @Test
    void ranksShouldBeContiguousAfterTruncation() {
        Random random = new Random(3L);
        List<FusionResult> results = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            results.add(result(String.format("%06d", i), random.nextDouble(), random.nextDouble() * 2.0 - 0.5,
                    random.nextDouble()));
        }

        RankedList ranked = ranker.rank(results, snapshots(results), 12, ValidityRules.defaults(), NOW);

        assertTrue(ranked.size() <= 12);
        for (int i = 0; i < ranked.size(); i++) {
            Recommendation rec = ranked.recommendations.get(i);
            assertEquals(i + 1, rec.rank);
            assertEquals(NOW, rec.generatedAt);
            if (i > 0) {
                assertTrue(ranked.recommendations.get(i - 1).finalScore() >= rec.finalScore());
            }
        }
    }

    @Test
    void validityRulesShouldDropRatherThanZeroFill() {
        List<FusionResult> results = List.of(
                result("OK", 0.9, 0.8, 0.7),
                result("NEG", 0.95, -0.1, 0.7),
                result("NOPRICE", 0.85, 0.6, 0.7),
                result("LIMIT", 0.8, 0.7, 0.7),
                result("MISSING", 0.75, 0.7, 0.7)
        );
        Map<String, StockSnapshot> snapshots = new HashMap<>();
        snapshots.put("OK", new StockSnapshot("OK", "Ok Corp", 12.5, 3.2));
        snapshots.put("NEG", new StockSnapshot("NEG", "Neg Corp", 8.0, 1.0));
        snapshots.put("NOPRICE", new StockSnapshot("NOPRICE", "No Price", 0.0, 1.0));
        snapshots.put("LIMIT", new StockSnapshot("LIMIT", "Limit Up", 10.0, 10.0));

        RankedList ranked = ranker.rank(results, snapshots, 10, ValidityRules.defaults(), NOW);

        assertEquals(List.of("OK"), ids(ranked.recommendations));
        assertEquals(CauseCode.SCORE_NOT_POSITIVE, ranked.dropped.get("NEG"));
        assertEquals(CauseCode.PRICE_INVALID, ranked.dropped.get("NOPRICE"));
        assertEquals(CauseCode.CHANGE_OUT_OF_RANGE, ranked.dropped.get("LIMIT"));
        assertEquals(CauseCode.PRICE_INVALID, ranked.dropped.get("MISSING"));
    }

    @Test
    void finalScoreFieldAndRelaxedPriceRuleShouldBeHonoured() {
        ValidityRules rules = new ValidityRules(ValidityRules.ScoreField.FINAL, true, false, 10.0);
        List<FusionResult> results = List.of(
                result("A", 0.4, -0.5, 0.7),
                result("B", -0.1, 0.9, 0.7)
        );

        RankedList ranked = ranker.rank(results, Map.of(), 10, rules, NOW);

        assertEquals(List.of("A"), ids(ranked.recommendations));
        assertEquals("", ranked.recommendations.get(0).stockName());
        assertEquals(CauseCode.SCORE_NOT_POSITIVE, ranked.dropped.get("B"));
    }

    @Test
    void nonFiniteScoresShouldBeDropped() {
        List<FusionResult> results = List.of(
                result("A", Double.NaN, 0.5, 0.7),
                result("B", 0.5, 0.5, 0.7)
        );

        RankedList ranked = ranker.rank(results, snapshots(results), 10, ValidityRules.defaults(), NOW);

        assertEquals(List.of("B"), ids(ranked.recommendations));
        assertEquals(CauseCode.NON_FINITE_SCORE, ranked.dropped.get("A"));
    }

    @Test
    void duplicatesShouldKeepTheBestEntry() {
        List<FusionResult> results = List.of(
                result("600000", 0.5, 0.5, 0.7),
                result("600000", 0.9, 0.5, 0.7),
                result("600001", 0.7, 0.5, 0.7)
        );

        RankedList ranked = ranker.rank(results, snapshots(results), 10, ValidityRules.defaults(), NOW);

        assertEquals(List.of("600000", "600001"), ids(ranked.recommendations));
        assertEquals(0.9, ranked.recommendations.get(0).finalScore(), 1e-12);
        assertEquals(List.of("600000"), ranked.duplicateIds);
    }

    @Test
    void emptyInputShouldGiveEmptyList() {
        RankedList ranked = ranker.rank(List.of(), Map.of(), 5, ValidityRules.defaults(), NOW);

        assertTrue(ranked.recommendations.isEmpty());
    }

    @Test
    void nonPositiveTopNShouldBeRejected() {
        assertThrows(
                IllegalArgumentException.class,
                () -> ranker.rank(List.of(), Map.of(), 0, ValidityRules.defaults(), NOW)
        );
    }

    static FusionResult result(String id, double finalScore, double totalScore, Double ml) {
        return FusionResult.builder()
                .stockId(id)
                .finalScore(finalScore)
                .totalScore(totalScore)
                .mlProbability(ml)
                .confidenceLevel(ConfidenceLevel.MEDIUM)
                .method(FusionMethod.WEIGHTED_AVERAGE)
                .rationale("")
                .scoreDetail(Map.of())
                .build();
    }

    static Map<String, StockSnapshot> snapshots(List<FusionResult> results) {
        Map<String, StockSnapshot> out = new HashMap<>();
        for (FusionResult result : results) {
            out.put(result.stockId, new StockSnapshot(result.stockId, "name-" + result.stockId, 10.0, 1.5));
        }
        return out;
    }

    private static List<String> ids(List<Recommendation> recommendations) {
        List<String> out = new ArrayList<>();
        for (Recommendation rec : recommendations) {
            out.add(rec.stockId());
        }
        return out;
    }
}
