package com.stockfusion.fusion;

import com.stockfusion.config.FusionParams;
import com.stockfusion.config.RankingConfig;
import com.stockfusion.core.diagnostics.CauseCode;
import com.stockfusion.core.diagnostics.Outcome;
import com.stockfusion.model.ConfidenceLevel;
import com.stockfusion.model.FactorSet;
import com.stockfusion.model.FusionInput;
import com.stockfusion.model.FusionMethod;
import com.stockfusion.model.FusionResult;
import com.stockfusion.model.NormalizedFactorSet;
import com.stockfusion.model.RiskLevel;
import com.stockfusion.model.Universe;
import com.stockfusion.scoring.CategoryScorer;
import com.stockfusion.scoring.FactorNormalizer;
import com.stockfusion.scoring.ScoredStock;
import com.stockfusion.scoring.WeightedScorer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FusionEngineTest {
    private final FusionEngine engine = new FusionEngine();
    private final FusionParams params = FusionParams.defaults();

    @Test
    void weightedAverageShouldBlendNormalizedScores() {
        FusionResult a = fuse(FusionInput.of("A", 1.2, 0.8), FusionMethod.WEIGHTED_AVERAGE);
        FusionResult b = fuse(FusionInput.of("B", 0.3, 0.55), FusionMethod.WEIGHTED_AVERAGE);

        assertEquals(0.8, a.finalScore, 1e-9);
        assertEquals(0.565, b.finalScore, 1e-9);
        assertTrue(a.finalScore > b.finalScore);
        assertEquals(ConfidenceLevel.MEDIUM, a.confidenceLevel);
        assertEquals(RiskLevel.MEDIUM, a.riskLevel);
        assertTrue(a.consensusFlag);
        assertEquals(FusionMethod.WEIGHTED_AVERAGE, a.method);
        assertTrue(a.rationale.startsWith("ML up probability 80.0%"));
        assertEquals(0.8, (Double) a.scoreDetail.get("normalized_factor_score"), 1e-9);
    }

    @Test
    void weightedAverageWithoutProbabilityShouldUseFactorScoreOnly() {
        FusionResult d = fuse(FusionInput.of("D", 0.5, null), FusionMethod.WEIGHTED_AVERAGE);

        assertEquals(0.6 * 0.625, d.finalScore, 1e-9);
        assertNull(d.mlProbability);
        assertTrue(d.rationale.contains("ML unavailable"));
        assertFalse(d.consensusFlag);
        assertEquals(ConfidenceLevel.LOW, d.confidenceLevel);
        assertEquals(RiskLevel.HIGH, d.riskLevel);
        assertEquals(Boolean.FALSE, d.scoreDetail.get("ml_available"));
    }

    @Test
    void nonFiniteProbabilityShouldBeTreatedAsMissing() {
        FusionResult result = fuse(FusionInput.of("E", 0.5, Double.NaN), FusionMethod.WEIGHTED_AVERAGE);

        assertNull(result.mlProbability);
        assertEquals(0.6 * 0.625, result.finalScore, 1e-9);
    }

    @Test
    void outOfRangeInputsShouldBeClipped() {
        FusionResult result = fuse(FusionInput.of("F", 9.0, 1.4), FusionMethod.WEIGHTED_AVERAGE);

        assertEquals(1.0, result.mlProbability);
        assertEquals(1.0, result.finalScore, 1e-9);
    }

    @Test
    void filterFirstShouldExcludeRatherThanPenalize() {
        Outcome<FusionResult> a = engine.fuse(FusionInput.of("A", 0.2, 0.5), FusionMethod.FILTER_FIRST, params);
        Outcome<FusionResult> b = engine.fuse(FusionInput.of("B", 0.9, 0.75), FusionMethod.FILTER_FIRST, params);
        Outcome<FusionResult> c = engine.fuse(FusionInput.of("C", 0.4, 0.9), FusionMethod.FILTER_FIRST, params);
        Outcome<FusionResult> d = engine.fuse(FusionInput.of("D", 0.9, null), FusionMethod.FILTER_FIRST, params);

        assertTrue(a.isExcluded());
        assertEquals(CauseCode.ML_BELOW_THRESHOLD, a.causeCode);
        assertTrue(b.success);
        assertEquals(0.9 + 0.5 * 0.75, b.value.finalScore, 1e-9);
        assertEquals(CauseCode.FACTOR_BELOW_THRESHOLD, c.causeCode);
        assertEquals(CauseCode.ML_UNAVAILABLE, d.causeCode);
    }

    @Test
    void filterFirstShouldNeverLetLowProbabilityThrough() {
        Random random = new Random(11L);
        List<FusionInput> inputs = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            inputs.add(FusionInput.of("S" + i, random.nextDouble() * 4.0 - 2.0, random.nextDouble()));
        }

        FusionBatch batch = engine.fuseAll(inputs, FusionMethod.FILTER_FIRST, params);

        assertFalse(batch.results.isEmpty());
        for (FusionResult result : batch.results) {
            assertTrue(result.mlProbability >= params.mlThreshold);
            assertTrue(result.totalScore >= params.factorThreshold);
        }
        assertEquals(200, batch.results.size() + batch.excludedCount());
    }

    @Test
    void filterFirstMayReturnNothing() {
        FusionBatch batch = engine.fuseAll(List.of(
                FusionInput.of("A", 1.0, 0.2),
                FusionInput.of("B", 0.1, 0.9)
        ), FusionMethod.FILTER_FIRST, params);

        assertTrue(batch.results.isEmpty());
        assertEquals(2, batch.excludedCount());
        assertEquals(0, batch.failedCount());
    }

    @Test
    void rankAdjustmentShouldNudgeFactorScore() {
        FusionBatch batch = engine.fuseAll(List.of(
                FusionInput.of("A", 0.3, 0.8),
                FusionInput.of("B", 0.5, 0.2),
                FusionInput.of("C", 0.4, null)
        ), FusionMethod.RANK_ADJUSTMENT, params);

        Map<String, FusionResult> byId = byId(batch.results);
        assertEquals(0.3 + 0.6, byId.get("A").finalScore, 1e-9);
        assertEquals(0.5 - 0.6, byId.get("B").finalScore, 1e-9);
        assertEquals(0.4, byId.get("C").finalScore, 1e-9);
        assertEquals(3, byId.get("A").scoreDetail.get("factor_rank"));
        assertEquals(1, byId.get("B").scoreDetail.get("factor_rank"));
        assertNull(byId.get("A").riskLevel);
        assertEquals(FusionMethod.RANK_ADJUSTMENT, byId.get("A").method);
    }

    @Test
    void consensusBoostShouldAddBonusOnlyWhenThresholdsAreCleared() {
        FusionResult strong = fuse(FusionInput.of("A", 0.8, 0.7), FusionMethod.CONSENSUS_BOOST);
        FusionResult weak = fuse(FusionInput.of("B", 0.3, 0.7), FusionMethod.CONSENSUS_BOOST);
        FusionResult split = fuse(FusionInput.of("C", 0.8, 0.3), FusionMethod.CONSENSUS_BOOST);

        assertEquals(0.7 + 0.15, strong.finalScore, 1e-9);
        assertTrue(strong.consensusFlag);
        assertEquals("high consensus", strong.scoreDetail.get("consensus_desc"));

        assertEquals(0.5 * 0.7 + 0.5 * 0.575, weak.finalScore, 1e-9);
        assertTrue(weak.consensusFlag);
        assertEquals("divergent", weak.scoreDetail.get("consensus_desc"));

        assertFalse(split.consensusFlag);
        assertEquals(0.0, (Double) split.scoreDetail.get("consensus_bonus"));
    }

    @Test
    void smallBonusShouldBeDescribedAsConsensus() {
        FusionParams small = params.toBuilder().consensusBonus(0.05).build();

        Outcome<FusionResult> outcome = engine.fuse(FusionInput.of("A", 0.8, 0.7), FusionMethod.CONSENSUS_BOOST, small);

        assertEquals("consensus", outcome.value.scoreDetail.get("consensus_desc"));
        assertTrue(outcome.value.rationale.contains("prediction consensus (+5.0%)"));
    }

    @Test
    void consensusBoostWithoutProbabilityShouldStillScore() {
        FusionResult result = fuse(FusionInput.of("A", 1.0, null), FusionMethod.CONSENSUS_BOOST);

        assertEquals(0.5 * 0.75, result.finalScore, 1e-9);
        assertFalse(result.consensusFlag);
    }

    @Test
    void nonFiniteScoreShouldBeSkippedWithoutStoppingTheBatch() {
        FusionBatch batch = engine.fuseAll(List.of(
                FusionInput.of("A", 0.6, 0.7),
                FusionInput.of("B", Double.NaN, 0.9),
                FusionInput.of("C", Double.POSITIVE_INFINITY, 0.9),
                FusionInput.of("D", 0.2, 0.4)
        ), FusionMethod.WEIGHTED_AVERAGE, params);

        assertEquals(List.of("A", "D"), List.of(batch.results.get(0).stockId, batch.results.get(1).stockId));
        assertEquals(CauseCode.NON_FINITE_SCORE, batch.failed.get("B"));
        assertEquals(CauseCode.NON_FINITE_SCORE, batch.failed.get("C"));
    }

    @Test
    void defaultScoredUniverseShouldKeepFactorScoresApart() {
        RankingConfig config = RankingConfig.defaults();
        List<FactorSet> sets = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            Map<String, Double> values = new LinkedHashMap<>();
            values.put("momentum_5d", (double) i);
            values.put("main_inflow_score", 10.0 * i);
            values.put("news_sentiment_score", 0.1 * i);
            sets.add(new FactorSet(String.format("%06d", i), values));
        }
        Map<String, NormalizedFactorSet> normalized = new FactorNormalizer().normalize(Universe.of(sets));
        WeightedScorer scorer = new WeightedScorer(new CategoryScorer(config.contributionBasis));

        List<Double> factorNorms = new ArrayList<>();
        for (FactorSet set : sets) {
            ScoredStock scored = scorer.score(normalized.get(set.stockId), config.weights);
            assertTrue(Math.abs(scored.totalScore) < 2.0, () -> set.stockId + " total " + scored.totalScore);
            FusionResult result = fuse(FusionInput.of(set.stockId, scored.totalScore, null), config.method);
            factorNorms.add((Double) result.scoreDetail.get("normalized_factor_score"));
        }

        for (int i = 1; i < factorNorms.size(); i++) {
            assertTrue(factorNorms.get(i) > factorNorms.get(i - 1), () -> "factor_norm not increasing: " + factorNorms);
        }
        assertTrue(factorNorms.get(0) < 0.5);
        assertTrue(factorNorms.get(4) > 0.5);
    }

    @Test
    void invalidRecordShouldFail() {
        Outcome<FusionResult> outcome = engine.fuse(null, FusionMethod.WEIGHTED_AVERAGE, params);

        assertTrue(outcome.isFailed());
        assertEquals(CauseCode.INVALID_RECORD, outcome.causeCode);
    }

    @Test
    void breakdownRationaleShouldFlowIntoResult() {
        FusionResult result = fuse(FusionInput.of("A", 0.9, 0.65), FusionMethod.WEIGHTED_AVERAGE);

        assertTrue(result.rationale.contains("factor score 0.90"));
        assertTrue(result.rationale.endsWith("confidence low, risk high"));
    }

    private FusionResult fuse(FusionInput input, FusionMethod method) {
        Outcome<FusionResult> outcome = engine.fuse(input, method, params);
        assertTrue(outcome.success, () -> "expected success but got " + outcome.causeCode);
        return outcome.value;
    }

    private static Map<String, FusionResult> byId(List<FusionResult> results) {
        Map<String, FusionResult> out = new LinkedHashMap<>();
        for (FusionResult result : results) {
            out.put(result.stockId, result);
        }
        return out;
    }
}
