package com.stockfusion.fusion;

import com.stockfusion.config.FusionParams;
import com.stockfusion.core.diagnostics.CauseCode;
import com.stockfusion.core.diagnostics.Outcome;
import com.stockfusion.model.CategoryScore;
import com.stockfusion.model.ConfidenceLevel;
import com.stockfusion.model.FusionInput;
import com.stockfusion.model.FusionMethod;
import com.stockfusion.model.FusionResult;
import com.stockfusion.model.RiskLevel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Combines the rule-based total score with the model's up-probability. Every method is
 * a pure function of the input and the parameters; a stock that cannot be fused comes
 * back as a failed or excluded {@link Outcome}, never as an exception.
 */
public final class FusionEngine {
    private static final Logger LOG = LogManager.getLogger(FusionEngine.class);

    private static final double FACTOR_OFFSET = 2.0;
    private static final double FACTOR_RANGE = 4.0;
    private static final double HIGH_CONSENSUS_BONUS = 0.1;

    private final SignalClassifier classifier;

    public FusionEngine() {
        this(new SignalClassifier());
    }

    public FusionEngine(SignalClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Fuses one stock with {@code method}.
     *
     * <p>A missing or non-finite probability is treated as absent and a finite one is
     * clipped to [0, 1]. A blank id fails with {@code INVALID_RECORD} and a non-finite
     * total with {@code NON_FINITE_SCORE}. {@code filter_first} reports the stocks it
     * rejects as excluded, not failed.
     *
     * @param input total score, optional ML probability and breakdown of one stock
     * @param method fusion method to apply
     * @param params weights and thresholds
     * @return the fused result, or an excluded/failed outcome carrying the cause
     */
    public Outcome<FusionResult> fuse(FusionInput input, FusionMethod method, FusionParams params) {
        if (input == null || input.stockId == null || input.stockId.trim().isEmpty()) {
            return Outcome.failure(CauseCode.INVALID_RECORD, "fusion");
        }
        if (!Double.isFinite(input.totalScore)) {
            return Outcome.failure(CauseCode.NON_FINITE_SCORE, input.stockId,
                    Map.of("total_score", String.valueOf(input.totalScore)));
        }
        Double ml = sanitizeProbability(input.mlProbability);
        switch (method) {
            case WEIGHTED_AVERAGE:
                return Outcome.success(weightedAverage(input, ml, params), input.stockId);
            case FILTER_FIRST:
                return filterFirst(input, ml, params);
            case RANK_ADJUSTMENT:
                return Outcome.success(rankAdjustment(input, ml, params), input.stockId);
            case CONSENSUS_BOOST:
                return Outcome.success(consensusBoost(input, ml, params), input.stockId);
            default:
                throw new IllegalStateException("unhandled fusion method: " + method);
        }
    }

    /**
     * Fuses a whole universe. Factor ranks are assigned from the total-score ordering
     * first, so {@code rank_adjustment} sees each stock's place in the factor ranking.
     */
    public FusionBatch fuseAll(List<FusionInput> inputs, FusionMethod method, FusionParams params) {
        List<FusionInput> ranked = assignFactorRanks(inputs == null ? List.of() : inputs);
        List<FusionResult> results = new ArrayList<>();
        Map<String, CauseCode> excluded = new LinkedHashMap<>();
        Map<String, CauseCode> failed = new LinkedHashMap<>();
        int anonymous = 0;
        for (FusionInput input : ranked) {
            String key = input == null || input.stockId == null ? "#invalid-" + (++anonymous) : input.stockId;
            Outcome<FusionResult> outcome;
            try {
                outcome = fuse(input, method, params);
            } catch (RuntimeException e) {
                LOG.warn("fusion failed for {}: {}", key, e.getMessage(), e);
                failed.put(key, CauseCode.RUNTIME_ERROR);
                continue;
            }
            if (outcome.success) {
                results.add(outcome.value);
            } else if (outcome.isExcluded()) {
                LOG.debug("{} excluded by {}: {}", key, method.key(), outcome.causeCode);
                excluded.put(key, outcome.causeCode);
            } else {
                LOG.warn("{} skipped by fusion: cause={} details={}", key, outcome.causeCode, outcome.details);
                failed.put(key, outcome.causeCode);
            }
        }
        return new FusionBatch(results, excluded, failed);
    }

    /**
     * Maps a total score onto [0, 1] as {@code (t + 2) / 4}, clipped.
     */
    public double normalizeFactorScore(double totalScore) {
        return clamp((totalScore + FACTOR_OFFSET) / FACTOR_RANGE, 0.0, 1.0);
    }

    private FusionResult weightedAverage(FusionInput input, Double ml, FusionParams params) {
        double factorNorm = normalizeFactorScore(input.totalScore);
        double finalScore = ml == null
                ? params.factorWeight * factorNorm
                : params.mlWeight * ml + params.factorWeight * factorNorm;
        ConfidenceLevel confidence = classifier.confidence(ml, input.totalScore, params);
        RiskLevel risk = classifier.risk(ml, input.totalScore, input.volatility, params);

        Map<String, Object> detail = baseDetail(input, ml, factorNorm);
        Map<String, Object> weights = new LinkedHashMap<>();
        weights.put("ml_weight", ml == null ? 0.0 : params.mlWeight);
        weights.put("factor_weight", params.factorWeight);
        detail.put("weights", weights);

        String rationale = join(
                mlPart(ml),
                rulePart(input),
                levelsPart(confidence, risk)
        );
        return result(input, ml, finalScore, confidence, risk, FusionMethod.WEIGHTED_AVERAGE, rationale, detail);
    }

    private Outcome<FusionResult> filterFirst(FusionInput input, Double ml, FusionParams params) {
        if (ml == null) {
            return Outcome.failure(CauseCode.ML_UNAVAILABLE, input.stockId);
        }
        if (ml < params.mlThreshold) {
            return Outcome.failure(CauseCode.ML_BELOW_THRESHOLD, input.stockId,
                    Map.of("ml_probability", ml, "ml_threshold", params.mlThreshold));
        }
        if (input.totalScore < params.factorThreshold) {
            return Outcome.failure(CauseCode.FACTOR_BELOW_THRESHOLD, input.stockId,
                    Map.of("total_score", input.totalScore, "factor_threshold", params.factorThreshold));
        }
        double finalScore = input.totalScore + params.factorBoost * ml;
        ConfidenceLevel confidence = classifier.confidence(ml, input.totalScore, params);
        RiskLevel risk = classifier.risk(ml, input.totalScore, input.volatility, params);

        Map<String, Object> detail = baseDetail(input, ml, normalizeFactorScore(input.totalScore));
        Map<String, Object> thresholds = new LinkedHashMap<>();
        thresholds.put("ml_threshold", params.mlThreshold);
        thresholds.put("factor_threshold", params.factorThreshold);
        detail.put("thresholds", thresholds);
        detail.put("factor_boost", params.factorBoost);

        String rationale = join(
                String.format(Locale.ROOT, "passed ML filter (%.1f%% >= %.1f%%) and factor filter (%.2f >= %.2f)",
                        ml * 100.0, params.mlThreshold * 100.0, input.totalScore, params.factorThreshold),
                rulePart(input),
                levelsPart(confidence, risk)
        );
        return Outcome.success(
                result(input, ml, finalScore, confidence, risk, FusionMethod.FILTER_FIRST, rationale, detail),
                input.stockId
        );
    }

    private FusionResult rankAdjustment(FusionInput input, Double ml, FusionParams params) {
        double adjustment = ml == null ? 0.0 : (ml - 0.5) * 2.0;
        double finalScore = input.totalScore + adjustment;
        ConfidenceLevel confidence = classifier.confidence(ml, input.totalScore, params);

        Map<String, Object> detail = baseDetail(input, ml, normalizeFactorScore(input.totalScore));
        detail.put("factor_rank", input.factorRank);
        detail.put("rank_adjustment", adjustment);

        String rationale = join(
                mlPart(ml),
                String.format(Locale.ROOT, "factor rank %d adjusted by %+.2f", input.factorRank, adjustment),
                rulePart(input),
                "confidence " + confidence.label()
        );
        return result(input, ml, finalScore, confidence, null, FusionMethod.RANK_ADJUSTMENT, rationale, detail);
    }

    private FusionResult consensusBoost(FusionInput input, Double ml, FusionParams params) {
        double factorNorm = normalizeFactorScore(input.totalScore);
        double base = ml == null
                ? params.baseWeight * factorNorm
                : params.baseWeight * ml + params.baseWeight * factorNorm;
        boolean agree = classifier.signsAgree(ml, input.totalScore);
        double bonus = 0.0;
        if (agree && ml >= params.mlThreshold && input.totalScore >= params.factorThreshold) {
            bonus = params.consensusBonus;
        }
        String consensus = consensusDescription(bonus);
        ConfidenceLevel confidence = classifier.confidence(ml, input.totalScore, params);
        RiskLevel risk = classifier.risk(ml, input.totalScore, input.volatility, params);

        Map<String, Object> detail = baseDetail(input, ml, factorNorm);
        detail.put("base_score", base);
        detail.put("consensus_bonus", bonus);
        detail.put("consensus_desc", consensus);

        String rationale = join(
                mlPart(ml),
                String.format(Locale.ROOT, "prediction %s (+%.1f%%)", consensus, bonus * 100.0),
                rulePart(input),
                levelsPart(confidence, risk)
        );
        return result(input, ml, base + bonus, confidence, risk, FusionMethod.CONSENSUS_BOOST, rationale, detail);
    }

    private FusionResult result(
            FusionInput input,
            Double ml,
            double finalScore,
            ConfidenceLevel confidence,
            RiskLevel risk,
            FusionMethod method,
            String rationale,
            Map<String, Object> detail
    ) {
        return FusionResult.builder()
                .stockId(input.stockId)
                .finalScore(finalScore)
                .totalScore(input.totalScore)
                .mlProbability(ml)
                .confidenceLevel(confidence)
                .riskLevel(risk)
                .consensusFlag(classifier.signsAgree(ml, input.totalScore))
                .method(method)
                .rationale(rationale)
                .scoreDetail(Collections.unmodifiableMap(detail))
                .breakdown(input.breakdown)
                .build();
    }

    private Map<String, Object> baseDetail(FusionInput input, Double ml, double factorNorm) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("normalized_factor_score", factorNorm);
        if (ml != null) {
            detail.put("normalized_ml_prob", ml);
        }
        detail.put("ml_available", ml != null);
        if (input.breakdown != null) {
            Map<String, Double> categories = new LinkedHashMap<>();
            for (CategoryScore score : input.breakdown.categories().values()) {
                categories.put(score.category, score.subScore);
            }
            detail.put("category_scores", Collections.unmodifiableMap(categories));
            detail.put("residual_score", input.breakdown.residualTotal());
        }
        return detail;
    }

    private List<FusionInput> assignFactorRanks(List<FusionInput> inputs) {
        List<FusionInput> rankable = new ArrayList<>();
        for (FusionInput input : inputs) {
            if (input != null && input.stockId != null && Double.isFinite(input.totalScore)) {
                rankable.add(input);
            }
        }
        rankable.sort(Comparator.comparingDouble((FusionInput in) -> in.totalScore).reversed()
                .thenComparing(in -> in.stockId));
        Map<FusionInput, Integer> ranks = new IdentityHashMap<>();
        for (int i = 0; i < rankable.size(); i++) {
            ranks.put(rankable.get(i), i + 1);
        }
        List<FusionInput> out = new ArrayList<>(inputs.size());
        for (FusionInput input : inputs) {
            Integer rank = input == null ? null : ranks.get(input);
            out.add(rank == null ? input : input.toBuilder().factorRank(rank).build());
        }
        return out;
    }

    private static Double sanitizeProbability(Double raw) {
        if (raw == null || !Double.isFinite(raw)) {
            return null;
        }
        return clamp(raw, 0.0, 1.0);
    }

    private static String consensusDescription(double bonus) {
        if (bonus > HIGH_CONSENSUS_BONUS) {
            return "high consensus";
        }
        if (bonus > 0.0) {
            return "consensus";
        }
        return "divergent";
    }

    private static String mlPart(Double ml) {
        if (ml == null) {
            return "ML unavailable, factor score only";
        }
        return String.format(Locale.ROOT, "ML up probability %.1f%%", ml * 100.0);
    }

    private static String rulePart(FusionInput input) {
        if (input.breakdown == null) {
            return String.format(Locale.ROOT, "factor score %.2f", input.totalScore);
        }
        return input.breakdown.summaryRationale();
    }

    private static String levelsPart(ConfidenceLevel confidence, RiskLevel risk) {
        return "confidence " + confidence.label() + ", risk " + risk.label();
    }

    private static String join(String... parts) {
        return String.join("; ", parts);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
