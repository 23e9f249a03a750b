package com.stockfusion.ranking;

import com.stockfusion.config.RankingConfig;
import com.stockfusion.model.CategoryScore;
import com.stockfusion.model.ConfidenceLevel;
import com.stockfusion.model.RationaleItem;
import com.stockfusion.model.Recommendation;
import com.stockfusion.model.RiskLevel;
import com.stockfusion.model.RunSummary;
import com.stockfusion.model.ScoreBreakdown;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Audit JSON for recommendations. Scores are rounded to four places; a missing ML
 * probability or risk level is written as JSON null.
 */
public final class RecommendationJsonBuilder {

    public JSONObject buildRecommendation(Recommendation rec, boolean includeDetails) {
        JSONObject root = new JSONObject();
        root.put("rank", rec.rank);
        root.put("stock_code", rec.stockId());
        root.put("stock_name", rec.stockName());
        if (rec.snapshot != null) {
            root.put("current_price", round4(rec.snapshot.lastPrice));
            root.put("change_pct", round4(rec.snapshot.changePct));
        }
        root.put("final_score", round4(rec.finalScore()));
        root.put("total_score", round4(rec.totalScore()));
        root.put("ml_probability", rec.mlProbability() == null ? JSONObject.NULL : round4(rec.mlProbability()));
        root.put("confidence_level", rec.fusion.confidenceLevel == null ? JSONObject.NULL : rec.fusion.confidenceLevel.label());
        root.put("risk_level", rec.fusion.riskLevel == null ? JSONObject.NULL : rec.fusion.riskLevel.label());
        root.put("consensus", rec.fusion.consensusFlag);
        root.put("method", rec.fusion.method == null ? "" : rec.fusion.method.key());
        root.put("rationale", safe(rec.fusion.rationale));
        if (rec.generatedAt != null) {
            root.put("generated_at", rec.generatedAt.toString());
        }
        if (includeDetails) {
            root.put("score_detail", detailObject(rec.fusion.scoreDetail));
            root.put("breakdown", breakdownObject(rec.fusion.breakdown));
        }
        return root;
    }

    /**
     * Full audit document: {@code metadata} with method, weights and thresholds,
     * {@code summary}, and one entry per recommendation.
     */
    public JSONObject buildDocument(
            List<Recommendation> recommendations,
            RunSummary summary,
            RankingConfig config,
            Instant generatedAt
    ) {
        JSONArray items = new JSONArray();
        for (Recommendation rec : recommendations) {
            items.put(buildRecommendation(rec, config.includeDetails));
        }

        JSONObject weights = new JSONObject()
                .put("profile", config.weightProfile)
                .put("ml_weight", config.params.mlWeight)
                .put("factor_weight", config.params.factorWeight)
                .put("base_weight", config.params.baseWeight)
                .put("factors", new JSONObject(config.weights.flatten()));
        JSONObject thresholds = new JSONObject()
                .put("ml_threshold", config.params.mlThreshold)
                .put("factor_threshold", config.params.factorThreshold)
                .put("confidence_threshold", config.params.confidenceThreshold)
                .put("risk_threshold", config.params.riskThreshold)
                .put("consensus_bonus", config.params.consensusBonus)
                .put("factor_boost", config.params.factorBoost);

        JSONObject metadata = new JSONObject();
        metadata.put("generated_at", generatedAt == null ? JSONObject.NULL : generatedAt.toString());
        metadata.put("method", config.method.key());
        metadata.put("count", recommendations.size());
        metadata.put("top_n", config.topN);
        metadata.put("contribution_basis", config.contributionBasis.name().toLowerCase(Locale.ROOT));
        metadata.put("weights", weights);
        metadata.put("thresholds", thresholds);

        JSONObject root = new JSONObject();
        root.put("metadata", metadata);
        root.put("summary", summaryObject(summary));
        root.put("recommendations", items);
        return root;
    }

    public JSONObject summaryObject(RunSummary summary) {
        JSONObject out = new JSONObject();
        if (summary == null) {
            return out;
        }
        JSONObject confidence = new JSONObject();
        for (ConfidenceLevel level : ConfidenceLevel.values()) {
            confidence.put(level.label(), summary.confidenceHistogram.getOrDefault(level, 0));
        }
        JSONObject risk = new JSONObject();
        for (RiskLevel level : RiskLevel.values()) {
            risk.put(level.label(), summary.riskHistogram.getOrDefault(level, 0));
        }
        out.put("universe_size", summary.universeSize);
        out.put("count", summary.count);
        out.put("avg_final_score", round4(summary.averageFinalScore));
        out.put("avg_total_score", round4(summary.averageTotalScore));
        out.put("avg_ml_probability", summary.averageMlProbability == null
                ? JSONObject.NULL
                : round4(summary.averageMlProbability));
        out.put("confidence_distribution", confidence);
        out.put("risk_distribution", risk);
        out.put("consensus_count", summary.consensusCount);
        out.put("high_confidence_count", summary.highConfidenceCount);
        out.put("low_risk_count", summary.lowRiskCount);
        out.put("excluded_count", summary.excludedCount);
        out.put("skipped_count", summary.skippedCount);
        return out;
    }

    private JSONObject breakdownObject(ScoreBreakdown breakdown) {
        JSONObject out = new JSONObject();
        if (breakdown == null) {
            return out;
        }
        JSONObject categories = new JSONObject();
        for (CategoryScore score : breakdown.categories().values()) {
            JSONArray items = new JSONArray();
            for (RationaleItem item : score.items) {
                items.put(new JSONObject()
                        .put("factor", item.factor)
                        .put("value", round4(item.rawValue))
                        .put("rule", item.operator + " " + item.threshold)
                        .put("message", item.message));
            }
            categories.put(score.category, new JSONObject()
                    .put("score", round4(score.subScore))
                    .put("factors", new JSONArray(score.contributingFactors))
                    .put("rationale", score.rationale())
                    .put("checks", items));
        }
        JSONObject residual = new JSONObject();
        for (Map.Entry<String, Double> entry : breakdown.residualContributions().entrySet()) {
            residual.put(entry.getKey(), round4(entry.getValue()));
        }
        out.put("categories", categories);
        out.put("residual", residual);
        out.put("total", round4(breakdown.total()));
        return out;
    }

    private JSONObject detailObject(Map<String, Object> detail) {
        JSONObject out = new JSONObject();
        if (detail == null) {
            return out;
        }
        for (Map.Entry<String, Object> entry : detail.entrySet()) {
            out.put(entry.getKey(), toJsonValue(entry.getValue()));
        }
        return out;
    }

    private Object toJsonValue(Object value) {
        if (value instanceof Double number) {
            return round4(number);
        }
        if (value instanceof Map<?, ?> map) {
            JSONObject nested = new JSONObject();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                nested.put(String.valueOf(entry.getKey()), toJsonValue(entry.getValue()));
            }
            return nested;
        }
        return value == null ? JSONObject.NULL : value;
    }

    private double round4(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.round(value * 10000.0) / 10000.0;
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
