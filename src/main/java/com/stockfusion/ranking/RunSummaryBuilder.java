package com.stockfusion.ranking;

import com.stockfusion.model.ConfidenceLevel;
import com.stockfusion.model.FusionMethod;
import com.stockfusion.model.Recommendation;
import com.stockfusion.model.RiskLevel;
import com.stockfusion.model.RunSummary;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Run-level summary derived only from the output sequence plus the drop counts.
 */
public final class RunSummaryBuilder {

    /**
     * Counts, averages and level distributions over {@code recommendations}. Score averages
     * are 0 for an empty list; the ML average is null when no row has a probability.
     */
    public RunSummary build(
            List<Recommendation> recommendations,
            FusionMethod method,
            int universeSize,
            int excludedCount,
            int skippedCount
    ) {
        List<Recommendation> rows = recommendations == null ? List.of() : recommendations;
        Map<ConfidenceLevel, Integer> confidence = new EnumMap<>(ConfidenceLevel.class);
        for (ConfidenceLevel level : ConfidenceLevel.values()) {
            confidence.put(level, 0);
        }
        Map<RiskLevel, Integer> risk = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : RiskLevel.values()) {
            risk.put(level, 0);
        }

        double finalSum = 0.0;
        double totalSum = 0.0;
        double mlSum = 0.0;
        int mlCount = 0;
        int consensus = 0;
        for (Recommendation row : rows) {
            finalSum += row.finalScore();
            totalSum += row.totalScore();
            if (row.mlProbability() != null) {
                mlSum += row.mlProbability();
                mlCount++;
            }
            if (row.fusion.consensusFlag) {
                consensus++;
            }
            if (row.fusion.confidenceLevel != null) {
                confidence.merge(row.fusion.confidenceLevel, 1, Integer::sum);
            }
            if (row.fusion.riskLevel != null) {
                risk.merge(row.fusion.riskLevel, 1, Integer::sum);
            }
        }
        int count = rows.size();
        return RunSummary.builder()
                .method(method)
                .universeSize(universeSize)
                .count(count)
                .averageFinalScore(count == 0 ? 0.0 : finalSum / count)
                .averageTotalScore(count == 0 ? 0.0 : totalSum / count)
                .averageMlProbability(mlCount == 0 ? null : mlSum / mlCount)
                .confidenceHistogram(Collections.unmodifiableMap(confidence))
                .riskHistogram(Collections.unmodifiableMap(risk))
                .consensusCount(consensus)
                .highConfidenceCount(confidence.get(ConfidenceLevel.HIGH))
                .lowRiskCount(risk.get(RiskLevel.LOW))
                .excludedCount(excludedCount)
                .skippedCount(skippedCount)
                .build();
    }

    /**
     * One-line form for the run log.
     */
    public String describe(RunSummary summary) {
        StringBuilder sb = new StringBuilder();
        sb.append("method=").append(summary.method == null ? "" : summary.method.key());
        sb.append(" universe=").append(summary.universeSize);
        sb.append(" count=").append(summary.count);
        sb.append(" avg_final=").append(round4(summary.averageFinalScore));
        sb.append(" avg_total=").append(round4(summary.averageTotalScore));
        sb.append(" avg_ml=").append(summary.averageMlProbability == null ? "n/a" : round4(summary.averageMlProbability));
        sb.append(" confidence=").append(summary.confidenceHistogram);
        sb.append(" consensus=").append(summary.consensusCount);
        sb.append(" excluded=").append(summary.excludedCount);
        sb.append(" skipped=").append(summary.skippedCount);
        return sb.toString();
    }

    private static String round4(double value) {
        return String.valueOf(Math.round(value * 10000.0) / 10000.0);
    }
}
