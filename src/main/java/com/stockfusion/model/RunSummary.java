package com.stockfusion.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class RunSummary {
    public final FusionMethod method;
    public final int universeSize;
    public final int count;
    public final double averageFinalScore;
    public final double averageTotalScore;
    /** Mean over recommendations that carry a probability; {@code null} when none do. */
    public final Double averageMlProbability;
    public final Map<ConfidenceLevel, Integer> confidenceHistogram;
    public final Map<RiskLevel, Integer> riskHistogram;
    public final int consensusCount;
    public final int highConfidenceCount;
    public final int lowRiskCount;
    public final int excludedCount;
    public final int skippedCount;
}
