package com.stockfusion.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class FusionResult {
    public final String stockId;
    public final double finalScore;
    public final double totalScore;
    public final Double mlProbability;
    public final ConfidenceLevel confidenceLevel;
    /** Left {@code null} by methods that do not model risk. */
    public final RiskLevel riskLevel;
    public final boolean consensusFlag;
    public final FusionMethod method;
    public final String rationale;
    public final Map<String, Object> scoreDetail;
    public final ScoreBreakdown breakdown;
}
