package com.stockfusion.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class FusionInput {
    public final String stockId;
    public final double totalScore;
    /** Up-probability from the model; {@code null} when the model had nothing for this stock. */
    public final Double mlProbability;
    public final Double volatility;
    /** 1-based position in the factor-score ordering, 0 when unknown. */
    public final int factorRank;
    public final ScoreBreakdown breakdown;

    public static FusionInput of(String stockId, double totalScore, Double mlProbability) {
        return new FusionInput(stockId, totalScore, mlProbability, null, 0, null);
    }
}
