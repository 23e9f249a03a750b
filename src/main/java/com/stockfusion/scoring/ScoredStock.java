package com.stockfusion.scoring;

import com.stockfusion.model.ScoreBreakdown;

public final class ScoredStock {
    public final String stockId;
    public final double totalScore;
    public final ScoreBreakdown breakdown;

    public ScoredStock(String stockId, double totalScore, ScoreBreakdown breakdown) {
        this.stockId = stockId;
        this.totalScore = totalScore;
        this.breakdown = breakdown;
    }
}
