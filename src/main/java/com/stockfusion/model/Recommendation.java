package com.stockfusion.model;

import java.time.Instant;

public final class Recommendation {
    public final int rank;
    public final FusionResult fusion;
    public final StockSnapshot snapshot;
    public final Instant generatedAt;

    public Recommendation(int rank, FusionResult fusion, StockSnapshot snapshot, Instant generatedAt) {
        this.rank = rank;
        this.fusion = fusion;
        this.snapshot = snapshot;
        this.generatedAt = generatedAt;
    }

    public String stockId() {
        return fusion.stockId;
    }

    public String stockName() {
        return snapshot == null ? "" : snapshot.name;
    }

    public double finalScore() {
        return fusion.finalScore;
    }

    public double totalScore() {
        return fusion.totalScore;
    }

    public Double mlProbability() {
        return fusion.mlProbability;
    }
}
