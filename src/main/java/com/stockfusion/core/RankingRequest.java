package com.stockfusion.core;

import com.stockfusion.model.StockSnapshot;
import com.stockfusion.model.Universe;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Inputs of one ranking run: the universe, the model's up-probability per stock (absent
 * entries mean no prediction) and display snapshots.
 */
public final class RankingRequest {
    public final Universe universe;
    public final Map<String, Double> mlProbabilities;
    public final Map<String, StockSnapshot> snapshots;

    public RankingRequest(Universe universe, Map<String, Double> mlProbabilities, Map<String, StockSnapshot> snapshots) {
        this.universe = universe == null ? Universe.of(null) : universe;
        this.mlProbabilities = mlProbabilities == null
                ? Map.of()
                : Collections.unmodifiableMap(new HashMap<>(mlProbabilities));
        this.snapshots = snapshots == null
                ? Map.of()
                : Collections.unmodifiableMap(new HashMap<>(snapshots));
    }

    public Double mlProbability(String stockId) {
        return mlProbabilities.get(stockId);
    }

    public StockSnapshot snapshot(String stockId) {
        return snapshots.get(stockId);
    }
}
