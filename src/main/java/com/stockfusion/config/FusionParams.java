package com.stockfusion.config;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Numeric parameters shared by the fusion methods. Each method reads only the ones it
 * needs.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class FusionParams {
    public final double mlWeight;
    public final double factorWeight;
    public final double mlThreshold;
    public final double factorThreshold;
    public final double confidenceThreshold;
    public final double riskThreshold;
    public final double consensusBonus;
    public final double baseWeight;
    public final double factorBoost;

    public static FusionParams defaults() {
        return FusionParams.builder()
                .mlWeight(0.4)
                .factorWeight(0.6)
                .mlThreshold(0.6)
                .factorThreshold(0.5)
                .confidenceThreshold(0.7)
                .riskThreshold(0.3)
                .consensusBonus(0.15)
                .baseWeight(0.5)
                .factorBoost(0.5)
                .build();
    }

    public static FusionParams fromConfig(Config config) {
        return FusionParams.builder()
                .mlWeight(finite(config, "fusion.ml_weight"))
                .factorWeight(finite(config, "fusion.factor_weight"))
                .mlThreshold(finite(config, "fusion.ml_threshold"))
                .factorThreshold(finite(config, "fusion.factor_threshold"))
                .confidenceThreshold(finite(config, "fusion.confidence_threshold"))
                .riskThreshold(finite(config, "fusion.risk_threshold"))
                .consensusBonus(finite(config, "fusion.consensus_bonus"))
                .baseWeight(finite(config, "fusion.base_weight"))
                .factorBoost(finite(config, "fusion.factor_boost"))
                .build();
    }

    private static double finite(Config config, String key) {
        String raw = config.getString(key);
        double value;
        try {
            value = Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid number for " + key + ": '" + raw + "'", e);
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(key + " must be finite: " + raw);
        }
        return value;
    }
}
