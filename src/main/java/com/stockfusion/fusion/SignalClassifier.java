package com.stockfusion.fusion;

import com.stockfusion.config.FusionParams;
import com.stockfusion.model.ConfidenceLevel;
import com.stockfusion.model.RiskLevel;

/**
 * Confidence and risk labels from the strength of the two signal sources. A missing ML
 * probability counts as zero strength, full uncertainty.
 */
public final class SignalClassifier {
    static final double MEDIUM_CONFIDENCE_FLOOR = 0.5;
    static final double MEDIUM_RISK_CEILING = 0.6;
    static final double FACTOR_SCORE_SPAN = 2.0;

    public double mlStrength(Double mlProbability) {
        if (mlProbability == null) {
            return 0.0;
        }
        return Math.abs(mlProbability - 0.5) * 2.0;
    }

    public double factorStrength(double totalScore) {
        return Math.min(Math.abs(totalScore), FACTOR_SCORE_SPAN) / FACTOR_SCORE_SPAN;
    }

    /**
     * True when the ML direction (probability above or below 0.5) has the same sign as
     * the factor score. Always false without a probability.
     */
    public boolean signsAgree(Double mlProbability, double totalScore) {
        if (mlProbability == null) {
            return false;
        }
        return Math.signum(mlProbability - 0.5) == Math.signum(totalScore);
    }

    public double confidenceRaw(Double mlProbability, double totalScore) {
        double factor = factorStrength(totalScore);
        if (mlProbability == null) {
            return factor / 2.0;
        }
        double ml = mlStrength(mlProbability);
        if (signsAgree(mlProbability, totalScore)) {
            return (ml + factor) / 2.0;
        }
        return Math.abs(ml - factor);
    }

    public ConfidenceLevel confidence(Double mlProbability, double totalScore, FusionParams params) {
        double raw = confidenceRaw(mlProbability, totalScore);
        if (raw >= params.confidenceThreshold) {
            return ConfidenceLevel.HIGH;
        }
        if (raw >= MEDIUM_CONFIDENCE_FLOOR) {
            return ConfidenceLevel.MEDIUM;
        }
        return ConfidenceLevel.LOW;
    }

    /**
     * Mean uncertainty of both sources, averaged with {@code min(volatility, 1)} when a
     * finite non-negative volatility is supplied.
     */
    public double riskRaw(Double mlProbability, double totalScore, Double volatility) {
        double mlUncertainty = 1.0 - mlStrength(mlProbability);
        double factorUncertainty = 1.0 - factorStrength(totalScore);
        double risk = (mlUncertainty + factorUncertainty) / 2.0;
        if (volatility != null && Double.isFinite(volatility) && volatility >= 0.0) {
            risk = (risk + Math.min(volatility, 1.0)) / 2.0;
        }
        return risk;
    }

    public RiskLevel risk(Double mlProbability, double totalScore, Double volatility, FusionParams params) {
        double raw = riskRaw(mlProbability, totalScore, volatility);
        if (raw <= params.riskThreshold) {
            return RiskLevel.LOW;
        }
        if (raw <= MEDIUM_RISK_CEILING) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.HIGH;
    }
}
