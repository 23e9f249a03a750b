package com.stockfusion.scoring;

import java.util.Locale;

/**
 * What a factor weight multiplies. {@code RAW} uses the normalized value as is;
 * {@code CENTERED} maps it to [-1, 1] around the neutral 50 so a total score keeps its
 * sign (bullish/bearish) and stays in the range the fusion step expects.
 */
public enum ContributionBasis {
    RAW,
    CENTERED;

    public double apply(double normalized) {
        if (this == CENTERED) {
            return (normalized - 50.0) / 50.0;
        }
        return normalized;
    }

    public static ContributionBasis fromKey(String raw) {
        String normalized = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("scoring.contribution_basis must be raw or centered: " + raw, e);
        }
    }
}
