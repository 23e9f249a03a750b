package com.stockfusion.scoring;

import com.stockfusion.model.NormalizedFactorSet;

import java.util.Collection;

/**
 * Population mean and standard deviation of one factor over a universe, and the z-score
 * mapping onto [0, 100] built on them.
 */
public final class CrossSectionStats {
    public static final double Z_CLIP = 3.0;

    public final int count;
    public final double mean;
    public final double std;

    private CrossSectionStats(int count, double mean, double std) {
        this.count = count;
        this.mean = mean;
        this.std = std;
    }

    /**
     * Statistics over the finite entries of {@code values}; null, NaN and infinite entries
     * are skipped.
     */
    public static CrossSectionStats of(Collection<Double> values) {
        int count = 0;
        double sum = 0.0;
        for (Double value : values) {
            if (value != null && Double.isFinite(value)) {
                count++;
                sum += value;
            }
        }
        if (count == 0) {
            return new CrossSectionStats(0, Double.NaN, Double.NaN);
        }
        double mean = sum / count;
        double squares = 0.0;
        for (Double value : values) {
            if (value != null && Double.isFinite(value)) {
                double delta = value - mean;
                squares += delta * delta;
            }
        }
        double std = Math.sqrt(squares / count);
        return new CrossSectionStats(count, mean, std);
    }

    /**
     * True when no comparison is possible: no finite values, zero spread, or statistics
     * that overflowed.
     */
    public boolean isDegenerate() {
        return count == 0 || !Double.isFinite(mean) || !Double.isFinite(std) || std <= 0.0;
    }

    public double zScore(Double raw) {
        if (raw == null || !Double.isFinite(raw) || isDegenerate()) {
            return 0.0;
        }
        double z = (raw - mean) / std;
        if (!Double.isFinite(z)) {
            return z > 0 ? Z_CLIP : (z < 0 ? -Z_CLIP : 0.0);
        }
        return clamp(z, -Z_CLIP, Z_CLIP);
    }

    public double normalize(Double raw) {
        double scaled = (zScore(raw) + Z_CLIP) * NormalizedFactorSet.MAX / (2.0 * Z_CLIP);
        return clamp(scaled, NormalizedFactorSet.MIN, NormalizedFactorSet.MAX);
    }

    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
