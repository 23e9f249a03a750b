package com.stockfusion.config;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * Post-fusion checks a result must pass to be listed.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ValidityRules {
    public enum ScoreField {
        TOTAL,
        FINAL
    }

    public final ScoreField scoreField;
    public final boolean requirePositiveScore;
    public final boolean requireValidPrice;
    /** Results with {@code |changePct| >= maxAbsChangePct} are dropped. */
    public final double maxAbsChangePct;

    public static ValidityRules defaults() {
        return new ValidityRules(ScoreField.TOTAL, true, true, 10.0);
    }

    public static ValidityRules fromConfig(Config config) {
        String field = config.getString("ranking.score_field", "total").toUpperCase(Locale.ROOT);
        ScoreField scoreField;
        try {
            scoreField = ScoreField.valueOf(field);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("ranking.score_field must be total or final: " + field, e);
        }
        double maxChange = config.getDouble("ranking.max_abs_change_pct", 10.0);
        if (!(maxChange > 0.0)) {
            throw new IllegalArgumentException("ranking.max_abs_change_pct must be positive: " + maxChange);
        }
        return new ValidityRules(
                scoreField,
                config.getBoolean("ranking.require_positive_score", true),
                config.getBoolean("ranking.require_valid_price", true),
                maxChange
        );
    }
}
