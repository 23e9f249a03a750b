package com.stockfusion.config;

import com.stockfusion.model.FusionMethod;
import com.stockfusion.scoring.ContributionBasis;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a ranking run needs, resolved and validated once. Configuration errors are
 * raised here, before any stock is scored.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class RankingConfig {
    public final FusionMethod method;
    public final FusionParams params;
    public final CategoryWeightTable weights;
    public final String weightProfile;
    public final ContributionBasis contributionBasis;
    public final ValidityRules validity;
    public final int topN;
    public final boolean includeDetails;

    public static RankingConfig defaults() {
        return new RankingConfig(
                FusionMethod.WEIGHTED_AVERAGE,
                FusionParams.defaults(),
                CategoryWeightTable.defaultTable(),
                "default",
                ContributionBasis.CENTERED,
                ValidityRules.defaults(),
                10,
                true
        );
    }

    public static RankingConfig fromConfig(Config config) {
        FusionMethod method = FusionMethod.fromKey(config.getString("fusion.method"));
        int topN = config.getInt("ranking.top_n", 10);
        if (topN < 1) {
            throw new IllegalArgumentException("ranking.top_n must be >= 1: " + topN);
        }
        String profile = config.getString("weights.profile", "default");
        return new RankingConfig(
                method,
                FusionParams.fromConfig(config),
                CategoryWeightTable.fromConfig(config, profile),
                profile,
                ContributionBasis.fromKey(config.getString("scoring.contribution_basis", "centered")),
                ValidityRules.fromConfig(config),
                topN,
                config.getBoolean("ranking.include_details", true)
        );
    }
}
