package com.stockfusion.app;

import com.stockfusion.app.properties.RankingProperties;
import com.stockfusion.config.Config;
import com.stockfusion.config.RankingConfig;
import com.stockfusion.core.RecommendationPipeline;
import com.stockfusion.fusion.FusionEngine;
import com.stockfusion.ranking.RecommendationJsonBuilder;
import com.stockfusion.ranking.RecommendationRanker;
import com.stockfusion.ranking.RunSummaryBuilder;
import com.stockfusion.scoring.CategoryScorer;
import com.stockfusion.scoring.FactorNormalizer;
import com.stockfusion.scoring.WeightedScorer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Clock;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@EnableConfigurationProperties({RankingProperties.class})
public class RankingBootstrapConfig {
    private static final List<String> CONFIG_PREFIXES = List.of("fusion", "ranking", "scoring", "weights");

    @Bean
    public Config rankingRawConfig(Environment environment) {
        Binder binder = Binder.get(environment);
        Map<String, Object> rawProperties = new LinkedHashMap<>();
        for (String prefix : CONFIG_PREFIXES) {
            Map<String, Object> section = binder
                    .bind(prefix, Bindable.mapOf(String.class, Object.class))
                    .orElseGet(Map::of);
            if (!section.isEmpty()) {
                rawProperties.put(prefix, section);
            }
        }
        return Config.fromConfigurationProperties(rawProperties);
    }

    /**
     * Fails context startup on an unknown fusion method or a malformed weight.
     */
    @Bean
    public RankingConfig rankingConfig(Config rankingRawConfig) {
        return RankingConfig.fromConfig(rankingRawConfig);
    }

    @Bean
    public FactorNormalizer factorNormalizer() {
        return new FactorNormalizer();
    }

    @Bean
    public WeightedScorer weightedScorer(RankingConfig rankingConfig) {
        return new WeightedScorer(new CategoryScorer(rankingConfig.contributionBasis));
    }

    @Bean
    public FusionEngine fusionEngine() {
        return new FusionEngine();
    }

    @Bean
    public RecommendationRanker recommendationRanker() {
        return new RecommendationRanker();
    }

    @Bean
    public RunSummaryBuilder runSummaryBuilder() {
        return new RunSummaryBuilder();
    }

    @Bean
    public RecommendationJsonBuilder recommendationJsonBuilder() {
        return new RecommendationJsonBuilder();
    }

    @Bean
    public Clock rankingClock(RankingProperties rankingProperties) {
        String zone = rankingProperties.getZone();
        if (zone == null || zone.trim().isEmpty()) {
            return Clock.systemUTC();
        }
        return Clock.system(ZoneId.of(zone.trim()));
    }

    @Bean
    public RecommendationPipeline recommendationPipeline(
            RankingConfig rankingConfig,
            FactorNormalizer factorNormalizer,
            WeightedScorer weightedScorer,
            FusionEngine fusionEngine,
            RecommendationRanker recommendationRanker,
            RunSummaryBuilder runSummaryBuilder,
            RankingProperties rankingProperties,
            Clock rankingClock
    ) {
        return new RecommendationPipeline(
                rankingConfig,
                factorNormalizer,
                weightedScorer,
                fusionEngine,
                recommendationRanker,
                runSummaryBuilder,
                rankingProperties.getThreads(),
                rankingClock
        );
    }
}
