package com.stockfusion.core;

import com.stockfusion.config.RankingConfig;
import com.stockfusion.core.diagnostics.CauseCode;
import com.stockfusion.core.diagnostics.Outcome;
import com.stockfusion.fusion.FusionBatch;
import com.stockfusion.fusion.FusionEngine;
import com.stockfusion.model.FactorSet;
import com.stockfusion.model.FusionInput;
import com.stockfusion.model.NormalizedFactorSet;
import com.stockfusion.model.RunSummary;
import com.stockfusion.model.StockSnapshot;
import com.stockfusion.model.Universe;
import com.stockfusion.ranking.RankedList;
import com.stockfusion.ranking.RecommendationRanker;
import com.stockfusion.ranking.RunSummaryBuilder;
import com.stockfusion.scoring.CategoryScorer;
import com.stockfusion.scoring.FactorNormalizer;
import com.stockfusion.scoring.ScoredStock;
import com.stockfusion.scoring.WeightedScorer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * One ranking run: normalize the universe, score each stock, fuse with the model
 * probability, then validate and rank. Holds only immutable configuration, so one
 * instance can serve concurrent runs over different universes.
 */
public final class RecommendationPipeline {
    private static final Logger LOG = LogManager.getLogger(RecommendationPipeline.class);

    private final RankingConfig config;
    private final FactorNormalizer normalizer;
    private final WeightedScorer scorer;
    private final FusionEngine fusionEngine;
    private final RecommendationRanker ranker;
    private final RunSummaryBuilder summaryBuilder;
    private final int threads;
    private final Clock clock;

    public RecommendationPipeline(RankingConfig config) {
        this(config, 1, Clock.systemUTC());
    }

    public RecommendationPipeline(RankingConfig config, int threads, Clock clock) {
        this(
                config,
                new FactorNormalizer(),
                new WeightedScorer(new CategoryScorer(config.contributionBasis)),
                new FusionEngine(),
                new RecommendationRanker(),
                new RunSummaryBuilder(),
                threads,
                clock
        );
    }

    public RecommendationPipeline(
            RankingConfig config,
            FactorNormalizer normalizer,
            WeightedScorer scorer,
            FusionEngine fusionEngine,
            RecommendationRanker ranker,
            RunSummaryBuilder summaryBuilder,
            int threads,
            Clock clock
    ) {
        this.config = config;
        this.normalizer = normalizer;
        this.scorer = scorer;
        this.fusionEngine = fusionEngine;
        this.ranker = ranker;
        this.summaryBuilder = summaryBuilder;
        this.threads = Math.max(1, threads);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public RankingConfig config() {
        return config;
    }

    /**
     * Runs normalize, score, fuse and rank over one universe.
     *
     * <p>A stock that fails scoring or fusion is reported in {@code skipped}; one filtered
     * out on purpose is reported in {@code excluded}. Neither stops the run.
     */
    public RankingOutcome run(RankingRequest request) {
        long startedNanos = System.nanoTime();
        Instant generatedAt = clock.instant();
        Universe universe = request.universe;

        Map<String, CauseCode> excluded = new LinkedHashMap<>();
        Map<String, CauseCode> skipped = new LinkedHashMap<>();
        List<String> duplicates = new ArrayList<>();
        for (String duplicate : universe.duplicateIds()) {
            LOG.warn("duplicate stock id in universe, keeping first record: {}", duplicate);
            duplicates.add(duplicate);
        }

        Map<String, NormalizedFactorSet> normalized = normalizer.normalize(universe);
        List<Outcome<ScoredStock>> scored = scoreAll(universe, normalized);

        List<FusionInput> inputs = new ArrayList<>(scored.size());
        for (Outcome<ScoredStock> outcome : scored) {
            if (!outcome.success) {
                skipped.put(outcome.owner, outcome.causeCode);
                continue;
            }
            ScoredStock stock = outcome.value;
            StockSnapshot snapshot = request.snapshot(stock.stockId);
            inputs.add(FusionInput.builder()
                    .stockId(stock.stockId)
                    .totalScore(stock.totalScore)
                    .mlProbability(request.mlProbability(stock.stockId))
                    .volatility(snapshot == null ? null : snapshot.volatility)
                    .breakdown(stock.breakdown)
                    .build());
        }

        FusionBatch batch = fusionEngine.fuseAll(inputs, config.method, config.params);
        excluded.putAll(batch.excluded);
        skipped.putAll(batch.failed);

        RankedList ranked = ranker.rank(batch.results, request.snapshots, config.topN, config.validity, generatedAt);
        excluded.putAll(ranked.dropped);
        for (String duplicate : ranked.duplicateIds) {
            LOG.warn("duplicate fusion result dropped: {}", duplicate);
            duplicates.add(duplicate);
        }

        RunSummary summary = summaryBuilder.build(
                ranked.recommendations,
                config.method,
                universe.size(),
                excluded.size() + duplicates.size(),
                skipped.size()
        );
        long elapsedMs = (System.nanoTime() - startedNanos) / 1_000_000L;
        LOG.info("ranking run finished: {} elapsed_ms={}", summaryBuilder.describe(summary), elapsedMs);
        return new RankingOutcome(
                ranked.recommendations,
                summary,
                excluded,
                skipped,
                duplicates,
                generatedAt,
                elapsedMs
        );
    }

    private List<Outcome<ScoredStock>> scoreAll(Universe universe, Map<String, NormalizedFactorSet> normalized) {
        List<FactorSet> members = universe.members();
        if (threads <= 1 || members.size() <= 1) {
            List<Outcome<ScoredStock>> out = new ArrayList<>(members.size());
            for (FactorSet member : members) {
                out.add(new StockTask(member.stockId, normalized.get(member.stockId)).call());
            }
            return out;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, members.size()));
        try {
            List<Future<Outcome<ScoredStock>>> futures = new ArrayList<>(members.size());
            for (FactorSet member : members) {
                futures.add(pool.submit(new StockTask(member.stockId, normalized.get(member.stockId))));
            }
            List<Outcome<ScoredStock>> out = new ArrayList<>(members.size());
            for (int i = 0; i < futures.size(); i++) {
                String stockId = members.get(i).stockId;
                try {
                    out.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    LOG.warn("scoring task failed for {}: {}", stockId, e.getMessage());
                    out.add(Outcome.failure(CauseCode.RUNTIME_ERROR, stockId));
                }
            }
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("ranking run interrupted", e);
        } finally {
            pool.shutdown();
        }
    }

    private final class StockTask implements Callable<Outcome<ScoredStock>> {
        private final String stockId;
        private final NormalizedFactorSet normalized;

        private StockTask(String stockId, NormalizedFactorSet normalized) {
            this.stockId = stockId;
            this.normalized = normalized;
        }

        @Override
        public Outcome<ScoredStock> call() {
            if (normalized == null) {
                return Outcome.failure(CauseCode.INVALID_RECORD, stockId);
            }
            try {
                return Outcome.success(scorer.score(normalized, config.weights), stockId);
            } catch (RuntimeException e) {
                LOG.warn("scoring failed for {}: {}", stockId, e.getMessage(), e);
                return Outcome.failure(CauseCode.RUNTIME_ERROR, stockId);
            }
        }
    }
}
