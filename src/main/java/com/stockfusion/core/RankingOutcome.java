package com.stockfusion.core;

import com.stockfusion.core.diagnostics.CauseCode;
import com.stockfusion.model.Recommendation;
import com.stockfusion.model.RunSummary;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class RankingOutcome {
    public final List<Recommendation> recommendations;
    public final RunSummary summary;
    /** Stocks filtered out on purpose by a fusion threshold or a validity rule. */
    public final Map<String, CauseCode> excluded;
    /** Stocks that could not be processed. */
    public final Map<String, CauseCode> skipped;
    /** Repeated stock ids; the best entry of each was kept. */
    public final List<String> duplicateIds;
    public final Instant generatedAt;
    public final long elapsedMs;

    public RankingOutcome(
            List<Recommendation> recommendations,
            RunSummary summary,
            Map<String, CauseCode> excluded,
            Map<String, CauseCode> skipped,
            List<String> duplicateIds,
            Instant generatedAt,
            long elapsedMs
    ) {
        this.recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        this.summary = summary;
        this.excluded = excluded == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(excluded));
        this.skipped = skipped == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(skipped));
        this.duplicateIds = duplicateIds == null ? List.of() : List.copyOf(duplicateIds);
        this.generatedAt = generatedAt;
        this.elapsedMs = elapsedMs;
    }

    public boolean isEmpty() {
        return recommendations.isEmpty();
    }
}
