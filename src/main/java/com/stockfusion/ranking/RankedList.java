package com.stockfusion.ranking;

import com.stockfusion.core.diagnostics.CauseCode;
import com.stockfusion.model.Recommendation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class RankedList {
    public final List<Recommendation> recommendations;
    /** Stocks removed by a validity rule, with the reason. */
    public final Map<String, CauseCode> dropped;
    /** Ids that appeared more than once; only the best-ordered entry was kept. */
    public final List<String> duplicateIds;

    public RankedList(List<Recommendation> recommendations, Map<String, CauseCode> dropped, List<String> duplicateIds) {
        this.recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        this.dropped = dropped == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(dropped));
        this.duplicateIds = duplicateIds == null ? List.of() : List.copyOf(duplicateIds);
    }

    public int size() {
        return recommendations.size();
    }
}
