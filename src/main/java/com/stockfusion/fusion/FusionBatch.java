package com.stockfusion.fusion;

import com.stockfusion.core.diagnostics.CauseCode;
import com.stockfusion.model.FusionResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fused results of one universe in input order, plus the stocks that produced none.
 */
public final class FusionBatch {
    public final List<FusionResult> results;
    public final Map<String, CauseCode> excluded;
    public final Map<String, CauseCode> failed;

    public FusionBatch(List<FusionResult> results, Map<String, CauseCode> excluded, Map<String, CauseCode> failed) {
        this.results = results == null ? List.of() : List.copyOf(results);
        this.excluded = excluded == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(excluded));
        this.failed = failed == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(failed));
    }

    public int excludedCount() {
        return excluded.size();
    }

    public int failedCount() {
        return failed.size();
    }
}
