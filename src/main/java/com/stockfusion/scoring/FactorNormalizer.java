package com.stockfusion.scoring;

import com.stockfusion.model.FactorSet;
import com.stockfusion.model.NormalizedFactorSet;
import com.stockfusion.model.Universe;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-sectional z-score normalization. Statistics are taken per factor key over the
 * whole universe of the current run and never reused across runs.
 */
public final class FactorNormalizer {
    private static final Logger LOG = LogManager.getLogger(FactorNormalizer.class);

    /**
     * Normalizes every member of {@code universe} to [0, 100]. A value missing or
     * non-finite for one stock gets the neutral 50; a key with zero spread is 50 for all.
     *
     * @return normalized factors keyed by stock id, in universe order
     */
    public Map<String, NormalizedFactorSet> normalize(Universe universe) {
        if (universe == null || universe.isEmpty()) {
            return Map.of();
        }
        Map<String, CrossSectionStats> stats = computeStats(universe);

        Map<String, NormalizedFactorSet> out = new LinkedHashMap<>();
        for (FactorSet set : universe.members()) {
            Map<String, Double> values = new LinkedHashMap<>();
            for (Map.Entry<String, CrossSectionStats> entry : stats.entrySet()) {
                values.put(entry.getKey(), entry.getValue().normalize(set.raw(entry.getKey())));
            }
            out.put(set.stockId, new NormalizedFactorSet(set, values));
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * The reduction step: one {@link CrossSectionStats} per factor key, over every member.
     */
    public Map<String, CrossSectionStats> computeStats(Universe universe) {
        Map<String, CrossSectionStats> stats = new LinkedHashMap<>();
        for (String key : universe.factorKeys()) {
            List<Double> column = new ArrayList<>(universe.size());
            for (FactorSet set : universe.members()) {
                column.add(set.raw(key));
            }
            CrossSectionStats keyStats = CrossSectionStats.of(column);
            if (keyStats.isDegenerate()) {
                LOG.debug("factor {} degenerate over {} stocks (finite={}), normalized to neutral",
                        key, universe.size(), keyStats.count);
            }
            stats.put(key, keyStats);
        }
        return stats;
    }
}
