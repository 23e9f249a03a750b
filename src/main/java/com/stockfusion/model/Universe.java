package com.stockfusion.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The ordered set of stocks scored together in one run. Cross-sectional statistics are
 * computed over its members. A repeated stock id keeps its first FactorSet.
 */
public final class Universe {
    private final List<FactorSet> members;
    private final Set<String> factorKeys;
    private final List<String> duplicateIds;

    private Universe(List<FactorSet> members, Set<String> factorKeys, List<String> duplicateIds) {
        this.members = members;
        this.factorKeys = factorKeys;
        this.duplicateIds = duplicateIds;
    }

    public static Universe of(List<FactorSet> factorSets) {
        Map<String, FactorSet> byId = new LinkedHashMap<>();
        Set<String> keys = new LinkedHashSet<>();
        List<String> duplicates = new ArrayList<>();
        if (factorSets != null) {
            for (FactorSet set : factorSets) {
                if (set == null) {
                    continue;
                }
                if (byId.containsKey(set.stockId)) {
                    duplicates.add(set.stockId);
                    continue;
                }
                byId.put(set.stockId, set);
                keys.addAll(set.keys());
            }
        }
        return new Universe(
                List.copyOf(byId.values()),
                Collections.unmodifiableSet(keys),
                List.copyOf(duplicates)
        );
    }

    public List<FactorSet> members() {
        return members;
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    /**
     * Union of factor keys over all members, in first-seen order.
     */
    public Set<String> factorKeys() {
        return factorKeys;
    }

    public List<String> duplicateIds() {
        return duplicateIds;
    }
}
