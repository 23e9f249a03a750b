package com.stockfusion.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Factor values of one stock mapped into [0, 100], 50 meaning neutral. Keeps the raw set
 * for rationale checks on pre-normalization values.
 */
public final class NormalizedFactorSet {
    public static final double NEUTRAL = 50.0;
    public static final double MIN = 0.0;
    public static final double MAX = 100.0;

    public final String stockId;
    private final Map<String, Double> values;
    private final FactorSet raw;

    public NormalizedFactorSet(FactorSet raw, Map<String, Double> values) {
        this.raw = raw;
        this.stockId = raw.stockId;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * Normalized value for {@code key}, or {@code null} when the key is not in the set.
     */
    public Double value(String key) {
        return values.get(key);
    }

    public Map<String, Double> values() {
        return values;
    }

    public FactorSet raw() {
        return raw;
    }
}
