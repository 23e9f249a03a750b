package com.stockfusion.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Raw factor values of one stock for one evaluation run. A {@code null} value is the
 * explicit "missing" marker; NaN and infinite values are kept as given and treated as
 * invalid by the normalizer.
 */
public final class FactorSet {
    public final String stockId;
    private final Map<String, Double> values;

    public FactorSet(String stockId, Map<String, Double> values) {
        if (stockId == null || stockId.trim().isEmpty()) {
            throw new IllegalArgumentException("stockId must not be blank");
        }
        this.stockId = stockId.trim();
        Map<String, Double> copy = new LinkedHashMap<>();
        if (values != null) {
            for (Map.Entry<String, Double> entry : values.entrySet()) {
                if (entry.getKey() == null || entry.getKey().trim().isEmpty()) {
                    continue;
                }
                copy.put(entry.getKey().trim(), entry.getValue());
            }
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * Raw value for {@code key}, or {@code null} when absent or marked missing.
     */
    public Double raw(String key) {
        return values.get(key);
    }

    public boolean isFinite(String key) {
        Double value = values.get(key);
        return value != null && Double.isFinite(value);
    }

    public Map<String, Double> values() {
        return values;
    }
}
