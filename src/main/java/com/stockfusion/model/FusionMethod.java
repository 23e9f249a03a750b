package com.stockfusion.model;

import java.util.Locale;

public enum FusionMethod {
    WEIGHTED_AVERAGE("weighted_average"),
    FILTER_FIRST("filter_first"),
    RANK_ADJUSTMENT("rank_adjustment"),
    CONSENSUS_BOOST("consensus_boost");

    private final String key;

    FusionMethod(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Resolves a configured method name. Unknown names are rejected rather than
     * mapped onto a default method.
     */
    public static FusionMethod fromKey(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (FusionMethod method : values()) {
            if (method.key.equals(normalized)) {
                return method;
            }
        }
        throw new IllegalArgumentException("unknown fusion method: '" + raw + "', expected one of "
                + "weighted_average, filter_first, rank_adjustment, consensus_boost");
    }
}
