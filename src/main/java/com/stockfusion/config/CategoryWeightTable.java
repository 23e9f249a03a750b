package com.stockfusion.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Factor weights grouped by category. A factor belongs to at most one category; factors
 * under {@link #RESIDUAL} are weighted but not grouped.
 */
public final class CategoryWeightTable {
    private static final Logger LOG = LogManager.getLogger(CategoryWeightTable.class);

    public static final String MOMENTUM = "momentum";
    public static final String VOLUME = "volume";
    public static final String CAPITAL_FLOW = "capital_flow";
    public static final String SENTIMENT = "sentiment";
    public static final String RISK = "risk";
    public static final String TECHNICAL = "technical";
    public static final String RESIDUAL = "residual";

    private static final List<String> CANONICAL_ORDER = List.of(
            MOMENTUM,
            VOLUME,
            CAPITAL_FLOW,
            SENTIMENT,
            RISK,
            TECHNICAL
    );

    private final Map<String, Map<String, Double>> categories;
    private final Map<String, Double> residual;

    private CategoryWeightTable(Map<String, Map<String, Double>> categories, Map<String, Double> residual) {
        this.categories = categories;
        this.residual = residual;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CategoryWeightTable defaultTable() {
        return builder()
                .put(MOMENTUM, "momentum_5d", 0.10)
                .put(MOMENTUM, "momentum_10d", 0.10)
                .put(MOMENTUM, "momentum_20d", 0.10)
                .put(MOMENTUM, "rsi", 0.05)
                .put(VOLUME, "volume_ratio", 0.08)
                .put(VOLUME, "volume_spike", 0.07)
                .put(VOLUME, "turnover_rate", 0.05)
                .put(CAPITAL_FLOW, "main_inflow_score", 0.10)
                .put(CAPITAL_FLOW, "large_inflow_score", 0.05)
                .put(CAPITAL_FLOW, "capital_strength", 0.05)
                .put(SENTIMENT, "news_sentiment_score", 0.08)
                .put(SENTIMENT, "market_sentiment_score", 0.04)
                .put(SENTIMENT, "overall_sentiment", 0.05)
                .put(RISK, "volatility_20d", -0.05)
                .put(RISK, "price_stability", 0.03)
                .put(TECHNICAL, "macd", 0.05)
                .put(TECHNICAL, "bollinger_position", 0.03)
                .residual("change_pct", 0.02)
                .build();
    }

    /**
     * Reads {@code weights.<profile>.<category>.<factor>=<weight>} entries. Falls back to
     * {@link #defaultTable()} when the profile has no entries.
     */
    public static CategoryWeightTable fromConfig(Config config, String profile) {
        String prefix = "weights." + profile + ".";
        Set<String> keys = config.keysWithPrefix(prefix);
        if (keys.isEmpty()) {
            LOG.info("no weights configured for profile '{}', using built-in table", profile);
            return defaultTable();
        }
        Builder builder = builder();
        for (String key : keys) {
            String rest = key.substring(prefix.length());
            int dot = rest.indexOf('.');
            if (dot <= 0 || dot == rest.length() - 1) {
                throw new IllegalArgumentException("weight key must be " + prefix + "<category>.<factor>: " + key);
            }
            String category = rest.substring(0, dot);
            String factor = rest.substring(dot + 1);
            double weight = parseWeight(key, config.getString(key));
            if (RESIDUAL.equals(category)) {
                builder.residual(factor, weight);
            } else {
                builder.put(category, factor, weight);
            }
        }
        return builder.build();
    }

    private static double parseWeight(String key, String raw) {
        double weight;
        try {
            weight = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid weight for " + key + ": '" + raw + "'", e);
        }
        if (!Double.isFinite(weight)) {
            throw new IllegalArgumentException("weight must be finite for " + key + ": " + raw);
        }
        return weight;
    }

    public Set<String> categories() {
        return categories.keySet();
    }

    public Map<String, Double> members(String category) {
        return categories.getOrDefault(category, Map.of());
    }

    public Map<String, Double> residual() {
        return residual;
    }

    public Double weightOf(String factor) {
        for (Map<String, Double> members : categories.values()) {
            Double weight = members.get(factor);
            if (weight != null) {
                return weight;
            }
        }
        return residual.get(factor);
    }

    public String categoryOf(String factor) {
        for (Map.Entry<String, Map<String, Double>> entry : categories.entrySet()) {
            if (entry.getValue().containsKey(factor)) {
                return entry.getKey();
            }
        }
        return residual.containsKey(factor) ? RESIDUAL : null;
    }

    /**
     * Flat view {@code category.factor -> weight}, used for audit output.
     */
    public Map<String, Double> flatten() {
        Map<String, Double> out = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Double>> entry : categories.entrySet()) {
            for (Map.Entry<String, Double> member : entry.getValue().entrySet()) {
                out.put(entry.getKey() + "." + member.getKey(), member.getValue());
            }
        }
        for (Map.Entry<String, Double> member : residual.entrySet()) {
            out.put(RESIDUAL + "." + member.getKey(), member.getValue());
        }
        return out;
    }

    public static final class Builder {
        private final Map<String, Map<String, Double>> categories = new LinkedHashMap<>();
        private final Map<String, Double> residual = new LinkedHashMap<>();
        private final Map<String, String> owner = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String category, String factor, double weight) {
            String cat = requireName(category, "category");
            if (RESIDUAL.equals(cat)) {
                return residual(factor, weight);
            }
            String name = claim(factor, cat);
            categories.computeIfAbsent(cat, ignored -> new LinkedHashMap<>()).put(name, weight);
            return this;
        }

        public Builder residual(String factor, double weight) {
            String name = claim(factor, RESIDUAL);
            residual.put(name, weight);
            return this;
        }

        /**
         * Registers a category with no members; it scores zero with an empty rationale.
         */
        public Builder category(String category) {
            String cat = requireName(category, "category");
            if (!RESIDUAL.equals(cat)) {
                categories.computeIfAbsent(cat, ignored -> new LinkedHashMap<>());
            }
            return this;
        }

        public CategoryWeightTable build() {
            Map<String, Map<String, Double>> ordered = new LinkedHashMap<>();
            for (String cat : CANONICAL_ORDER) {
                Map<String, Double> members = categories.get(cat);
                if (members != null) {
                    ordered.put(cat, Collections.unmodifiableMap(new LinkedHashMap<>(members)));
                }
            }
            List<String> others = new ArrayList<>(categories.keySet());
            others.removeAll(CANONICAL_ORDER);
            Collections.sort(others);
            for (String cat : others) {
                ordered.put(cat, Collections.unmodifiableMap(new LinkedHashMap<>(categories.get(cat))));
            }
            return new CategoryWeightTable(
                    Collections.unmodifiableMap(ordered),
                    Collections.unmodifiableMap(new LinkedHashMap<>(residual))
            );
        }

        private String claim(String factor, String category) {
            String name = requireName(factor, "factor");
            String previous = owner.putIfAbsent(name, category);
            if (previous != null && !previous.equals(category)) {
                throw new IllegalArgumentException("factor '" + name + "' assigned to both "
                        + previous + " and " + category);
            }
            return name;
        }

        private static String requireName(String value, String what) {
            if (value == null || value.trim().isEmpty()) {
                throw new IllegalArgumentException(what + " name must not be blank");
            }
            return value.trim();
        }
    }
}
