package com.stockfusion.scoring;

import com.stockfusion.model.RationaleItem;

import java.util.List;

/**
 * A threshold check on a raw factor value that adds a message to the rationale of the
 * category the factor is weighted under. Rules never influence the numeric score.
 */
public final class RationaleRule {
    public enum Operator {
        GREATER_THAN(">"),
        LESS_THAN("<");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        boolean test(double value, double threshold) {
            return this == GREATER_THAN ? value > threshold : value < threshold;
        }
    }

    private static final List<RationaleRule> DEFAULTS = List.of(
            gt("rsi", 70, "RSI overbought"),
            lt("rsi", 30, "RSI oversold"),
            gt("momentum_5d", 5, "{factor} strong uptrend"),
            lt("momentum_5d", -5, "{factor} weak downtrend"),
            gt("momentum_10d", 5, "{factor} strong uptrend"),
            lt("momentum_10d", -5, "{factor} weak downtrend"),
            gt("momentum_20d", 5, "{factor} strong uptrend"),
            lt("momentum_20d", -5, "{factor} weak downtrend"),
            gt("volume_spike", 0, "volume spike"),
            gt("volume_ratio", 2, "volume expanding"),
            gt("turnover_rate", 5, "high turnover"),
            gt("main_inflow_score", 60, "main capital net inflow"),
            gt("large_inflow_score", 60, "large orders net inflow"),
            gt("news_sentiment_score", 70, "positive news sentiment"),
            gt("market_sentiment_score", 60, "optimistic market sentiment"),
            gt("volatility_20d", 30, "high volatility"),
            gt("price_stability", 70, "price relatively stable"),
            gt("macd", 0, "MACD above zero"),
            gt("bollinger_position", 0.8, "near upper Bollinger band"),
            lt("bollinger_position", 0.2, "near lower Bollinger band")
    );

    public final String factor;
    public final Operator operator;
    public final double threshold;
    public final String template;

    public RationaleRule(String factor, Operator operator, double threshold, String template) {
        this.factor = factor;
        this.operator = operator;
        this.threshold = threshold;
        this.template = template == null ? "" : template;
    }

    public static RationaleRule gt(String factor, double threshold, String template) {
        return new RationaleRule(factor, Operator.GREATER_THAN, threshold, template);
    }

    public static RationaleRule lt(String factor, double threshold, String template) {
        return new RationaleRule(factor, Operator.LESS_THAN, threshold, template);
    }

    public static List<RationaleRule> defaults() {
        return DEFAULTS;
    }

    public boolean matches(double rawValue) {
        return Double.isFinite(rawValue) && operator.test(rawValue, threshold);
    }

    public RationaleItem toItem(String category, double rawValue) {
        return new RationaleItem(
                category,
                factor,
                rawValue,
                operator.symbol(),
                threshold,
                template.replace("{factor}", factor)
        );
    }
}
