package com.stockfusion.model;

/**
 * Display metadata passed through to a recommendation. {@code volatility} is optional
 * and only used to blend into the risk level.
 */
public final class StockSnapshot {
    public final String stockId;
    public final String name;
    public final double lastPrice;
    public final double changePct;
    public final Double volatility;

    public StockSnapshot(String stockId, String name, double lastPrice, double changePct, Double volatility) {
        this.stockId = stockId;
        this.name = name == null ? "" : name;
        this.lastPrice = lastPrice;
        this.changePct = changePct;
        this.volatility = volatility;
    }

    public StockSnapshot(String stockId, String name, double lastPrice, double changePct) {
        this(stockId, name, lastPrice, changePct, null);
    }
}
