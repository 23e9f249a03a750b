package com.stockfusion.model;

import java.util.Locale;

public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
