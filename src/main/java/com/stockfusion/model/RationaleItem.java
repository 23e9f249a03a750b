package com.stockfusion.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * One triggered threshold check on a raw factor value.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class RationaleItem {
    public final String category;
    public final String factor;
    public final double rawValue;
    public final String operator;
    public final double threshold;
    public final String message;
}
