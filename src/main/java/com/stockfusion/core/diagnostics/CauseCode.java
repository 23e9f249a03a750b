package com.stockfusion.core.diagnostics;

/**
 * Why a stock did not reach the output. Exclusions are normal filtering; failures are
 * records that could not be processed and are counted as skipped.
 */
public enum CauseCode {
    NONE(false),
    ML_UNAVAILABLE(false),
    ML_BELOW_THRESHOLD(false),
    FACTOR_BELOW_THRESHOLD(false),
    SCORE_NOT_POSITIVE(false),
    PRICE_INVALID(false),
    CHANGE_OUT_OF_RANGE(false),
    NON_FINITE_SCORE(true),
    INVALID_RECORD(true),
    RUNTIME_ERROR(true);

    private final boolean failure;

    CauseCode(boolean failure) {
        this.failure = failure;
    }

    public boolean isFailure() {
        return failure;
    }

    public boolean isExclusion() {
        return this != NONE && !failure;
    }
}
