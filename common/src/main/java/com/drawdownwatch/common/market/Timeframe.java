package com.drawdownwatch.common.market;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Lookback windows for historical baselines.
 */
public enum Timeframe {
    ONE_DAY("1d", 1),
    ONE_WEEK("1w", 7),
    ONE_MONTH("1m", 30),
    THREE_MONTHS("3m", 90),
    SIX_MONTHS("6m", 180),
    ONE_YEAR("1y", 365);

    /** Timeframes the drawdown detector compares against. */
    public static final List<Timeframe> DETECTION = List.of(ONE_DAY, ONE_WEEK, ONE_MONTH, ONE_YEAR);

    private final String code;
    private final int lookbackDays;

    Timeframe(String code, int lookbackDays) {
        this.code = code;
        this.lookbackDays = lookbackDays;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public int lookbackDays() {
        return lookbackDays;
    }

    @JsonCreator
    public static Timeframe fromCode(String code) {
        return Arrays.stream(values())
                .filter(t -> t.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown timeframe: " + code));
    }
}
