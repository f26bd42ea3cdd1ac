package org.nowstart.perpbot.data.type;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MarketRegime {
    QUIET("quiet"),
    RANGING("ranging"),
    TRENDING("trending"),
    VOLATILE_TREND("volatile_trend");

    private final String wireName;

    MarketRegime(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTrending() {
        return this == TRENDING || this == VOLATILE_TREND;
    }

    public boolean isRangeBound() {
        return this == QUIET || this == RANGING;
    }

    public static MarketRegime classify(double adx, double bollingerWidth) {
        if (adx > 25) {
            return bollingerWidth > 0.06 ? VOLATILE_TREND : TRENDING;
        }
        return bollingerWidth < 0.03 ? QUIET : RANGING;
    }
}
