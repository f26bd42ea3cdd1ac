package org.nowstart.perpbot.data.type;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StrategyCategory {
    TREND("trend"),
    MEAN_REVERSION("mean-reversion"),
    BREAKOUT("breakout"),
    SENTIMENT_CONFIRMED("sentiment-confirmed"),
    CONTRARIAN("contrarian");

    private final String wireName;

    StrategyCategory(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
