package org.nowstart.perpbot.data.type;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TradeSide {
    LONG("long"),
    SHORT("short");

    private final String wireName;

    TradeSide(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public TradeSide opposite() {
        return this == LONG ? SHORT : LONG;
    }

    public boolean isBuy() {
        return this == LONG;
    }

    public static TradeSide fromSignedSize(double signedSize) {
        return signedSize > 0 ? LONG : SHORT;
    }
}
