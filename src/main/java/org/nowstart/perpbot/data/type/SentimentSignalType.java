package org.nowstart.perpbot.data.type;

public enum SentimentSignalType {
    BULLISH,
    BEARISH,
    ALERT;

    public String label() {
        return name().toLowerCase();
    }
}
