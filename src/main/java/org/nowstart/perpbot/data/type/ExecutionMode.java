package org.nowstart.perpbot.data.type;

public enum ExecutionMode {
    LIVE,
    PAPER;

    public String tradeLogMode() {
        return this == LIVE ? "live" : "simulated";
    }
}
