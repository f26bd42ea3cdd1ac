package org.nowstart.perpbot.data.type;

public enum RiskVerdict {
    CONTINUE,
    CIRCUIT_BREAKER,
    SESSION_TIMEOUT;

    public boolean isTerminal() {
        return this != CONTINUE;
    }
}
