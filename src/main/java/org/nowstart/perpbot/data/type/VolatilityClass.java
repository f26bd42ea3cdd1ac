package org.nowstart.perpbot.data.type;

public enum VolatilityClass {
    CALM,
    NORMAL,
    ELEVATED,
    SPIKE;

    public boolean isHot() {
        return this == ELEVATED || this == SPIKE;
    }
}
