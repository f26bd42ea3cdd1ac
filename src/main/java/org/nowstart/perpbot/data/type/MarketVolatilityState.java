package org.nowstart.perpbot.data.type;

public enum MarketVolatilityState {
    NORMAL(1.0),
    ELEVATED(0.5),
    SPIKE(0.33);

    private final double sleepMultiplier;

    MarketVolatilityState(double sleepMultiplier) {
        this.sleepMultiplier = sleepMultiplier;
    }

    public double sleepMultiplier() {
        return sleepMultiplier;
    }
}
