package org.nowstart.perpbot.strategy.core;

/**
 * Profit-side exit thresholds expressed as fractions of entry notional.
 */
public record ExitThresholds(
        double trailArm,
        double trailTrigger,
        double takeProfitCap
) {

    public static final ExitThresholds VOLATILE = new ExitThresholds(0.02, 0.008, 0.05);
    public static final ExitThresholds STANDARD = new ExitThresholds(0.012, 0.005, 0.03);
    public static final ExitThresholds CONTRARIAN = new ExitThresholds(0.005, 0.002, 0.015);

    public static final double CONTRARIAN_STOP_LOSS = -0.015;
    public static final double CONTRARIAN_TIME_STOP_HOURS = 2.0;
    public static final double TIME_STOP_HOURS = 4.0;
    public static final double FLAT_PNL_BAND = 0.005;

    public static ExitThresholds forCoin(String coin) {
        return VolatileCoins.contains(coin) ? VOLATILE : STANDARD;
    }
}
