package org.nowstart.perpbot.strategy.core;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-coin decision state owned by the control loop. Only the loop thread mutates it.
 */
public class AgentState {

    private final Map<String, Double> peakPnlByCoin = new HashMap<>();
    private final Map<String, Boolean> squeezeFormingByCoin = new HashMap<>();
    private final Map<String, Instant> entryTimeByCoin = new HashMap<>();

    public double peakPnl(String coin) {
        return peakPnlByCoin.getOrDefault(coin, 0.0);
    }

    /**
     * Raises the stored high-water mark when {@code pnl} exceeds it and returns the resulting peak.
     */
    public double trackPeak(String coin, double pnl) {
        double previous = peakPnl(coin);
        if (pnl > previous) {
            peakPnlByCoin.put(coin, pnl);
            return pnl;
        }
        return previous;
    }

    public boolean isSqueezeForming(String coin) {
        return squeezeFormingByCoin.getOrDefault(coin, false);
    }

    public void markSqueezeForming(String coin, boolean forming) {
        squeezeFormingByCoin.put(coin, forming);
    }

    public Optional<Instant> entryTime(String coin) {
        return Optional.ofNullable(entryTimeByCoin.get(coin));
    }

    public void openPosition(String coin, Instant openedAt) {
        peakPnlByCoin.put(coin, 0.0);
        entryTimeByCoin.put(coin, openedAt);
    }

    public void closePosition(String coin) {
        peakPnlByCoin.remove(coin);
        entryTimeByCoin.remove(coin);
    }

    public void clear() {
        peakPnlByCoin.clear();
        squeezeFormingByCoin.clear();
        entryTimeByCoin.clear();
    }
}
