package org.nowstart.perpbot.strategy;

import static org.nowstart.perpbot.strategy.core.DecisionText.fixed;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.nowstart.perpbot.data.dto.IndicatorSnapshot;
import org.nowstart.perpbot.data.dto.NearMiss;
import org.nowstart.perpbot.data.dto.SentimentSignal;
import org.nowstart.perpbot.data.type.MarketRegime;
import org.nowstart.perpbot.data.type.SentimentSignalType;
import org.nowstart.perpbot.data.type.TradeSide;
import org.springframework.stereotype.Component;

/**
 * Finds entries that almost fired. A candidate qualifies only when one or two of its gates failed.
 */
@Component
public class NearMissDetector {

    static final int MAX_FAILED_GATES = 2;

    public List<NearMiss> detect(IndicatorSnapshot ind1h, Instant now) {
        List<NearMiss> misses = new ArrayList<>();
        MarketRegime regime = ind1h.regime();
        IndicatorSnapshot.Adx adx = ind1h.adx();
        double rsi = ind1h.rsi();
        double histogram = ind1h.macd().histogram();

        if (regime.isTrending() && adx.value() > 20 && adx.plusDi() > adx.minusDi()) {
            List<String> failed = new ArrayList<>();
            if (adx.value() <= 25) {
                failed.add("ADX " + fixed(adx.value(), 1) + " ≤ 25");
            }
            if (rsi <= 45) {
                failed.add("RSI " + fixed(rsi, 1) + " ≤ 45");
            }
            if (histogram <= 0) {
                failed.add("MACD hist " + fixed(histogram, 4) + " ≤ 0");
            }
            if (isNear(failed)) {
                misses.add(NearMiss.of(ind1h, TradeSide.LONG, "R3-trend", now,
                        "Bullish DI in trending regime, almost R3", String.join("; ", failed)));
            }
        }

        if (adx.value() > 18 && adx.minusDi() > adx.plusDi()) {
            double diSpread = adx.minusDi() - adx.plusDi();
            List<String> failed = new ArrayList<>();
            if (adx.value() <= 22) {
                failed.add("ADX " + fixed(adx.value(), 1) + " ≤ 22");
            } else if (adx.value() <= 25 && diSpread <= 8) {
                failed.add("ADX " + fixed(adx.value(), 1) + " ≤ 25, DI spread " + fixed(diSpread, 1) + " ≤ 8");
            }
            if (rsi >= 50) {
                failed.add("RSI " + fixed(rsi, 1) + " ≥ 50");
            }
            if (histogram >= 0.05) {
                failed.add("MACD hist " + fixed(histogram, 4) + " ≥ 0.05");
            }
            if (isNear(failed)) {
                misses.add(NearMiss.of(ind1h, TradeSide.SHORT, "R4-trend", now,
                        "Bearish DI, almost R4 (DI spread " + fixed(diSpread, 1) + ")", String.join("; ", failed)));
            }
        }

        if (regime.isRangeBound()) {
            if (rsi > 25 && rsi < 35) {
                misses.add(NearMiss.of(ind1h, TradeSide.LONG, "R1-mean-reversion", now,
                        "RSI " + fixed(rsi, 1) + " approaching oversold (< 30)", "RSI " + fixed(rsi, 1) + " > 30"));
            }
            if (rsi > 65 && rsi < 75) {
                misses.add(NearMiss.of(ind1h, TradeSide.SHORT, "R2-mean-reversion", now,
                        "RSI " + fixed(rsi, 1) + " approaching overbought (> 70)", "RSI " + fixed(rsi, 1) + " < 70"));
            }
        }

        if (regime.isRangeBound() && adx.value() > 18) {
            String regimeName = regime.wireName();
            if (adx.minusDi() - adx.plusDi() > 5 && rsi < 50 && adx.value() < 22) {
                misses.add(NearMiss.of(ind1h, TradeSide.SHORT, "R4-trend", now,
                        "Strong bearish DI but regime=" + regimeName + " (ADX too low)",
                        "ADX " + fixed(adx.value(), 1) + " < 22, regime=" + regimeName));
            }
            if (adx.plusDi() - adx.minusDi() > 5 && rsi > 50 && adx.value() < 25) {
                misses.add(NearMiss.of(ind1h, TradeSide.LONG, "R3-trend", now,
                        "Strong bullish DI but regime=" + regimeName + " (ADX transitional)",
                        "ADX " + fixed(adx.value(), 1) + " < 25, regime=" + regimeName));
            }
        }
        return misses;
    }

    /**
     * Sentiment signals without technical backing, recorded so their outcome can be judged later.
     */
    public List<NearMiss> detectSentimentOnly(IndicatorSnapshot ind1h, List<SentimentSignal> coinSignals, Instant now) {
        List<NearMiss> misses = new ArrayList<>();
        for (SentimentSignal signal : coinSignals) {
            if (signal.type() == SentimentSignalType.ALERT) {
                continue;
            }
            TradeSide side = signal.type() == SentimentSignalType.BULLISH ? TradeSide.LONG : TradeSide.SHORT;
            misses.add(NearMiss.of(ind1h, side, "SENTIMENT-" + signal.type().label(), now,
                    signal.reason(), "No technical signal"));
        }
        return misses;
    }

    private static boolean isNear(List<String> failedGates) {
        return !failedGates.isEmpty() && failedGates.size() <= MAX_FAILED_GATES;
    }
}
