package org.nowstart.perpbot.strategy;

import static org.nowstart.perpbot.strategy.core.DecisionText.fixed;
import static org.nowstart.perpbot.strategy.core.DecisionText.plain;

import java.util.List;
import java.util.Optional;
import java.util.function.DoubleSupplier;
import org.nowstart.perpbot.data.dto.IndicatorSnapshot;
import org.nowstart.perpbot.data.dto.SentimentSignal;
import org.nowstart.perpbot.data.dto.SentimentSnapshot;
import org.nowstart.perpbot.data.dto.Signal;
import org.nowstart.perpbot.data.type.SentimentSignalType;
import org.nowstart.perpbot.data.type.SignalStrength;
import org.nowstart.perpbot.data.type.StrategyCategory;
import org.nowstart.perpbot.data.type.TradeSide;
import org.nowstart.perpbot.strategy.core.ContrarianDecision;
import org.springframework.stereotype.Component;

/**
 * Entry rules that need a sentiment snapshot: relaxed R3, standalone R6, confidence boost and the contrarian flip.
 */
@Component
public class SentimentEntryRules {

    public static final double CONTRARIAN_DISCOUNT = 0.6;
    public static final double CONTRARIAN_FLOOR = 0.4;

    public Optional<Signal> sentimentAssistedTrend(IndicatorSnapshot ind1h, SentimentSnapshot sentiment) {
        if (sentiment == null) {
            return Optional.empty();
        }
        boolean strongBullish = sentiment.galaxyScore() > 70 || sentiment.sentiment() >= 80;
        IndicatorSnapshot.Adx adx = ind1h.adx();
        boolean matches = strongBullish
                && ind1h.regime().isTrending()
                && adx.value() > 25
                && adx.plusDi() > adx.minusDi()
                && ind1h.rsi() > 40
                && ind1h.rsi() <= 45
                && ind1h.macd().histogram() > 0;
        if (!matches) {
            return Optional.empty();
        }
        return Optional.of(new Signal(
                ind1h.coin(),
                TradeSide.LONG,
                "R3-trend",
                StrategyCategory.TREND,
                0.55,
                "Sentiment-assisted R3: RSI " + fixed(ind1h.rsi(), 1)
                        + " (relaxed from 45 due to sentiment=" + plain(sentiment.sentiment())
                        + "% galaxy=" + plain(sentiment.galaxyScore()) + ")"
        ));
    }

    public Optional<Signal> sentimentConfirmed(IndicatorSnapshot ind1h, SentimentSnapshot sentiment) {
        if (sentiment == null) {
            return Optional.empty();
        }
        IndicatorSnapshot.Adx adx = ind1h.adx();
        double rsi = ind1h.rsi();
        boolean extremeBullish = sentiment.galaxyScore() > 75 && sentiment.sentiment() >= 85;
        boolean extremeBearish = sentiment.galaxyScore() < 30 || sentiment.sentiment() <= 15;

        if (extremeBullish && adx.plusDi() > adx.minusDi() && rsi > 40 && rsi < 65) {
            return Optional.of(new Signal(
                    ind1h.coin(),
                    TradeSide.LONG,
                    "R6-sentiment",
                    StrategyCategory.SENTIMENT_CONFIRMED,
                    0.52,
                    "R6 sentiment-confirmed long: galaxy=" + plain(sentiment.galaxyScore())
                            + " sentiment=" + plain(sentiment.sentiment())
                            + "% +DI>" + fixed(adx.plusDi(), 1) + " RSI=" + fixed(rsi, 1)
            ));
        }
        if (extremeBearish && adx.minusDi() > adx.plusDi() && rsi > 35 && rsi < 60) {
            return Optional.of(new Signal(
                    ind1h.coin(),
                    TradeSide.SHORT,
                    "R6-sentiment",
                    StrategyCategory.SENTIMENT_CONFIRMED,
                    0.52,
                    "R6 sentiment-confirmed short: galaxy=" + plain(sentiment.galaxyScore())
                            + " sentiment=" + plain(sentiment.sentiment())
                            + "% -DI>" + fixed(adx.minusDi(), 1) + " RSI=" + fixed(rsi, 1)
            ));
        }
        return Optional.empty();
    }

    public Signal applyBoost(Signal signal, SentimentSnapshot sentiment, List<SentimentSignal> coinSignals) {
        if (sentiment == null) {
            return signal;
        }
        String galaxy = plain(sentiment.galaxyScore());
        if (signal.side() == TradeSide.LONG) {
            if (hasSignal(coinSignals, SentimentSignalType.BULLISH, true)) {
                return signal.boosted(0.1, "sentiment boost (galaxy=" + galaxy + ", "
                        + plain(sentiment.sentiment()) + "% positive)");
            }
            if (hasSignal(coinSignals, SentimentSignalType.BULLISH, false)) {
                return signal.boosted(0.05, "sentiment nudge (galaxy=" + galaxy + ")");
            }
            return signal;
        }
        if (hasSignal(coinSignals, SentimentSignalType.BEARISH, true)) {
            return signal.boosted(0.1, "sentiment boost (galaxy crashed to " + galaxy + ")");
        }
        if (hasSignal(coinSignals, SentimentSignalType.BEARISH, false)) {
            return signal.boosted(0.05, "sentiment nudge (bearish)");
        }
        return signal;
    }

    /**
     * Fades a signal taken at a sentiment extreme while RSI is already stretched in the same direction.
     *
     * @param openContrarian contrarian positions currently held
     * @param slots          maximum contrarian positions allowed at once
     * @param draw           uniform source in [0, 1), consulted only when the extremes line up
     */
    public ContrarianDecision contrarian(
            Signal signal,
            IndicatorSnapshot ind1h,
            SentimentSnapshot sentiment,
            double contrarianPct,
            int openContrarian,
            long slots,
            DoubleSupplier draw
    ) {
        if (contrarianPct <= 0 || sentiment == null) {
            return ContrarianDecision.unchanged(signal);
        }
        boolean euphoria = sentiment.sentiment() >= 85;
        boolean panic = sentiment.sentiment() > 0 && sentiment.sentiment() <= 20;
        boolean rsiStretched = (signal.side() == TradeSide.LONG && ind1h.rsi() >= 65)
                || (signal.side() == TradeSide.SHORT && ind1h.rsi() <= 35);
        if (!(euphoria || panic) || !rsiStretched || draw.getAsDouble() >= contrarianPct / 100.0) {
            return ContrarianDecision.unchanged(signal);
        }
        if (openContrarian >= slots) {
            return new ContrarianDecision(ContrarianDecision.Outcome.SLOTS_FULL, signal);
        }

        Signal flipped = signal.flippedContrarian(
                CONTRARIAN_DISCOUNT,
                "sentiment=" + plain(sentiment.sentiment()) + "% RSI=" + fixed(ind1h.rsi(), 1)
        );
        if (flipped.confidence() < CONTRARIAN_FLOOR) {
            return new ContrarianDecision(ContrarianDecision.Outcome.BELOW_FLOOR, flipped);
        }
        return new ContrarianDecision(ContrarianDecision.Outcome.FLIPPED, flipped);
    }

    private static boolean hasSignal(List<SentimentSignal> signals, SentimentSignalType type, boolean strongOnly) {
        return signals.stream()
                .anyMatch(signal -> signal.type() == type
                        && (!strongOnly || signal.strength() == SignalStrength.STRONG));
    }
}
