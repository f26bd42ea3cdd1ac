package org.nowstart.perpbot.strategy;

import static org.nowstart.perpbot.strategy.core.DecisionText.fixed;
import static org.nowstart.perpbot.strategy.core.DecisionText.plain;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.nowstart.perpbot.data.dto.IndicatorSnapshot;
import org.nowstart.perpbot.data.dto.Signal;
import org.nowstart.perpbot.data.type.MarketRegime;
import org.nowstart.perpbot.data.type.StrategyCategory;
import org.nowstart.perpbot.data.type.TradeSide;
import org.nowstart.perpbot.strategy.core.AgentState;
import org.springframework.stereotype.Component;

/**
 * Technical entry rules R1 to R5 evaluated against the 1h snapshot, with optional 15m timing refinement.
 */
@Component
public class EntrySignalEvaluator {

    public static final double MIN_CONFIDENCE = 0.5;

    static final double SQUEEZE_WIDTH = 0.01;
    static final double BREAKOUT_WIDTH = 0.015;

    public Optional<Signal> evaluate(IndicatorSnapshot ind1h, IndicatorSnapshot ind15m, String coin, AgentState state) {
        List<Signal> candidates = new ArrayList<>();
        meanReversionLong(ind1h, ind15m, coin).ifPresent(candidates::add);
        meanReversionShort(ind1h, ind15m, coin).ifPresent(candidates::add);
        trendLong(ind1h, ind15m, coin).ifPresent(candidates::add);
        trendShort(ind1h, ind15m, coin).ifPresent(candidates::add);
        squeezeBreakout(ind1h, coin, state).ifPresent(candidates::add);

        Signal best = null;
        for (Signal candidate : candidates) {
            if (candidate.confidence() < MIN_CONFIDENCE) {
                continue;
            }
            if (best == null || candidate.confidence() > best.confidence()) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    private Optional<Signal> meanReversionLong(IndicatorSnapshot ind1h, IndicatorSnapshot ind15m, String coin) {
        MarketRegime regime = ind1h.regime();
        if (!regime.isRangeBound() || ind1h.rsi() >= 30) {
            return Optional.empty();
        }
        double confidence = 0.6;
        if (ind15m != null && ind15m.rsi() < 35) {
            confidence += 0.1;
        }
        return Optional.of(new Signal(
                coin,
                TradeSide.LONG,
                "R1-mean-reversion",
                StrategyCategory.MEAN_REVERSION,
                confidence,
                "RSI " + fixed(ind1h.rsi(), 1) + ", regime " + regime.wireName()
        ));
    }

    private Optional<Signal> meanReversionShort(IndicatorSnapshot ind1h, IndicatorSnapshot ind15m, String coin) {
        MarketRegime regime = ind1h.regime();
        if (!regime.isRangeBound() || ind1h.rsi() <= 70) {
            return Optional.empty();
        }
        double confidence = 0.6;
        if (ind15m != null && ind15m.rsi() > 65) {
            confidence += 0.1;
        }
        return Optional.of(new Signal(
                coin,
                TradeSide.SHORT,
                "R2-mean-reversion",
                StrategyCategory.MEAN_REVERSION,
                confidence,
                "RSI " + fixed(ind1h.rsi(), 1) + ", regime " + regime.wireName()
        ));
    }

    private Optional<Signal> trendLong(IndicatorSnapshot ind1h, IndicatorSnapshot ind15m, String coin) {
        IndicatorSnapshot.Adx adx = ind1h.adx();
        boolean matches = ind1h.regime().isTrending()
                && adx.value() > 25
                && adx.plusDi() > adx.minusDi()
                && ind1h.rsi() > 45
                && ind1h.macd().histogram() > 0;
        if (!matches) {
            return Optional.empty();
        }

        double confidence = 0.6;
        double diSpread = adx.plusDi() - adx.minusDi();
        if (diSpread > 10) {
            confidence += 0.1;
        }
        if (adx.value() > 35) {
            confidence += 0.05;
        }
        // pullback on the 15m frame
        if (ind15m != null && ind15m.rsi() < 55 && ind15m.rsi() > 40) {
            confidence += 0.1;
        }
        return Optional.of(new Signal(
                coin,
                TradeSide.LONG,
                "R3-trend",
                StrategyCategory.TREND,
                Math.min(confidence, 1.0),
                "ADX " + fixed(adx.value(), 1)
                        + ", +DI " + fixed(adx.plusDi(), 1)
                        + " > -DI " + fixed(adx.minusDi(), 1)
                        + ", RSI " + fixed(ind1h.rsi(), 1)
                        + ", MACD hist " + fixed(ind1h.macd().histogram(), 4)
        ));
    }

    private Optional<Signal> trendShort(IndicatorSnapshot ind1h, IndicatorSnapshot ind15m, String coin) {
        IndicatorSnapshot.Adx adx = ind1h.adx();
        double adxValue = adx.value();
        double diSpread = adx.minusDi() - adx.plusDi();
        boolean adxOk = adxValue > 25 || (adxValue > 22 && diSpread > 8);
        boolean regimeOk = ind1h.regime().isTrending() || (adxValue > 22 && adxValue <= 25);

        if (!regimeOk || !adxOk || adx.minusDi() <= adx.plusDi() || ind1h.rsi() >= 50) {
            return Optional.empty();
        }

        boolean macdOk = ind1h.macd().histogram() < 0.05 || (adxValue > 35 && diSpread > 10);
        if (!macdOk) {
            return Optional.empty();
        }

        double confidence = 0.7;
        if (diSpread > 10) {
            confidence += 0.1;
        }
        if (adxValue > 35) {
            confidence += 0.05;
        }
        if (adxValue <= 25) {
            confidence -= 0.05;
        }
        if (ind15m != null && ind15m.rsi() > 45 && ind15m.rsi() < 55) {
            confidence += 0.05;
        }
        return Optional.of(new Signal(
                coin,
                TradeSide.SHORT,
                "R4-trend",
                StrategyCategory.TREND,
                Math.min(confidence, 1.0),
                "ADX " + fixed(adxValue, 1)
                        + ", -DI " + fixed(adx.minusDi(), 1)
                        + " > +DI " + fixed(adx.plusDi(), 1)
                        + " (spread " + fixed(diSpread, 1) + ")"
                        + ", RSI " + fixed(ind1h.rsi(), 1)
                        + ", MACD hist " + fixed(ind1h.macd().histogram(), 4)
        ));
    }

    private Optional<Signal> squeezeBreakout(IndicatorSnapshot ind1h, String coin, AgentState state) {
        IndicatorSnapshot.Bollinger bollinger = ind1h.bollinger();
        if (bollinger.width() < SQUEEZE_WIDTH) {
            state.markSqueezeForming(coin, true);
        }
        if (!state.isSqueezeForming(coin) || bollinger.width() <= BREAKOUT_WIDTH) {
            return Optional.empty();
        }

        state.markSqueezeForming(coin, false);
        // base confidence sits below MIN_CONFIDENCE, so the rule only fires once re-tuned
        if (ind1h.price() > bollinger.upper()) {
            return Optional.of(new Signal(
                    coin,
                    TradeSide.LONG,
                    "R5-breakout",
                    StrategyCategory.BREAKOUT,
                    0.4,
                    "Squeeze breakout UP, width " + fixed(bollinger.width(), 4)
                            + ", price " + plain(ind1h.price()) + " > upper " + fixed(bollinger.upper(), 2)
            ));
        }
        if (ind1h.price() < bollinger.lower()) {
            return Optional.of(new Signal(
                    coin,
                    TradeSide.SHORT,
                    "R5-breakout",
                    StrategyCategory.BREAKOUT,
                    0.4,
                    "Squeeze breakout DOWN, width " + fixed(bollinger.width(), 4)
                            + ", price " + plain(ind1h.price()) + " < lower " + fixed(bollinger.lower(), 2)
            ));
        }
        return Optional.empty();
    }
}
