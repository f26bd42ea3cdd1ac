package org.nowstart.perpbot.strategy;

import static org.nowstart.perpbot.strategy.core.DecisionText.fixed;
import static org.nowstart.perpbot.strategy.core.DecisionText.pct;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;
import org.nowstart.perpbot.data.dto.ExitSignal;
import org.nowstart.perpbot.data.dto.IndicatorSnapshot;
import org.nowstart.perpbot.data.dto.OpenPosition;
import org.nowstart.perpbot.data.type.TradeSide;
import org.nowstart.perpbot.strategy.core.AgentState;
import org.nowstart.perpbot.strategy.core.ExitInput;
import org.nowstart.perpbot.strategy.core.ExitThresholds;
import org.nowstart.perpbot.strategy.core.VolatileCoins;
import org.springframework.stereotype.Component;

/**
 * Exit rules as an ordered guard list; the first guard whose predicate holds produces the exit.
 */
@Component
public class ExitSignalEvaluator {

    private static final double ADX_COLLAPSE = 20;
    private static final double RSI_OVERBOUGHT = 70;
    private static final double RSI_OVERSOLD = 30;

    private final List<ExitGuard> standardGuards = List.of(
            new ExitGuard("EXIT-1-trailing",
                    m -> m.peakPct() > m.thresholds().trailArm() && m.pnlPct() < m.thresholds().trailTrigger(),
                    m -> "Trailing stop: peak " + pct(m.peakPct()) + ", now " + pct(m.pnlPct())
                            + (m.volatileCoin() ? " (volatile)" : "")),
            new ExitGuard("EXIT-1-takeprofit",
                    m -> m.pnlPct() > m.thresholds().takeProfitCap(),
                    m -> "Take profit cap: " + pct(m.pnlPct())
                            + " (limit " + fixed(m.thresholds().takeProfitCap() * 100, 0) + "%)"),
            new ExitGuard("EXIT-2-stoploss",
                    m -> m.pnlPct() < m.stopLoss(),
                    m -> "Stop loss: " + pct(m.pnlPct()) + (m.r3Long() ? " (R3-long tighter stop)" : ""))
    );

    private final List<ExitGuard> contrarianGuards = List.of(
            new ExitGuard("EXIT-1-trailing-C",
                    m -> m.peakPct() > ExitThresholds.CONTRARIAN.trailArm()
                            && m.pnlPct() < ExitThresholds.CONTRARIAN.trailTrigger(),
                    m -> "Contrarian trailing: peak " + pct(m.peakPct()) + ", now " + pct(m.pnlPct())),
            new ExitGuard("EXIT-1-takeprofit-C",
                    m -> m.pnlPct() > ExitThresholds.CONTRARIAN.takeProfitCap(),
                    m -> "Contrarian take profit: " + pct(m.pnlPct())
                            + " (cap " + fixed(ExitThresholds.CONTRARIAN.takeProfitCap() * 100, 1) + "%)"),
            new ExitGuard("EXIT-2-stoploss-C",
                    m -> m.pnlPct() < ExitThresholds.CONTRARIAN_STOP_LOSS,
                    m -> "Contrarian stop loss: " + pct(m.pnlPct())),
            new ExitGuard("EXIT-4-timestop-C",
                    m -> isFlatFor(m, ExitThresholds.CONTRARIAN_TIME_STOP_HOURS),
                    m -> "Contrarian time stop: " + fixed(m.hoursOpen(), 1) + "h open, PnL " + pct(m.pnlPct()) + " (flat)")
    );

    private final List<ExitGuard> reversalGuards = List.of(
            new ExitGuard("EXIT-3-adx-collapse",
                    m -> m.trendEntry() && m.adx().value() < ADX_COLLAPSE,
                    m -> "ADX collapsed to " + fixed(m.adx().value(), 1) + " (< 20)"),
            new ExitGuard("EXIT-3-di-flip",
                    m -> m.trendEntry() && m.side() == TradeSide.LONG && m.adx().minusDi() > m.adx().plusDi(),
                    m -> "DI flipped: -DI " + fixed(m.adx().minusDi(), 1) + " > +DI " + fixed(m.adx().plusDi(), 1)),
            new ExitGuard("EXIT-3-di-flip",
                    m -> m.trendEntry() && m.side() == TradeSide.SHORT && m.adx().plusDi() > m.adx().minusDi(),
                    m -> "DI flipped: +DI " + fixed(m.adx().plusDi(), 1) + " > -DI " + fixed(m.adx().minusDi(), 1)),
            new ExitGuard("EXIT-3-rsi-overbought",
                    m -> m.side() == TradeSide.LONG && m.rsi() > RSI_OVERBOUGHT,
                    m -> "RSI overbought: " + fixed(m.rsi(), 1)),
            new ExitGuard("EXIT-3-rsi-oversold",
                    m -> m.side() == TradeSide.SHORT && m.rsi() < RSI_OVERSOLD,
                    m -> "RSI oversold: " + fixed(m.rsi(), 1))
    );

    private final ExitGuard timeStop = new ExitGuard("EXIT-4-timestop",
            m -> isFlatFor(m, ExitThresholds.TIME_STOP_HOURS),
            m -> "Time stop: " + fixed(m.hoursOpen(), 1) + "h open, PnL " + pct(m.pnlPct()) + " (flat)");

    private final List<ExitGuard> standardChain = concat(concat(standardGuards, reversalGuards), List.of(timeStop));
    private final List<ExitGuard> contrarianChain = concat(contrarianGuards, reversalGuards);

    /**
     * Updates the coin's peak PnL in {@code state} and returns the first matching exit.
     */
    public Optional<ExitSignal> evaluate(ExitInput input, AgentState state) {
        Measurement measurement = measure(input, state);
        List<ExitGuard> chain = input.contrarian() ? contrarianChain : standardChain;
        return chain.stream()
                .filter(guard -> guard.predicate().test(measurement))
                .findFirst()
                .map(guard -> new ExitSignal(guard.rule(), guard.reason().apply(measurement)));
    }

    private Measurement measure(ExitInput input, AgentState state) {
        OpenPosition position = input.position();
        String coin = position.coin();
        double notional = position.notional();
        double pnl = position.unrealizedPnl(input.currentPrice());
        double pnlPct = notional > 0 ? pnl / notional : 0.0;
        double peak = state.trackPeak(coin, pnl);
        double peakPct = notional > 0 ? peak / notional : 0.0;
        double hoursOpen = state.entryTime(coin)
                .map(openedAt -> Duration.between(openedAt, input.evaluatedAt()).toMillis() / 3_600_000.0)
                .orElse(Double.NaN);

        String rule = input.entryRule() == null ? "" : input.entryRule();
        boolean r3Long = rule.contains("R3") && position.side() == TradeSide.LONG;
        boolean trendEntry = rule.contains("trend") || rule.contains("R3") || rule.contains("R4");
        IndicatorSnapshot indicators = input.indicators();

        return new Measurement(
                position.side(),
                pnlPct,
                peakPct,
                hoursOpen,
                ExitThresholds.forCoin(coin),
                VolatileCoins.contains(coin),
                r3Long ? -0.015 : -0.02,
                r3Long,
                trendEntry,
                indicators.adx(),
                indicators.rsi()
        );
    }

    private static boolean isFlatFor(Measurement measurement, double hours) {
        return !Double.isNaN(measurement.hoursOpen())
                && measurement.hoursOpen() > hours
                && Math.abs(measurement.pnlPct()) < ExitThresholds.FLAT_PNL_BAND;
    }

    private static List<ExitGuard> concat(List<ExitGuard> first, List<ExitGuard> second) {
        return Stream.concat(first.stream(), second.stream()).toList();
    }

    private record ExitGuard(
            String rule,
            Predicate<Measurement> predicate,
            Function<Measurement, String> reason
    ) {
    }

    private record Measurement(
            TradeSide side,
            double pnlPct,
            double peakPct,
            double hoursOpen,
            ExitThresholds thresholds,
            boolean volatileCoin,
            double stopLoss,
            boolean r3Long,
            boolean trendEntry,
            IndicatorSnapshot.Adx adx,
            double rsi
    ) {
    }
}
