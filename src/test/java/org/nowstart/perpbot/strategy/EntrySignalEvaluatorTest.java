package org.nowstart.perpbot.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.nowstart.perpbot.data.dto.IndicatorSnapshot;
import org.nowstart.perpbot.data.dto.Signal;
import org.nowstart.perpbot.data.type.MarketRegime;
import org.nowstart.perpbot.data.type.StrategyCategory;
import org.nowstart.perpbot.data.type.TradeSide;
import org.nowstart.perpbot.fixture.IndicatorFixtures;
import org.nowstart.perpbot.strategy.core.AgentState;

class EntrySignalEvaluatorTest {

    private final EntrySignalEvaluator evaluator = new EntrySignalEvaluator();

    @Test
    void evaluate_quietOversoldWithout15m_emitsMeanReversionLongAtBaseConfidence() {
        IndicatorSnapshot ind1h = IndicatorFixtures.quiet("ETH", 2000, 25);

        Optional<Signal> signal = evaluator.evaluate(ind1h, null, "ETH", new AgentState());

        assertThat(signal).isPresent();
        assertThat(signal.get().side()).isEqualTo(TradeSide.LONG);
        assertThat(signal.get().rule()).isEqualTo("R1-mean-reversion");
        assertThat(signal.get().category()).isEqualTo(StrategyCategory.MEAN_REVERSION);
        assertThat(signal.get().confidence()).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void evaluate_quietOversold_neverEmitsTrendRule() {
        AgentState state = new AgentState();
        for (double rsi = 1; rsi < 30; rsi += 2.5) {
            IndicatorSnapshot ind1h = IndicatorFixtures.snapshot("BTC", 60000, rsi, 0.5, 40, 30, 10, 0.02, MarketRegime.QUIET);

            Optional<Signal> signal = evaluator.evaluate(ind1h, null, "BTC", state);

            assertThat(signal).isPresent();
            assertThat(signal.get().rule()).isEqualTo("R1-mean-reversion");
            assertThat(signal.get().confidence()).isGreaterThanOrEqualTo(0.6);
        }
    }

    @Test
    void evaluate_quietOversoldWith15mConfirmation_addsTimingBonus() {
        IndicatorSnapshot ind1h = IndicatorFixtures.quiet("ETH", 2000, 25);
        IndicatorSnapshot ind15m = IndicatorFixtures.quiet("ETH", 2000, 30);

        Optional<Signal> signal = evaluator.evaluate(ind1h, ind15m, "ETH", new AgentState());

        assertThat(signal).map(Signal::confidence).hasValueSatisfying(c -> assertThat(c).isCloseTo(0.7, within(1e-9)));
    }

    @Test
    void evaluate_trendingBullishSnapshot_emitsR3WithDiSpreadBonus() {
        IndicatorSnapshot ind1h = IndicatorFixtures.snapshot("SOL", 150, 55, 0.01, 30, 25, 10, 0.04, MarketRegime.TRENDING);

        Optional<Signal> signal = evaluator.evaluate(ind1h, null, "SOL", new AgentState());

        assertThat(signal).isPresent();
        assertThat(signal.get().side()).isEqualTo(TradeSide.LONG);
        assertThat(signal.get().rule()).isEqualTo("R3-trend");
        assertThat(signal.get().confidence()).isGreaterThan(0.6);
        assertThat(signal.get().confidence()).isCloseTo(0.7, within(1e-9));
    }

    @Test
    void evaluate_bearishTrend_emitsR4Short() {
        IndicatorSnapshot ind1h = IndicatorFixtures.snapshot("BTC", 60000, 40, -0.2, 30, 10, 25, 0.04, MarketRegime.TRENDING);

        Optional<Signal> signal = evaluator.evaluate(ind1h, null, "BTC", new AgentState());

        assertThat(signal).isPresent();
        assertThat(signal.get().rule()).isEqualTo("R4-trend");
        assertThat(signal.get().side()).isEqualTo(TradeSide.SHORT);
        assertThat(signal.get().confidence()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void evaluate_transitionalAdxWithWideDiSpread_emitsDiscountedR4() {
        IndicatorSnapshot ind1h = IndicatorFixtures.snapshot("BTC", 60000, 45, 0.0, 23, 10, 20, 0.02, MarketRegime.RANGING);

        Optional<Signal> signal = evaluator.evaluate(ind1h, null, "BTC", new AgentState());

        assertThat(signal).isPresent();
        assertThat(signal.get().rule()).isEqualTo("R4-trend");
        assertThat(signal.get().confidence()).isCloseTo(0.65, within(1e-9));
    }

    @Test
    void evaluate_neutralSnapshot_returnsEmpty() {
        IndicatorSnapshot ind1h = IndicatorFixtures.quiet("ETH", 2000, 50);

        assertThat(evaluator.evaluate(ind1h, null, "ETH", new AgentState())).isEmpty();
    }

    @Test
    void evaluate_squeezeBreakout_staysBelowMinimumConfidenceAndResetsSqueeze() {
        AgentState state = new AgentState();
        IndicatorSnapshot squeeze = IndicatorFixtures.snapshot("ETH", 2000, 50, 0.0, 15, 18, 20, 0.005, MarketRegime.QUIET);
        evaluator.evaluate(squeeze, null, "ETH", state);
        assertThat(state.isSqueezeForming("ETH")).isTrue();

        IndicatorSnapshot expanded = IndicatorFixtures.snapshot("ETH", 2000, 50, 0.0, 15, 18, 20, 0.02, MarketRegime.RANGING);
        IndicatorSnapshot breakout = new IndicatorSnapshot(
                "ETH", "1h", 2100, 50, expanded.macd(), expanded.bollinger(), 20, expanded.adx(), MarketRegime.RANGING
        );

        Optional<Signal> signal = evaluator.evaluate(breakout, null, "ETH", state);

        assertThat(signal).isEmpty();
        assertThat(state.isSqueezeForming("ETH")).isFalse();
    }
}
