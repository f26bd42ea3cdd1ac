package org.nowstart.perpbot.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.nowstart.perpbot.data.dto.IndicatorSnapshot;
import org.nowstart.perpbot.data.dto.SentimentSignal;
import org.nowstart.perpbot.data.dto.SentimentSnapshot;
import org.nowstart.perpbot.data.dto.Signal;
import org.nowstart.perpbot.data.type.MarketRegime;
import org.nowstart.perpbot.data.type.SentimentSignalType;
import org.nowstart.perpbot.data.type.SignalStrength;
import org.nowstart.perpbot.data.type.StrategyCategory;
import org.nowstart.perpbot.data.type.TradeSide;
import org.nowstart.perpbot.fixture.IndicatorFixtures;
import org.nowstart.perpbot.strategy.core.ContrarianDecision;

class SentimentEntryRulesTest {

    private final SentimentEntryRules rules = new SentimentEntryRules();

    @Test
    void sentimentAssistedTrend_relaxesRsiGateWhenSentimentStrong() {
        IndicatorSnapshot ind1h = IndicatorFixtures.snapshot("SOL", 150, 43, 0.1, 30, 25, 10, 0.04, MarketRegime.TRENDING);

        Optional<Signal> signal = rules.sentimentAssistedTrend(ind1h, IndicatorFixtures.sentiment("SOL", 72, 60));

        assertThat(signal).isPresent();
        assertThat(signal.get().rule()).isEqualTo("R3-trend");
        assertThat(signal.get().confidence()).isEqualTo(0.55);
        assertThat(signal.get().reason()).startsWith("Sentiment-assisted R3");
    }

    @Test
    void sentimentAssistedTrend_withoutSentiment_returnsEmpty() {
        IndicatorSnapshot ind1h = IndicatorFixtures.snapshot("SOL", 150, 43, 0.1, 30, 25, 10, 0.04, MarketRegime.TRENDING);

        assertThat(rules.sentimentAssistedTrend(ind1h, null)).isEmpty();
    }

    @Test
    void sentimentConfirmed_extremeBullishWithDiSupport_emitsR6Long() {
        IndicatorSnapshot ind1h = IndicatorFixtures.snapshot("ETH", 2000, 50, 0.0, 18, 22, 15, 0.02, MarketRegime.RANGING);

        Optional<Signal> signal = rules.sentimentConfirmed(ind1h, IndicatorFixtures.sentiment("ETH", 80, 90));

        assertThat(signal).isPresent();
        assertThat(signal.get().side()).isEqualTo(TradeSide.LONG);
        assertThat(signal.get().rule()).isEqualTo("R6-sentiment");
        assertThat(signal.get().category()).isEqualTo(StrategyCategory.SENTIMENT_CONFIRMED);
        assertThat(signal.get().confidence()).isEqualTo(0.52);
    }

    @Test
    void sentimentConfirmed_extremeBearishWithDiSupport_emitsR6Short() {
        IndicatorSnapshot ind1h = IndicatorFixtures.snapshot("ETH", 2000, 45, 0.0, 18, 12, 20, 0.02, MarketRegime.RANGING);

        Optional<Signal> signal = rules.sentimentConfirmed(ind1h, IndicatorFixtures.sentiment("ETH", 25, 40));

        assertThat(signal).map(Signal::side).contains(TradeSide.SHORT);
    }

    @Test
    void applyBoost_strongMatchingSignalAddsTenPoints() {
        Signal signal = new Signal("ETH", TradeSide.LONG, "R1-mean-reversion", StrategyCategory.MEAN_REVERSION, 0.6, "RSI 25.0");
        List<SentimentSignal> coinSignals = List.of(
                new SentimentSignal("ETH", SentimentSignalType.BULLISH, SignalStrength.STRONG, "spike", null)
        );

        Signal boosted = rules.applyBoost(signal, IndicatorFixtures.sentiment("ETH", 70, 60), coinSignals);

        assertThat(boosted.confidence()).isCloseTo(0.7, within(1e-9));
        assertThat(boosted.reason()).contains("sentiment boost");
    }

    @Test
    void applyBoost_moderateOppositeSignalLeavesShortUntouched() {
        Signal signal = new Signal("ETH", TradeSide.SHORT, "R4-trend", StrategyCategory.TREND, 0.7, "ADX");
        List<SentimentSignal> coinSignals = List.of(
                new SentimentSignal("ETH", SentimentSignalType.BULLISH, SignalStrength.MODERATE, "nudge", null)
        );

        assertThat(rules.applyBoost(signal, IndicatorFixtures.sentiment("ETH", 70, 60), coinSignals)).isSameAs(signal);
    }

    @Test
    void applyBoost_neverExceedsOne() {
        Signal signal = new Signal("ETH", TradeSide.SHORT, "R4-trend", StrategyCategory.TREND, 0.95, "ADX");
        List<SentimentSignal> coinSignals = List.of(
                new SentimentSignal("ETH", SentimentSignalType.BEARISH, SignalStrength.STRONG, "crash", null)
        );

        assertThat(rules.applyBoost(signal, IndicatorFixtures.sentiment("ETH", 20, 30), coinSignals).confidence())
                .isEqualTo(1.0);
    }

    @Test
    void contrarian_euphoriaWithStretchedRsi_flipsAndDiscounts() {
        Signal signal = new Signal("BTC", TradeSide.LONG, "R3-trend", StrategyCategory.TREND, 0.8, "ADX");
        IndicatorSnapshot ind1h = IndicatorFixtures.snapshot("BTC", 60000, 70, 0.1, 30, 25, 10, 0.04, MarketRegime.TRENDING);
        SentimentSnapshot euphoric = IndicatorFixtures.sentiment("BTC", 80, 90);

        ContrarianDecision decision = rules.contrarian(signal, ind1h, euphoric, 20, 0, 1, () -> 0.1);

        assertThat(decision.outcome()).isEqualTo(ContrarianDecision.Outcome.FLIPPED);
        assertThat(decision.tradeable()).isTrue();
        assertThat(decision.signal().side()).isEqualTo(TradeSide.SHORT);
        assertThat(decision.signal().rule()).isEqualTo("C-R3-trend");
        assertThat(decision.signal().isContrarian()).isTrue();
        assertThat(decision.signal().confidence()).isCloseTo(0.48, within(1e-9));
    }

    @Test
    void contrarian_discountedBelowFloor_isNotTradeable() {
        Signal signal = new Signal("BTC", TradeSide.LONG, "R3-trend", StrategyCategory.TREND, 0.6, "ADX");
        IndicatorSnapshot ind1h = IndicatorFixtures.snapshot("BTC", 60000, 70, 0.1, 30, 25, 10, 0.04, MarketRegime.TRENDING);

        ContrarianDecision decision = rules.contrarian(
                signal, ind1h, IndicatorFixtures.sentiment("BTC", 80, 90), 20, 0, 1, () -> 0.0
        );

        assertThat(decision.outcome()).isEqualTo(ContrarianDecision.Outcome.BELOW_FLOOR);
        assertThat(decision.tradeable()).isFalse();
        assertThat(decision.signal().confidence()).isLessThan(SentimentEntryRules.CONTRARIAN_FLOOR);
    }

    @Test
    void contrarian_slotsFull_keepsOriginalSignal() {
        Signal signal = new Signal("BTC", TradeSide.SHORT, "R4-trend", StrategyCategory.TREND, 0.8, "ADX");
        IndicatorSnapshot ind1h = IndicatorFixtures.snapshot("BTC", 60000, 30, -0.1, 30, 10, 25, 0.04, MarketRegime.TRENDING);

        ContrarianDecision decision = rules.contrarian(
                signal, ind1h, IndicatorFixtures.sentiment("BTC", 20, 15), 20, 1, 1, () -> 0.0
        );

        assertThat(decision.outcome()).isEqualTo(ContrarianDecision.Outcome.SLOTS_FULL);
        assertThat(decision.signal()).isSameAs(signal);
    }

    @Test
    void contrarian_drawAboveProbability_leavesSignalUnchanged() {
        Signal signal = new Signal("BTC", TradeSide.LONG, "R3-trend", StrategyCategory.TREND, 0.8, "ADX");
        IndicatorSnapshot ind1h = IndicatorFixtures.snapshot("BTC", 60000, 70, 0.1, 30, 25, 10, 0.04, MarketRegime.TRENDING);

        ContrarianDecision decision = rules.contrarian(
                signal, ind1h, IndicatorFixtures.sentiment("BTC", 80, 90), 20, 0, 1, () -> 0.5
        );

        assertThat(decision.outcome()).isEqualTo(ContrarianDecision.Outcome.UNCHANGED);
        assertThat(decision.signal()).isSameAs(signal);
    }

    @Test
    void contrarian_disabledPercentage_neverDraws() {
        Signal signal = new Signal("BTC", TradeSide.LONG, "R3-trend", StrategyCategory.TREND, 0.8, "ADX");
        IndicatorSnapshot ind1h = IndicatorFixtures.snapshot("BTC", 60000, 70, 0.1, 30, 25, 10, 0.04, MarketRegime.TRENDING);

        ContrarianDecision decision = rules.contrarian(
                signal, ind1h, IndicatorFixtures.sentiment("BTC", 80, 90), 0, 0, 0, () -> {
                    throw new AssertionError("draw must not be consulted");
                }
        );

        assertThat(decision.outcome()).isEqualTo(ContrarianDecision.Outcome.UNCHANGED);
    }
}
