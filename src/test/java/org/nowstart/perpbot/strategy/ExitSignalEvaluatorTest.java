package org.nowstart.perpbot.strategy;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.nowstart.perpbot.data.dto.ExitSignal;
import org.nowstart.perpbot.data.dto.IndicatorSnapshot;
import org.nowstart.perpbot.data.dto.OpenPosition;
import org.nowstart.perpbot.data.type.MarketRegime;
import org.nowstart.perpbot.data.type.TradeSide;
import org.nowstart.perpbot.fixture.IndicatorFixtures;
import org.nowstart.perpbot.strategy.core.AgentState;
import org.nowstart.perpbot.strategy.core.ExitInput;

class ExitSignalEvaluatorTest {

    private static final Instant OPENED_AT = Instant.parse("2026-01-01T00:00:00Z");

    private final ExitSignalEvaluator evaluator = new ExitSignalEvaluator();

    @Test
    void evaluate_volatileLongGivesBackPeak_returnsTrailingExit() {
        AgentState state = openState("DOGE");
        OpenPosition position = new OpenPosition("DOGE", TradeSide.LONG, 1, 100, 3);

        Optional<ExitSignal> atPeak = evaluator.evaluate(input(position, "R1-mean-reversion", 102.5, neutral("DOGE")), state);
        Optional<ExitSignal> afterPullback = evaluator.evaluate(input(position, "R1-mean-reversion", 100.4, neutral("DOGE")), state);

        assertThat(atPeak).isEmpty();
        assertThat(afterPullback).map(ExitSignal::rule).contains("EXIT-1-trailing");
    }

    @Test
    void evaluate_trailingExit_isIdempotentAcrossRulesAndSides() {
        for (String rule : new String[] {"R1-mean-reversion", "R3-trend", "R4-trend", "R6-sentiment"}) {
            for (TradeSide side : TradeSide.values()) {
                AgentState state = openState("BTC");
                state.trackPeak("BTC", 1.5);
                double price = side == TradeSide.LONG ? 100.3 : 99.7;
                OpenPosition position = new OpenPosition("BTC", side, 1, 100, 3);
                ExitInput input = input(position, rule, price, neutral("BTC"));

                Optional<ExitSignal> first = evaluator.evaluate(input, state);
                Optional<ExitSignal> second = evaluator.evaluate(input, state);

                assertThat(first).map(ExitSignal::rule).contains("EXIT-1-trailing");
                assertThat(second).isEqualTo(first);
            }
        }
    }

    @Test
    void evaluate_standardCoinAboveCap_returnsTakeProfit() {
        OpenPosition position = new OpenPosition("BTC", TradeSide.LONG, 1, 100, 3);

        Optional<ExitSignal> exit = evaluator.evaluate(input(position, "R1-mean-reversion", 103.5, neutral("BTC")), openState("BTC"));

        assertThat(exit).map(ExitSignal::rule).contains("EXIT-1-takeprofit");
    }

    @Test
    void evaluate_r3LongUsesTighterStop() {
        OpenPosition position = new OpenPosition("BTC", TradeSide.LONG, 1, 100, 3);
        IndicatorSnapshot strongTrend = IndicatorFixtures.snapshot("BTC", 98.3, 50, 0.1, 30, 25, 10, 0.04, MarketRegime.TRENDING);

        Optional<ExitSignal> r3 = evaluator.evaluate(input(position, "R3-trend", 98.3, strongTrend), openState("BTC"));
        Optional<ExitSignal> r1 = evaluator.evaluate(input(position, "R1-mean-reversion", 98.3, strongTrend), openState("BTC"));

        assertThat(r3).map(ExitSignal::rule).contains("EXIT-2-stoploss");
        assertThat(r1).isEmpty();
    }

    @Test
    void evaluate_trendEntryWithCollapsedAdx_returnsAdxCollapse() {
        OpenPosition position = new OpenPosition("ETH", TradeSide.SHORT, 1, 100, 3);
        IndicatorSnapshot collapsed = IndicatorFixtures.snapshot("ETH", 100, 50, 0.0, 15, 10, 20, 0.02, MarketRegime.QUIET);

        Optional<ExitSignal> exit = evaluator.evaluate(input(position, "R4-trend", 100, collapsed), openState("ETH"));

        assertThat(exit).map(ExitSignal::rule).contains("EXIT-3-adx-collapse");
    }

    @Test
    void evaluate_longWithFlippedDi_returnsDiFlip() {
        OpenPosition position = new OpenPosition("ETH", TradeSide.LONG, 1, 100, 3);
        IndicatorSnapshot flipped = IndicatorFixtures.snapshot("ETH", 100, 50, 0.0, 28, 12, 22, 0.04, MarketRegime.TRENDING);

        Optional<ExitSignal> exit = evaluator.evaluate(input(position, "R3-trend", 100, flipped), openState("ETH"));

        assertThat(exit).map(ExitSignal::rule).contains("EXIT-3-di-flip");
    }

    @Test
    void evaluate_meanReversionLongWithOverboughtRsi_returnsRsiExit() {
        OpenPosition position = new OpenPosition("ETH", TradeSide.LONG, 1, 100, 3);

        Optional<ExitSignal> exit = evaluator.evaluate(
                input(position, "R1-mean-reversion", 100.5, IndicatorFixtures.quiet("ETH", 100.5, 75)),
                openState("ETH")
        );

        assertThat(exit).map(ExitSignal::rule).contains("EXIT-3-rsi-overbought");
    }

    @Test
    void evaluate_flatPositionOpenTooLong_returnsTimeStop() {
        OpenPosition position = new OpenPosition("ETH", TradeSide.LONG, 1, 100, 3);
        ExitInput input = new ExitInput(
                position, "R1-mean-reversion", false, 100.1, neutral("ETH"), OPENED_AT.plus(Duration.ofHours(5))
        );

        Optional<ExitSignal> exit = evaluator.evaluate(input, openState("ETH"));

        assertThat(exit).map(ExitSignal::rule).contains("EXIT-4-timestop");
    }

    @Test
    void evaluate_unknownEntryTime_neverTimeStops() {
        OpenPosition position = new OpenPosition("ETH", TradeSide.LONG, 1, 100, 3);
        ExitInput input = new ExitInput(
                position, "R1-mean-reversion", false, 100.1, neutral("ETH"), OPENED_AT.plus(Duration.ofHours(50))
        );

        assertThat(evaluator.evaluate(input, new AgentState())).isEmpty();
    }

    @Test
    void evaluate_contrarianPosition_usesTighterThresholds() {
        OpenPosition position = new OpenPosition("BTC", TradeSide.SHORT, 1, 100, 3);
        ExitInput input = new ExitInput(position, "C-R3-trend", true, 98.4, neutral("BTC"), OPENED_AT.plusSeconds(60));

        Optional<ExitSignal> exit = evaluator.evaluate(input, openState("BTC"));

        assertThat(exit).map(ExitSignal::rule).contains("EXIT-1-takeprofit-C");
    }

    @Test
    void evaluate_contrarianFlatAfterTwoHours_returnsContrarianTimeStop() {
        OpenPosition position = new OpenPosition("BTC", TradeSide.SHORT, 1, 100, 3);
        ExitInput input = new ExitInput(
                position, "C-R3-trend", true, 100.0, neutral("BTC"), OPENED_AT.plus(Duration.ofMinutes(150))
        );

        Optional<ExitSignal> exit = evaluator.evaluate(input, openState("BTC"));

        assertThat(exit).map(ExitSignal::rule).contains("EXIT-4-timestop-C");
    }

    private static AgentState openState(String coin) {
        AgentState state = new AgentState();
        state.openPosition(coin, OPENED_AT);
        return state;
    }

    private static IndicatorSnapshot neutral(String coin) {
        return IndicatorFixtures.snapshot(coin, 100, 50, 0.0, 22, 20, 18, 0.02, MarketRegime.RANGING);
    }

    private static ExitInput input(OpenPosition position, String rule, double price, IndicatorSnapshot indicators) {
        return new ExitInput(position, rule, false, price, indicators, OPENED_AT.plusSeconds(600));
    }
}
