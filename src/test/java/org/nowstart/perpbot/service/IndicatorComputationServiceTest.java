package org.nowstart.perpbot.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.perpbot.data.dto.IndicatorSnapshot;
import org.nowstart.perpbot.data.type.MarketRegime;
import org.nowstart.perpbot.strategy.core.OhlcvCandle;

class IndicatorComputationServiceTest {

    private final IndicatorComputationService service = new IndicatorComputationService();

    @Test
    void compute_tooFewCandles_returnsNull() {
        assertThat(service.compute("BTC", "1h", risingCandles(49))).isNull();
        assertThat(service.compute("BTC", "1h", null)).isNull();
    }

    @Test
    void compute_steadyUptrend_readsAsStrongBullishTrend() {
        IndicatorSnapshot snapshot = service.compute("BTC", "1h", risingCandles(200));

        assertThat(snapshot.coin()).isEqualTo("BTC");
        assertThat(snapshot.interval()).isEqualTo("1h");
        assertThat(snapshot.price()).isEqualTo(299.0);
        assertThat(snapshot.rsi()).isEqualTo(100.0);
        assertThat(snapshot.atr()).isCloseTo(1.5, within(1e-9));
        assertThat(snapshot.adx().plusDi()).isGreaterThan(snapshot.adx().minusDi());
        assertThat(snapshot.adx().value()).isGreaterThan(25);
        assertThat(snapshot.regime().isTrending()).isTrue();
        assertThat(snapshot.bollinger().upper()).isGreaterThan(snapshot.bollinger().middle());
        assertThat(snapshot.bollinger().middle()).isCloseTo(289.5, within(1e-9));
    }

    @Test
    void exponentialMovingAverage_seedsWithSimpleAverage() {
        double[] ema = service.exponentialMovingAverage(new double[] {1, 2, 3, 4}, 2);

        assertThat(ema[0]).isNaN();
        assertThat(ema[1]).isCloseTo(1.5, within(1e-9));
        assertThat(ema[2]).isCloseTo(2.5, within(1e-9));
        assertThat(ema[3]).isCloseTo(3.5, within(1e-9));
    }

    @Test
    void rsi_notEnoughHistory_isNeutral() {
        assertThat(service.rsi(new double[] {1, 2, 3}, 14)).isEqualTo(50.0);
    }

    @Test
    void rsi_mixedMoves_staysWithinBounds() {
        double[] close = new double[60];
        for (int i = 0; i < close.length; i++) {
            close[i] = 100 + (i % 2 == 0 ? 1 : -1) * (i % 7);
        }

        assertThat(service.rsi(close, 14)).isBetween(0.0, 100.0);
    }

    @Test
    void bollinger_flatSeries_hasZeroWidth() {
        double[] close = new double[30];
        java.util.Arrays.fill(close, 50.0);

        IndicatorSnapshot.Bollinger bollinger = service.bollinger(close, 20, 2.0);

        assertThat(bollinger.width()).isZero();
        assertThat(MarketRegime.classify(10, bollinger.width())).isEqualTo(MarketRegime.QUIET);
    }

    @Test
    void macd_shortSeries_isZero() {
        assertThat(service.macd(new double[] {1, 2, 3})).isEqualTo(new IndicatorSnapshot.Macd(0.0, 0.0, 0.0));
    }

    private static List<OhlcvCandle> risingCandles(int count) {
        List<OhlcvCandle> candles = new ArrayList<>();
        Instant start = Instant.parse("2026-01-01T00:00:00Z");
        for (int i = 0; i < count; i++) {
            double close = 100 + i;
            candles.add(new OhlcvCandle(start.plusSeconds(3600L * i), close - 0.5, close + 0.5, close - 0.5, close, 1000));
        }
        return candles;
    }
}
