package org.nowstart.perpbot.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.perpbot.data.dto.IndicatorSnapshot;
import org.nowstart.perpbot.fixture.IndicatorFixtures;
import org.nowstart.perpbot.service.exchange.HyperliquidInfoService;
import org.nowstart.perpbot.strategy.core.OhlcvCandle;

@ExtendWith(MockitoExtension.class)
class MarketDataServiceTest {

    @Mock
    private HyperliquidInfoService infoService;

    @Mock
    private IndicatorComputationService indicatorComputationService;

    @InjectMocks
    private MarketDataService marketDataService;

    @Test
    void fetchIndicators_requestsTwoHundredCandlesOfTheInterval() {
        List<OhlcvCandle> candles = List.of();
        IndicatorSnapshot snapshot = IndicatorFixtures.quiet("ETH", 2000, 40);
        when(infoService.candles("ETH", "15m", Duration.ofMinutes(15), 200)).thenReturn(candles);
        when(indicatorComputationService.compute("ETH", "15m", candles)).thenReturn(snapshot);

        assertThat(marketDataService.fetchIndicators("ETH", MarketDataService.INTERVAL_15M)).isSameAs(snapshot);
        verify(infoService).candles("ETH", "15m", Duration.ofMinutes(15), 200);
    }

    @Test
    void fetchIndicators_insufficientHistory_returnsNull() {
        when(infoService.candles("HYPE", "1h", Duration.ofHours(1), 200)).thenReturn(List.of());

        assertThat(marketDataService.fetchIndicators("HYPE", MarketDataService.INTERVAL_1H)).isNull();
    }
}
