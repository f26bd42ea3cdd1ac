package org.nowstart.perpbot.service;

import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.perpbot.data.dto.IndicatorSnapshot;
import org.nowstart.perpbot.service.exchange.HyperliquidInfoService;
import org.nowstart.perpbot.strategy.core.OhlcvCandle;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class MarketDataService {

    public static final String INTERVAL_1H = "1h";
    public static final String INTERVAL_15M = "15m";
    static final int CANDLE_COUNT = 200;

    private final HyperliquidInfoService infoService;
    private final IndicatorComputationService indicatorComputationService;

    /**
     * @return {@code null} when the coin has too little history for this interval
     */
    public IndicatorSnapshot fetchIndicators(String coin, String interval) {
        List<OhlcvCandle> candles = infoService.candles(coin, interval, intervalLength(interval), CANDLE_COUNT);
        IndicatorSnapshot snapshot = indicatorComputationService.compute(coin, interval, candles);
        if (snapshot == null) {
            log.debug("event=insufficient_history coin={} interval={} candles={}", coin, interval, candles.size());
        }
        return snapshot;
    }

    static Duration intervalLength(String interval) {
        return INTERVAL_15M.equals(interval) ? Duration.ofMinutes(15) : Duration.ofHours(1);
    }
}
