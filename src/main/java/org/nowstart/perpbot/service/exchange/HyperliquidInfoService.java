package org.nowstart.perpbot.service.exchange;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.perpbot.data.dto.AssetMeta;
import org.nowstart.perpbot.data.dto.HyperliquidCandleResponse;
import org.nowstart.perpbot.data.dto.HyperliquidInfoRequest;
import org.nowstart.perpbot.data.dto.HyperliquidMetaResponse;
import org.nowstart.perpbot.data.exception.ExchangeRequestException;
import org.nowstart.perpbot.repository.HyperliquidFeignClient;
import org.nowstart.perpbot.strategy.core.OhlcvCandle;
import org.springframework.stereotype.Service;

/**
 * Public market data reads shared by the paper and live gateways.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HyperliquidInfoService {

    static final Duration META_TTL = Duration.ofHours(1);

    private final HyperliquidFeignClient hyperliquidFeignClient;
    private final Clock clock;

    private volatile MetaCache metaCache;

    public double midPrice(String coin) {
        Map<String, String> mids = hyperliquidFeignClient.getAllMids(HyperliquidInfoRequest.allMids());
        String mid = mids == null ? null : mids.get(coin);
        if (mid == null) {
            throw new ExchangeRequestException(coin, "No mid price for " + coin);
        }
        return Double.parseDouble(mid);
    }

    public Optional<AssetMeta> assetMeta(String coin) {
        return Optional.ofNullable(metaByCoin().get(coin));
    }

    public List<OhlcvCandle> candles(String coin, String interval, Duration intervalLength, int count) {
        long end = clock.millis();
        long start = end - intervalLength.toMillis() * count;
        List<HyperliquidCandleResponse> response = hyperliquidFeignClient.getCandles(
                HyperliquidInfoRequest.candleSnapshot(coin, interval, start, end)
        );
        if (response == null) {
            return List.of();
        }
        return response.stream()
                .map(candle -> new OhlcvCandle(
                        Instant.ofEpochMilli(candle.t()),
                        Double.parseDouble(candle.o()),
                        Double.parseDouble(candle.h()),
                        Double.parseDouble(candle.l()),
                        Double.parseDouble(candle.c()),
                        candle.v() == null ? 0.0 : Double.parseDouble(candle.v())
                ))
                .toList();
    }

    private Map<String, AssetMeta> metaByCoin() {
        MetaCache cached = metaCache;
        Instant now = clock.instant();
        if (cached != null && cached.fetchedAt().plus(META_TTL).isAfter(now)) {
            return cached.assets();
        }

        HyperliquidMetaResponse response = hyperliquidFeignClient.getMeta(HyperliquidInfoRequest.meta());
        Map<String, AssetMeta> assets = new LinkedHashMap<>();
        if (response != null && response.universe() != null) {
            List<HyperliquidMetaResponse.Asset> universe = response.universe();
            for (int i = 0; i < universe.size(); i++) {
                HyperliquidMetaResponse.Asset asset = universe.get(i);
                assets.put(asset.name(), new AssetMeta(
                        i,
                        asset.name(),
                        asset.szDecimals(),
                        asset.maxLeverage(),
                        Boolean.TRUE.equals(asset.isDelisted())
                ));
            }
        }
        log.debug("event=asset_meta_refreshed assets={}", assets.size());
        metaCache = new MetaCache(Map.copyOf(assets), now);
        return metaCache.assets();
    }

    private record MetaCache(Map<String, AssetMeta> assets, Instant fetchedAt) {
    }
}
