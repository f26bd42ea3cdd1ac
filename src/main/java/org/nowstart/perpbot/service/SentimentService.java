package org.nowstart.perpbot.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.perpbot.data.dto.LunarCrushCoinListResponse;
import org.nowstart.perpbot.data.dto.SentimentSnapshot;
import org.nowstart.perpbot.data.property.IntegrationProperties;
import org.nowstart.perpbot.repository.LunarCrushFeignClient;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class SentimentService {

    static final double DEFAULT_ALT_RANK = 999;

    private final LunarCrushFeignClient lunarCrushFeignClient;
    private final IntegrationProperties integrationProperties;
    private final RetryExecutor retryExecutor;
    private final Clock clock;

    /**
     * @return empty when sentiment is disabled or the fetch failed
     */
    public Optional<List<SentimentSnapshot>> fetchSentiment(List<String> coins) {
        if (!integrationProperties.sentiment().usable()) {
            return Optional.empty();
        }
        try {
            LunarCrushCoinListResponse response = retryExecutor.call("sentiment", lunarCrushFeignClient::getCoinList);
            if (response == null || response.data() == null) {
                log.warn("event=sentiment_fetch_failed reason=empty_response");
                return Optional.empty();
            }

            Set<String> wanted = coins.stream()
                    .map(coin -> coin.toUpperCase(Locale.ROOT))
                    .collect(Collectors.toSet());
            Instant fetchedAt = clock.instant();
            List<SentimentSnapshot> snapshots = new ArrayList<>();
            for (LunarCrushCoinListResponse.Coin coin : response.data()) {
                if (coin.symbol() == null) {
                    continue;
                }
                String symbol = coin.symbol().toUpperCase(Locale.ROOT);
                if (!wanted.contains(symbol)) {
                    continue;
                }
                snapshots.add(new SentimentSnapshot(
                        symbol,
                        orZero(coin.galaxy_score()),
                        orZero(coin.sentiment()),
                        orZero(coin.social_volume_24h()),
                        orZero(coin.interactions_24h()),
                        orZero(coin.social_dominance()),
                        coin.alt_rank() == null ? DEFAULT_ALT_RANK : coin.alt_rank(),
                        fetchedAt
                ));
            }
            log.info("event=sentiment_fetched coins={} requested={}", snapshots.size(), coins.size());
            return Optional.of(snapshots);
        } catch (RuntimeException e) {
            log.warn("event=sentiment_fetch_failed reason={}", e.getMessage());
            return Optional.empty();
        }
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
