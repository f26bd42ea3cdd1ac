package org.nowstart.perpbot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.perpbot.data.dto.IndicatorSnapshot;
import org.nowstart.perpbot.data.dto.MlScore;
import org.nowstart.perpbot.data.dto.MlScoreRequest;
import org.nowstart.perpbot.data.dto.MlScoreResponse;
import org.nowstart.perpbot.data.dto.SentimentSnapshot;
import org.nowstart.perpbot.data.property.IntegrationProperties;
import org.nowstart.perpbot.data.type.TradeSide;
import org.nowstart.perpbot.repository.MlScorerFeignClient;
import org.springframework.stereotype.Service;

/**
 * Advisory ML confidence. Never throws; an unusable answer forfeits only the blend.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConfidenceScoringService {

    static final double DEFAULT_GALAXY_SCORE = 0;
    static final double DEFAULT_SENTIMENT_PCT = 50;
    static final double DEFAULT_ALT_RANK = 500;

    private final MlScorerFeignClient mlScorerFeignClient;
    private final IntegrationProperties integrationProperties;

    public MlScore scoreSignal(String coin, TradeSide side, String rule, IndicatorSnapshot indicators, SentimentSnapshot sentiment) {
        if (!integrationProperties.mlScorer().enabled()) {
            return MlScore.unavailable();
        }
        try {
            MlScoreResponse response = mlScorerFeignClient.score(toRequest(coin, side, rule, indicators, sentiment));
            if (response == null || response.error() != null || response.score() == null) {
                log.debug("event=ml_score_unavailable coin={} rule={} error={}", coin, rule, response == null ? null : response.error());
                return MlScore.unavailable();
            }
            int samples = response.modelSamples() == null ? 0 : response.modelSamples();
            return new MlScore(response.score(), samples);
        } catch (RuntimeException e) {
            log.warn("event=ml_score_failed coin={} rule={} reason={}", coin, rule, e.getMessage());
            return MlScore.unavailable();
        }
    }

    static MlScoreRequest toRequest(
            String coin,
            TradeSide side,
            String rule,
            IndicatorSnapshot indicators,
            SentimentSnapshot sentiment
    ) {
        return new MlScoreRequest(
                coin,
                side.wireName(),
                rule,
                indicators.adx().value(),
                indicators.adx().plusDi(),
                indicators.adx().minusDi(),
                indicators.rsi(),
                indicators.macd().histogram(),
                indicators.bollinger().width(),
                indicators.atrPct(),
                indicators.regime().wireName(),
                sentiment == null ? DEFAULT_GALAXY_SCORE : sentiment.galaxyScore(),
                sentiment == null ? DEFAULT_SENTIMENT_PCT : sentiment.sentiment(),
                sentiment == null ? DEFAULT_ALT_RANK : sentiment.altRank()
        );
    }
}
