package org.nowstart.perpbot.data.dto;

import java.time.Instant;
import org.nowstart.perpbot.data.type.MarketRegime;
import org.nowstart.perpbot.data.type.TradeSide;

public record NearMiss(
        String coin,
        TradeSide side,
        String rule,
        double price,
        Instant timestamp,
        String reason,
        String blockedBy,
        Indicators indicators,
        Double mlScore
) {

    public record Indicators(
            double adx,
            double plusDi,
            double minusDi,
            double rsi,
            double macdHistogram,
            MarketRegime regime,
            double bollingerWidth
    ) {
        public static Indicators from(IndicatorSnapshot snapshot) {
            return new Indicators(
                    snapshot.adx().value(),
                    snapshot.adx().plusDi(),
                    snapshot.adx().minusDi(),
                    snapshot.rsi(),
                    snapshot.macd().histogram(),
                    snapshot.regime(),
                    snapshot.bollinger().width()
            );
        }
    }

    public static NearMiss of(
            IndicatorSnapshot snapshot,
            TradeSide side,
            String rule,
            Instant timestamp,
            String reason,
            String blockedBy
    ) {
        return new NearMiss(
                snapshot.coin(),
                side,
                rule,
                snapshot.price(),
                timestamp,
                reason,
                blockedBy,
                Indicators.from(snapshot),
                null
        );
    }

    public NearMiss withMlScore(Double score) {
        return new NearMiss(coin, side, rule, price, timestamp, reason, blockedBy, indicators, score);
    }

    public String lessonKey() {
        return rule + "-" + side.wireName();
    }
}
