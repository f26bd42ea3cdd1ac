package org.nowstart.perpbot.data.dto;

import java.time.Instant;

public record SentimentSnapshot(
        String coin,
        double galaxyScore,
        double sentiment,
        double socialVolume,
        double interactions24h,
        double socialDominance,
        double altRank,
        Instant fetchedAt
) {
}
