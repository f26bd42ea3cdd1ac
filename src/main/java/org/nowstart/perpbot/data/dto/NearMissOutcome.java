package org.nowstart.perpbot.data.dto;

import java.time.Instant;

public record NearMissOutcome(
        NearMiss miss,
        double priceLater,
        double pnlPct,
        boolean wouldHaveWon,
        Instant checkedAt
) {
}
