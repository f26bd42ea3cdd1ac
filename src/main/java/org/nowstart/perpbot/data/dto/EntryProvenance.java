package org.nowstart.perpbot.data.dto;

import java.time.Instant;
import java.util.Map;
import org.nowstart.perpbot.data.type.StrategyCategory;

public record EntryProvenance(
        String rule,
        StrategyCategory category,
        String reason,
        double confidence,
        double entryPrice,
        double size,
        int leverage,
        Instant openedAt,
        Map<String, Object> indicators,
        String tradeId
) {
}
