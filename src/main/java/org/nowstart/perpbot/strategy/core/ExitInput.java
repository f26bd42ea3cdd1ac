package org.nowstart.perpbot.strategy.core;

import java.time.Instant;
import org.nowstart.perpbot.data.dto.IndicatorSnapshot;
import org.nowstart.perpbot.data.dto.OpenPosition;

/**
 * @param entryRule  rule that opened the position, inferred from the side when unknown
 * @param contrarian whether the position was opened as a contrarian fade
 */
public record ExitInput(
        OpenPosition position,
        String entryRule,
        boolean contrarian,
        double currentPrice,
        IndicatorSnapshot indicators,
        Instant evaluatedAt
) {

    public static String inferEntryRule(OpenPosition position, String recordedRule) {
        if (recordedRule != null) {
            return recordedRule;
        }
        return position.side().isBuy() ? "R3-trend" : "R4-trend";
    }
}
