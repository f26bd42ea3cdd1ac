package org.nowstart.perpbot.data.dto;

import org.nowstart.perpbot.data.type.SentimentSignalType;
import org.nowstart.perpbot.data.type.SignalStrength;

public record SentimentSignal(
        String coin,
        SentimentSignalType type,
        SignalStrength strength,
        String reason,
        SentimentSnapshot snapshot
) {
}
