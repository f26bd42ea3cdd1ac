package org.nowstart.perpbot.strategy.core;

import java.time.Instant;

public record OhlcvCandle(
        Instant openTime,
        double open,
        double high,
        double low,
        double close,
        double volume
) {
}
