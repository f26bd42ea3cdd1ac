package org.nowstart.perpbot.data.dto;

import org.nowstart.perpbot.data.type.TradeSide;

/**
 * Exchange-side view of a position. {@code size} is always the absolute quantity.
 */
public record OpenPosition(
        String coin,
        TradeSide side,
        double size,
        double entryPrice,
        int leverage
) {

    public double notional() {
        return size * entryPrice;
    }

    public double unrealizedPnl(double currentPrice) {
        return side == TradeSide.LONG
                ? size * (currentPrice - entryPrice)
                : size * (entryPrice - currentPrice);
    }

    public double unrealizedPnlPct(double currentPrice) {
        double notional = notional();
        return notional > 0 ? unrealizedPnl(currentPrice) / notional : 0.0;
    }
}
