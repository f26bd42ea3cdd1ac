package org.nowstart.perpbot.data.dto;

public record TradeLogCloseRequest(
        double exitPrice,
        double realizedPnl,
        String comment
) {
}
