package org.nowstart.perpbot.data.dto;

public record TradeLogSessionEndRequest(
        String statsJson
) {
}
