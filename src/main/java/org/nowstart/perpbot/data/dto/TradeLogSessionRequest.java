package org.nowstart.perpbot.data.dto;

public record TradeLogSessionRequest(
        String id,
        String marketplace,
        String mode,
        String env,
        String profileJson
) {
}
