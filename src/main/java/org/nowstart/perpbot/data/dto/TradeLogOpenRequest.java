package org.nowstart.perpbot.data.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TradeLogOpenRequest(
        String sessionId,
        String marketplace,
        String mode,
        String coin,
        String side,
        double entryPrice,
        double size,
        int leverage,
        String strategyReason,
        String orderId,
        String comment,
        String indicatorsJson
) {
}
