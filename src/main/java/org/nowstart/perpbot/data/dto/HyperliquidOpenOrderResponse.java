package org.nowstart.perpbot.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HyperliquidOpenOrderResponse(
        String coin,
        long oid,
        String side,
        String sz,
        String limitPx
) {
}
