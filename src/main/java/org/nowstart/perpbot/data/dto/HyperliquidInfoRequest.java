package org.nowstart.perpbot.data.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HyperliquidInfoRequest(
        String type,
        String user,
        CandleRequest req
) {

    public record CandleRequest(
            String coin,
            String interval,
            long startTime,
            long endTime
    ) {
    }

    public static HyperliquidInfoRequest meta() {
        return new HyperliquidInfoRequest("meta", null, null);
    }

    public static HyperliquidInfoRequest allMids() {
        return new HyperliquidInfoRequest("allMids", null, null);
    }

    public static HyperliquidInfoRequest clearinghouseState(String user) {
        return new HyperliquidInfoRequest("clearinghouseState", user, null);
    }

    public static HyperliquidInfoRequest spotClearinghouseState(String user) {
        return new HyperliquidInfoRequest("spotClearinghouseState", user, null);
    }

    public static HyperliquidInfoRequest openOrders(String user) {
        return new HyperliquidInfoRequest("openOrders", user, null);
    }

    public static HyperliquidInfoRequest candleSnapshot(String coin, String interval, long startTime, long endTime) {
        return new HyperliquidInfoRequest("candleSnapshot", null, new CandleRequest(coin, interval, startTime, endTime));
    }
}
