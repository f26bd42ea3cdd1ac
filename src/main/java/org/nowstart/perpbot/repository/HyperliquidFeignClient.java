package org.nowstart.perpbot.repository;

import java.util.List;
import java.util.Map;
import org.nowstart.perpbot.data.dto.HyperliquidCandleResponse;
import org.nowstart.perpbot.data.dto.HyperliquidClearinghouseStateResponse;
import org.nowstart.perpbot.data.dto.HyperliquidExchangeRequest;
import org.nowstart.perpbot.data.dto.HyperliquidExchangeResponse;
import org.nowstart.perpbot.data.dto.HyperliquidInfoRequest;
import org.nowstart.perpbot.data.dto.HyperliquidMetaResponse;
import org.nowstart.perpbot.data.dto.HyperliquidOpenOrderResponse;
import org.nowstart.perpbot.data.dto.HyperliquidSpotStateResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

@FeignClient(
        name = "hyperliquidClient",
        url = "${perpbot.exchange.base-url}"
)
public interface HyperliquidFeignClient {

    @PostMapping(value = "/info", consumes = "application/json")
    HyperliquidMetaResponse getMeta(@RequestBody HyperliquidInfoRequest request);

    @PostMapping(value = "/info", consumes = "application/json")
    Map<String, String> getAllMids(@RequestBody HyperliquidInfoRequest request);

    @PostMapping(value = "/info", consumes = "application/json")
    List<HyperliquidCandleResponse> getCandles(@RequestBody HyperliquidInfoRequest request);

    @PostMapping(value = "/info", consumes = "application/json")
    HyperliquidClearinghouseStateResponse getClearinghouseState(@RequestBody HyperliquidInfoRequest request);

    @PostMapping(value = "/info", consumes = "application/json")
    HyperliquidSpotStateResponse getSpotState(@RequestBody HyperliquidInfoRequest request);

    @PostMapping(value = "/info", consumes = "application/json")
    List<HyperliquidOpenOrderResponse> getOpenOrders(@RequestBody HyperliquidInfoRequest request);

    @PostMapping(value = "/exchange", consumes = "application/json")
    HyperliquidExchangeResponse postExchange(@RequestBody HyperliquidExchangeRequest request);
}
