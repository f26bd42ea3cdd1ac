package org.nowstart.perpbot.repository;

import org.nowstart.perpbot.data.dto.TradeLogCloseRequest;
import org.nowstart.perpbot.data.dto.TradeLogOpenRequest;
import org.nowstart.perpbot.data.dto.TradeLogOpenResponse;
import org.nowstart.perpbot.data.dto.TradeLogSessionEndRequest;
import org.nowstart.perpbot.data.dto.TradeLogSessionRequest;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

@FeignClient(
        name = "tradeLogClient",
        url = "${perpbot.integration.trade-log.base-url}"
)
public interface TradeLogFeignClient {

    @PostMapping(value = "/api/sessions", consumes = "application/json")
    void registerSession(@RequestBody TradeLogSessionRequest request);

    @PostMapping(value = "/api/sessions/{id}/end", consumes = "application/json")
    void endSession(@PathVariable("id") String sessionId, @RequestBody TradeLogSessionEndRequest request);

    @PostMapping(value = "/api/trades", consumes = "application/json")
    TradeLogOpenResponse openTrade(@RequestBody TradeLogOpenRequest request);

    @PostMapping(value = "/api/trades/{id}/close", consumes = "application/json")
    void closeTrade(@PathVariable("id") String tradeId, @RequestBody TradeLogCloseRequest request);
}
