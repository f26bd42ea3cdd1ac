package org.nowstart.perpbot.repository;

import org.nowstart.perpbot.config.SentimentFeignConfig;
import org.nowstart.perpbot.data.dto.LunarCrushCoinListResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;

@FeignClient(
        name = "lunarCrushClient",
        url = "${perpbot.integration.sentiment.base-url}",
        configuration = SentimentFeignConfig.class
)
public interface LunarCrushFeignClient {

    @GetMapping("/api4/public/coins/list/v1")
    LunarCrushCoinListResponse getCoinList();
}
