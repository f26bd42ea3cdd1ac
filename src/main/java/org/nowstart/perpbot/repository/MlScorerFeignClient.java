package org.nowstart.perpbot.repository;

import org.nowstart.perpbot.data.dto.MlScoreRequest;
import org.nowstart.perpbot.data.dto.MlScoreResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

@FeignClient(
        name = "mlScorerClient",
        url = "${perpbot.integration.ml-scorer.base-url}"
)
public interface MlScorerFeignClient {

    @PostMapping(value = "/score", consumes = "application/json")
    MlScoreResponse score(@RequestBody MlScoreRequest request);
}
