package org.nowstart.perpbot.repository;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;

@FeignClient(
        name = "ntfyClient",
        url = "${perpbot.integration.ntfy.base-url}"
)
public interface NtfyFeignClient {

    @PostMapping(value = "/{topic}", consumes = "text/plain")
    void publish(
            @PathVariable("topic") String topic,
            @RequestHeader("Title") String title,
            @RequestHeader("Tags") String tags,
            @RequestHeader("Priority") String priority,
            @RequestBody String message
    );
}
