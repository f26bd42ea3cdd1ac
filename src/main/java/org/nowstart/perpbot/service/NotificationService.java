package org.nowstart.perpbot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.perpbot.data.property.IntegrationProperties;
import org.nowstart.perpbot.repository.NtfyFeignClient;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    public static final String PRIORITY_DEFAULT = "default";
    public static final String PRIORITY_HIGH = "high";

    private final NtfyFeignClient ntfyFeignClient;
    private final IntegrationProperties integrationProperties;

    public void notify(String title, String body, String tags) {
        notify(title, body, tags, PRIORITY_DEFAULT);
    }

    public void notify(String title, String body, String tags, String priority) {
        IntegrationProperties.Ntfy ntfy = integrationProperties.ntfy();
        if (!ntfy.usable()) {
            return;
        }
        try {
            ntfyFeignClient.publish(ntfy.topic(), headerSafe(title), tags, priority, body);
        } catch (RuntimeException e) {
            log.warn("event=notify_failed title=\"{}\" reason={}", title, e.getMessage());
        }
    }

    // header values must stay ASCII
    static String headerSafe(String value) {
        return value.replace('\u2014', '-').replaceAll("[^\\x20-\\x7E]", "").trim();
    }
}
