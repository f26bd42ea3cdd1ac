package org.nowstart.perpbot.service.auth;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class BearerTokenRequestInterceptor implements RequestInterceptor {

    private final String apiKey;

    @Override
    public void apply(RequestTemplate template) {
        if (apiKey != null && !apiKey.isBlank()) {
            template.header("Authorization", "Bearer " + apiKey);
        }
        template.header("Accept", "application/json");
        template.header("User-Agent", "perpbot/1.0");
    }
}
