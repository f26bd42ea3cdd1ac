package org.nowstart.perpbot.config;

import feign.RequestInterceptor;
import org.nowstart.perpbot.data.property.IntegrationProperties;
import org.nowstart.perpbot.service.auth.BearerTokenRequestInterceptor;
import org.springframework.context.annotation.Bean;

/**
 * Referenced only from {@code LunarCrushFeignClient}. Not a {@code @Configuration} so the
 * interceptor stays scoped to that client.
 */
public class SentimentFeignConfig {

    @Bean
    public RequestInterceptor sentimentAuthRequestInterceptor(IntegrationProperties integrationProperties) {
        return new BearerTokenRequestInterceptor(integrationProperties.sentiment().apiKey());
    }
}
