package org.nowstart.perpbot.config;

import org.nowstart.perpbot.data.property.ExchangeProperties;
import org.nowstart.perpbot.service.auth.HyperliquidActionSigner;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExchangeClientConfig {

    @Bean
    @RefreshScope
    public HyperliquidActionSigner hyperliquidActionSigner(ExchangeProperties exchangeProperties) {
        return new HyperliquidActionSigner(exchangeProperties.privateKey(), exchangeProperties.testnet());
    }
}
