package org.nowstart.perpbot.config;

import java.time.Clock;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.perpbot.data.exception.StartupPreconditionException;
import org.nowstart.perpbot.data.property.AgentProperties;
import org.nowstart.perpbot.data.property.ExchangeProperties;
import org.nowstart.perpbot.data.type.ExecutionMode;
import org.nowstart.perpbot.repository.HyperliquidFeignClient;
import org.nowstart.perpbot.service.RetryExecutor;
import org.nowstart.perpbot.service.auth.HyperliquidActionSigner;
import org.nowstart.perpbot.service.exchange.ExchangeGateway;
import org.nowstart.perpbot.service.exchange.HyperliquidExchangeGateway;
import org.nowstart.perpbot.service.exchange.HyperliquidInfoService;
import org.nowstart.perpbot.service.exchange.PaperExchangeGateway;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Slf4j
@Configuration
public class AgentRuntimeConfig {

    static final int SHUTDOWN_AWAIT_SECONDS = 30;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random contrarianRandom(AgentProperties agentProperties) {
        Long seed = agentProperties.contrarianSeed();
        return seed == null ? new Random() : new Random(seed);
    }

    @Bean
    public RetryExecutor retryExecutor(AgentProperties agentProperties) {
        return new RetryExecutor(agentProperties.retryAttempts(), agentProperties.retryDelay());
    }

    /**
     * LIVE requires a private key and account address; without them the context fails and the
     * process exits with code 1.
     */
    @Bean
    public ExchangeGateway exchangeGateway(
            AgentProperties agentProperties,
            ExchangeProperties exchangeProperties,
            HyperliquidFeignClient hyperliquidFeignClient,
            HyperliquidInfoService hyperliquidInfoService,
            HyperliquidActionSigner hyperliquidActionSigner,
            Clock clock
    ) {
        if (agentProperties.executionMode() == ExecutionMode.LIVE) {
            if (!exchangeProperties.hasCredentials()) {
                throw new StartupPreconditionException(
                        "LIVE mode requires perpbot.exchange.private-key and perpbot.exchange.account-address"
                );
            }
            log.info("event=exchange_gateway mode=LIVE testnet={}", exchangeProperties.testnet());
            return new HyperliquidExchangeGateway(
                    hyperliquidFeignClient,
                    hyperliquidInfoService,
                    hyperliquidActionSigner,
                    exchangeProperties,
                    clock
            );
        }
        log.info("event=exchange_gateway mode=PAPER paper_balance={}", agentProperties.paperBalance());
        return new PaperExchangeGateway(hyperliquidInfoService, agentProperties.paperBalance());
    }

    @Bean
    public ThreadPoolTaskScheduler agentTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("perpbot-loop-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(SHUTDOWN_AWAIT_SECONDS);
        return scheduler;
    }
}
