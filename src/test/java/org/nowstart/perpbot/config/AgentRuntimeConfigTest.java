package org.nowstart.perpbot.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.nowstart.perpbot.data.exception.StartupPreconditionException;
import org.nowstart.perpbot.data.property.AgentProperties;
import org.nowstart.perpbot.data.property.ExchangeProperties;
import org.nowstart.perpbot.data.type.ExecutionMode;
import org.nowstart.perpbot.fixture.PropertyFixtures;
import org.nowstart.perpbot.repository.HyperliquidFeignClient;
import org.nowstart.perpbot.service.RetryExecutor;
import org.nowstart.perpbot.service.auth.HyperliquidActionSigner;
import org.nowstart.perpbot.service.exchange.ExchangeGateway;
import org.nowstart.perpbot.service.exchange.HyperliquidExchangeGateway;
import org.nowstart.perpbot.service.exchange.HyperliquidInfoService;
import org.nowstart.perpbot.service.exchange.PaperExchangeGateway;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

class AgentRuntimeConfigTest {

    private final AgentRuntimeConfig config = new AgentRuntimeConfig();

    @Test
    void exchangeGateway_paperMode_usesVirtualFills() {
        ExchangeGateway gateway = gateway(PropertyFixtures.agent(), PropertyFixtures.exchange());

        assertThat(gateway).isInstanceOf(PaperExchangeGateway.class);
        assertThat(gateway.mode()).isEqualTo(ExecutionMode.PAPER);
        assertThat(gateway.fetchBalance().available()).isEqualTo(200.0);
    }

    @Test
    void exchangeGateway_liveModeWithoutCredentials_failsStartup() {
        AgentProperties live = PropertyFixtures.agent(ExecutionMode.LIVE, List.of("BTC"), 30, 24, 0);

        assertThatThrownBy(() -> gateway(live, PropertyFixtures.exchange()))
                .isInstanceOf(StartupPreconditionException.class)
                .hasMessageContaining("perpbot.exchange.private-key");
    }

    @Test
    void exchangeGateway_liveModeWithCredentials_signsRealOrders() {
        AgentProperties live = PropertyFixtures.agent(ExecutionMode.LIVE, List.of("BTC"), 30, 24, 0);
        ExchangeProperties credentials = new ExchangeProperties(
                "https://api.hyperliquid.xyz",
                true,
                "0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318",
                "0x2c7536E3605D9C16a7a3D7b1898e529396a65c23",
                50
        );

        ExchangeGateway gateway = gateway(live, credentials);

        assertThat(gateway).isInstanceOf(HyperliquidExchangeGateway.class);
        assertThat(gateway.mode()).isEqualTo(ExecutionMode.LIVE);
    }

    @Test
    void contrarianRandom_seeded_isReproducible() {
        AgentProperties agentProperties = PropertyFixtures.agent();

        Random first = config.contrarianRandom(agentProperties);
        Random second = config.contrarianRandom(agentProperties);

        assertThat(first.nextDouble()).isEqualTo(second.nextDouble());
    }

    @Test
    void retryExecutor_usesConfiguredAttemptsAndDelay() {
        RetryExecutor retryExecutor = config.retryExecutor(PropertyFixtures.agent());

        assertThat(retryExecutor.getRetries()).isEqualTo(2);
        assertThat(retryExecutor.getDelay()).isEqualTo(Duration.ZERO);
    }

    @Test
    void agentTaskScheduler_singleLoopThread() {
        ThreadPoolTaskScheduler scheduler = config.agentTaskScheduler();

        assertThat(scheduler.getPoolSize()).isEqualTo(1);
        assertThat(scheduler.getThreadNamePrefix()).isEqualTo("perpbot-loop-");
    }

    @Test
    void clock_isUtc() {
        assertThat(config.clock().getZone()).isEqualTo(Clock.systemUTC().getZone());
    }

    private ExchangeGateway gateway(AgentProperties agentProperties, ExchangeProperties exchangeProperties) {
        return config.exchangeGateway(
                agentProperties,
                exchangeProperties,
                mock(HyperliquidFeignClient.class),
                mock(HyperliquidInfoService.class),
                mock(HyperliquidActionSigner.class),
                Clock.systemUTC()
        );
    }
}
