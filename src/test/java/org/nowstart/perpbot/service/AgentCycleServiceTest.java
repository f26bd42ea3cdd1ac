package org.nowstart.perpbot.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.perpbot.data.dto.OpenPosition;
import org.nowstart.perpbot.data.property.AgentProperties;
import org.nowstart.perpbot.data.type.ExecutionMode;
import org.nowstart.perpbot.data.type.RiskVerdict;
import org.nowstart.perpbot.data.type.TradeSide;
import org.nowstart.perpbot.fixture.IndicatorFixtures;
import org.nowstart.perpbot.fixture.PropertyFixtures;
import org.nowstart.perpbot.service.exchange.ExchangeGateway;
import org.nowstart.perpbot.strategy.SentimentSignalDetector;

@ExtendWith(MockitoExtension.class)
class AgentCycleServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private ExchangeGateway exchangeGateway;
    @Mock
    private SentimentService sentimentService;
    @Mock
    private ExitService exitService;
    @Mock
    private EntryService entryService;
    @Mock
    private PeriodicReportService periodicReportService;
    @Mock
    private NotificationService notificationService;

    private AgentSession agentSession;

    private AgentCycleService cycleService(AgentProperties agentProperties) {
        agentSession = new AgentSession(agentProperties, Clock.fixed(NOW, ZoneOffset.UTC));
        return new AgentCycleService(
                agentProperties,
                agentSession,
                exchangeGateway,
                new RetryExecutor(0, Duration.ZERO),
                sentimentService,
                new SentimentSignalDetector(),
                exitService,
                entryService,
                new VolatilityTracker(),
                new RiskGovernor(agentProperties),
                periodicReportService,
                notificationService,
                new AgentLogService()
        );
    }

    @Test
    void runCycle_quietCycle_continuesAndRunsPeriodicTasks() {
        AgentCycleService service = cycleService(PropertyFixtures.agent());
        when(exchangeGateway.fetchPositions()).thenReturn(List.of());
        when(exchangeGateway.mode()).thenReturn(ExecutionMode.PAPER);
        when(sentimentService.fetchSentiment(List.of("BTC", "ETH", "SOL"))).thenReturn(Optional.empty());

        RiskVerdict verdict = service.runCycle();

        assertThat(verdict).isEqualTo(RiskVerdict.CONTINUE);
        assertThat(agentSession.cycleCount()).isEqualTo(1);
        assertThat(agentSession.sentimentAvailable()).isFalse();
        verify(exitService).checkExits(List.of());
        verify(entryService).checkEntries();
        verify(periodicReportService).runPeriodicTasks(1);
        verify(periodicReportService, never()).cycleSummary(anyLong());
    }

    @Test
    void runCycle_liveMode_resyncsHeldCoinsFromExchange() {
        AgentCycleService service = cycleService(PropertyFixtures.agent(ExecutionMode.LIVE, List.of("BTC"), 30, 24, 0));
        agentSession.adopt("DOGE", NOW);
        List<OpenPosition> positions = List.of(new OpenPosition("BTC", TradeSide.LONG, 0.01, 60000, 3));
        when(exchangeGateway.fetchPositions()).thenReturn(positions);
        when(exchangeGateway.mode()).thenReturn(ExecutionMode.LIVE);
        when(sentimentService.fetchSentiment(List.of("BTC"))).thenReturn(Optional.empty());

        service.runCycle();

        assertThat(agentSession.heldCoins()).containsExactly("BTC");
        verify(exitService).checkExits(positions);
    }

    @Test
    void runCycle_positionOpened_pushesCycleSummary() {
        AgentCycleService service = cycleService(PropertyFixtures.agent());
        when(exchangeGateway.fetchPositions()).thenReturn(List.of());
        when(exchangeGateway.mode()).thenReturn(ExecutionMode.PAPER);
        when(sentimentService.fetchSentiment(anyList())).thenReturn(Optional.empty());
        doAnswer(invocation -> {
            agentSession.adopt("ETH", NOW);
            return true;
        }).when(entryService).checkEntries();

        service.runCycle();

        verify(periodicReportService).cycleSummary(1);
    }

    @Test
    void runCycle_sentimentFetched_storesSnapshotsInSession() {
        AgentCycleService service = cycleService(PropertyFixtures.agent());
        when(exchangeGateway.fetchPositions()).thenReturn(List.of());
        when(exchangeGateway.mode()).thenReturn(ExecutionMode.PAPER);
        when(sentimentService.fetchSentiment(anyList()))
                .thenReturn(Optional.of(List.of(IndicatorFixtures.sentiment("BTC", 70, 80))));

        service.runCycle();

        assertThat(agentSession.sentimentAvailable()).isTrue();
        assertThat(agentSession.sentimentFor("BTC").galaxyScore()).isEqualTo(70);
    }

    @Test
    void runCycle_lossBeyondLimit_tripsCircuitBreakerAndClosesEverything() {
        AgentCycleService service = cycleService(PropertyFixtures.agent());
        agentSession.recordExit("ETH", "R3-trend", -31.0);
        agentSession.adopt("BTC", NOW);
        when(exchangeGateway.fetchPositions()).thenReturn(List.of(new OpenPosition("BTC", TradeSide.LONG, 0.01, 60000, 3)));
        when(exchangeGateway.mode()).thenReturn(ExecutionMode.PAPER);
        when(sentimentService.fetchSentiment(anyList())).thenReturn(Optional.empty());
        when(exchangeGateway.closeAllPositions()).thenReturn(List.of("BTC"));

        RiskVerdict verdict = service.runCycle();

        assertThat(verdict).isEqualTo(RiskVerdict.CIRCUIT_BREAKER);
        assertThat(agentSession.isStopped()).isTrue();
        assertThat(agentSession.heldCount()).isZero();
        verify(notificationService).notify(
                eq("CIRCUIT BREAKER"),
                anyString(),
                eq("rotating_light,skull"),
                eq(NotificationService.PRIORITY_HIGH)
        );
        verify(notificationService, never()).notify(eq("Emergency Close - BTC"), anyString(), anyString(), anyString());
        verify(periodicReportService, never()).runPeriodicTasks(anyLong());
    }

    @Test
    void runCycle_emergencyCloseFails_stillStopsSessionAndReturnsBreaker() {
        AgentCycleService service = cycleService(PropertyFixtures.agent());
        agentSession.recordExit("ETH", "R3-trend", -31.0);
        agentSession.adopt("BTC", NOW);
        when(exchangeGateway.fetchPositions()).thenReturn(List.of(new OpenPosition("BTC", TradeSide.LONG, 0.01, 60000, 3)));
        when(exchangeGateway.mode()).thenReturn(ExecutionMode.LIVE);
        when(sentimentService.fetchSentiment(anyList())).thenReturn(Optional.empty());
        when(exchangeGateway.closeAllPositions()).thenThrow(new IllegalStateException("clearinghouse unavailable"));

        RiskVerdict verdict = service.runCycle();

        assertThat(verdict).isEqualTo(RiskVerdict.CIRCUIT_BREAKER);
        assertThat(agentSession.isStopped()).isTrue();
        assertThat(agentSession.stopReason()).isEqualTo("CIRCUIT_BREAKER");
        assertThat(agentSession.heldCoins()).containsExactly("BTC");
        verify(notificationService).notify(
                eq("Emergency Close Failed"),
                anyString(),
                eq("rotating_light,x"),
                eq(NotificationService.PRIORITY_HIGH)
        );
        verify(periodicReportService, never()).runPeriodicTasks(anyLong());
    }

    @Test
    void runCycle_sessionExpired_stopsWithoutClosingPositions() {
        AgentCycleService service = cycleService(PropertyFixtures.agent(ExecutionMode.PAPER, List.of("BTC"), 30, 0, 0));
        when(exchangeGateway.fetchPositions()).thenReturn(List.of());
        when(exchangeGateway.mode()).thenReturn(ExecutionMode.PAPER);
        when(sentimentService.fetchSentiment(anyList())).thenReturn(Optional.empty());

        RiskVerdict verdict = service.runCycle();

        assertThat(verdict).isEqualTo(RiskVerdict.SESSION_TIMEOUT);
        verify(notificationService).notify(eq("Session Complete - 0h"), anyString(), eq("checkered_flag"));
        verify(exchangeGateway, never()).closeAllPositions();
    }

    @Test
    void isSentimentDue_firstCycleAndEverySeventh() {
        AgentCycleService service = cycleService(PropertyFixtures.agent());

        assertThat(service.isSentimentDue(1)).isTrue();
        assertThat(service.isSentimentDue(2)).isFalse();
        assertThat(service.isSentimentDue(7)).isTrue();
        assertThat(service.isSentimentDue(8)).isFalse();
        assertThat(service.isSentimentDue(14)).isTrue();
    }
}
