package org.nowstart.perpbot.service;

import static org.nowstart.perpbot.strategy.core.DecisionText.fixed;
import static org.nowstart.perpbot.strategy.core.DecisionText.usd;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.perpbot.data.dto.AccountBalance;
import org.nowstart.perpbot.data.dto.OpenPosition;
import org.nowstart.perpbot.data.property.AgentProperties;
import org.nowstart.perpbot.data.type.ExecutionMode;
import org.nowstart.perpbot.data.type.RiskVerdict;
import org.nowstart.perpbot.service.exchange.ExchangeGateway;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Session start, risk-limit termination and interrupt shutdown. Session close-out runs at most once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentLifecycleService {

    private final AgentProperties agentProperties;
    private final AgentSession agentSession;
    private final ExchangeGateway exchangeGateway;
    private final RetryExecutor retryExecutor;
    private final TradeLogService tradeLogService;
    private final NotificationService notificationService;
    private final PeriodicReportService periodicReportService;
    private final ApplicationExitService applicationExitService;
    private final Clock clock;

    private final AtomicBoolean closedOut = new AtomicBoolean();
    private volatile boolean started;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        ExecutionMode mode = exchangeGateway.mode();
        log.info(
                "event=agent_config session_id={} mode={} interval={} coins={} max_positions={} max_alloc_pct={} leverage={} circuit_breaker_usd={} session_hours={} contrarian_pct={} contrarian_slots={} volatility_detection={}",
                agentSession.getSessionId(),
                mode,
                agentProperties.interval(),
                agentProperties.coins(),
                agentProperties.maxPositions(),
                agentProperties.maxAllocPct(),
                agentProperties.leverage(),
                agentProperties.circuitBreakerUsd(),
                agentProperties.sessionHours(),
                agentProperties.contrarianPct(),
                agentProperties.contrarianSlots(),
                agentProperties.volatilityDetection()
        );

        AccountBalance balance = retryExecutor.call("fetchBalance", exchangeGateway::fetchBalance);
        log.info(
                "event=agent_balance account_value={} margin_used={} available={}",
                balance.accountValue(),
                balance.marginUsed(),
                balance.available()
        );

        tradeLogService.registerSession(agentSession.getSessionId(), mode, profile());
        if (mode == ExecutionMode.LIVE) {
            adoptExistingPositions();
        }

        notificationService.notify(
                mode == ExecutionMode.PAPER ? "Paper Trading Started" : "Real Trading Started",
                "**Session " + agentSession.getSessionId() + " is up.**\n\n"
                        + "- **Balance:** $" + fixed(balance.accountValue(), 2) + (mode == ExecutionMode.PAPER ? " paper (virtual)" : "") + "\n"
                        + "- **Positions:** " + agentSession.heldCount() + " open\n"
                        + "- **Max:** " + agentProperties.maxPositions() + "\n"
                        + "- **Coins:** " + String.join(", ", agentProperties.coins()) + "\n"
                        + "- **Leverage:** " + agentProperties.leverage() + "x\n"
                        + "- **Interval:** " + agentProperties.interval().toMinutes() + "min\n"
                        + "- **Vol-detect:** " + (agentProperties.volatilityDetection() ? "ON" : "OFF") + "\n"
                        + "- **Contrarian:** " + (agentProperties.contrarianPct() > 0
                        ? fixed(agentProperties.contrarianPct(), 0) + "% (max " + agentProperties.contrarianSlots() + " positions)"
                        : "OFF"),
                "rocket,robot"
        );
        started = true;
    }

    public boolean isStarted() {
        return started;
    }

    /**
     * Ends the session after a circuit breaker or session timeout and exits with code 0.
     */
    public void terminate(RiskVerdict verdict) {
        agentSession.stop(verdict.name());
        log.info(
                "event=session_end reason={} realized_pnl={} wins={} losses={}",
                verdict,
                agentSession.realizedPnl(),
                agentSession.wins(),
                agentSession.losses()
        );
        closeOut();
        notificationService.notify(
                "Agent Stopped",
                "**Session complete.**\n\n"
                        + "- **Realized PnL:** " + usd(agentSession.realizedPnl()) + "\n"
                        + "- **Record:** " + agentSession.wins() + "W-" + agentSession.losses() + "L\n\n"
                        + "_Until next time._",
                "wave"
        );
        applicationExitService.exit(0);
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        if (!started || closedOut.get()) {
            return;
        }
        agentSession.stop("interrupt");
        List<String> held = agentSession.heldCoins();
        log.info(
                "event=agent_interrupted held_not_closed={} realized_pnl={}",
                held.isEmpty() ? "none" : String.join(",", held),
                agentSession.realizedPnl()
        );
        closeOut();
        notificationService.notify(
                "Agent Stopped (manual)",
                "**Interrupted, shutting down.**\n\n"
                        + "- **Positions held (NOT closed):** " + (held.isEmpty() ? "none" : String.join(", ", held)) + "\n"
                        + "- **Realized PnL:** " + usd(agentSession.realizedPnl()) + "\n"
                        + "- **Record:** " + agentSession.wins() + "W-" + agentSession.losses() + "L",
                "stop_sign"
        );
    }

    private void closeOut() {
        if (!closedOut.compareAndSet(false, true)) {
            return;
        }
        periodicReportService.persistLessons();
        tradeLogService.closeSession(
                agentSession.getSessionId(),
                agentSession.wins(),
                agentSession.losses(),
                agentSession.realizedPnl()
        );
    }

    private void adoptExistingPositions() {
        List<OpenPosition> positions = retryExecutor.call("fetchPositions", exchangeGateway::fetchPositions);
        for (OpenPosition position : positions) {
            agentSession.adopt(position.coin(), clock.instant());
            log.info(
                    "event=position_adopted coin={} side={} size={} entry={} leverage={}",
                    position.coin(),
                    position.side().wireName(),
                    position.size(),
                    position.entryPrice(),
                    position.leverage()
            );
        }
    }

    private Map<String, Object> profile() {
        Map<String, Object> profile = new LinkedHashMap<>();
        profile.put("coins", agentProperties.coins());
        profile.put("intervalMinutes", agentProperties.interval().toMinutes());
        profile.put("maxPositions", agentProperties.maxPositions());
        profile.put("maxAllocPct", agentProperties.maxAllocPct());
        profile.put("leverage", agentProperties.leverage());
        profile.put("circuitBreakerUsd", agentProperties.circuitBreakerUsd());
        profile.put("sessionHours", agentProperties.sessionHours());
        profile.put("contrarianPct", agentProperties.contrarianPct());
        profile.put("volatilityDetection", agentProperties.volatilityDetection());
        return profile;
    }
}
