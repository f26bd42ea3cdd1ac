package org.nowstart.perpbot.service;

import static org.nowstart.perpbot.strategy.core.DecisionText.fixed;
import static org.nowstart.perpbot.strategy.core.DecisionText.usd;

import java.util.HashSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.perpbot.data.dto.OpenPosition;
import org.nowstart.perpbot.data.dto.SentimentSignal;
import org.nowstart.perpbot.data.dto.VolatilityAssessment;
import org.nowstart.perpbot.data.property.AgentProperties;
import org.nowstart.perpbot.data.type.ExecutionMode;
import org.nowstart.perpbot.data.type.MarketVolatilityState;
import org.nowstart.perpbot.data.type.RiskVerdict;
import org.nowstart.perpbot.service.exchange.ExchangeGateway;
import org.nowstart.perpbot.strategy.SentimentSignalDetector;
import org.springframework.stereotype.Service;

/**
 * One pass of the control loop: sync, sentiment, exits, entries, volatility, risk limits, then
 * periodic bookkeeping.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentCycleService {

    static final int SENTIMENT_EVERY_CYCLES = 7;

    private final AgentProperties agentProperties;
    private final AgentSession agentSession;
    private final ExchangeGateway exchangeGateway;
    private final RetryExecutor retryExecutor;
    private final SentimentService sentimentService;
    private final SentimentSignalDetector sentimentSignalDetector;
    private final ExitService exitService;
    private final EntryService entryService;
    private final VolatilityTracker volatilityTracker;
    private final RiskGovernor riskGovernor;
    private final PeriodicReportService periodicReportService;
    private final NotificationService notificationService;
    private final AgentLogService agentLogService;

    /**
     * Exceptions from the position fetch propagate to the caller; per-coin failures are absorbed
     * by the entry and exit services.
     *
     * @return the risk verdict after this cycle; any terminal verdict ends the loop
     */
    public RiskVerdict runCycle() {
        long cycle = agentSession.nextCycle();

        List<OpenPosition> positions = retryExecutor.call("fetchPositions", exchangeGateway::fetchPositions);
        if (exchangeGateway.mode() == ExecutionMode.LIVE) {
            agentSession.resyncHeldCoins(positions.stream().map(OpenPosition::coin).toList());
        }
        agentLogService.logCycleStart(
                cycle,
                agentSession.elapsedHours(),
                positions.size(),
                agentProperties.maxPositions(),
                agentSession.realizedPnl()
        );

        refreshSentiment(cycle);

        Set<String> heldBefore = new HashSet<>(agentSession.heldCoins());
        exitService.checkExits(positions);
        entryService.checkEntries();
        boolean traded = !heldBefore.equals(new HashSet<>(agentSession.heldCoins()));

        if (agentProperties.volatilityDetection()) {
            assessVolatility();
        }

        if (traded) {
            try {
                periodicReportService.cycleSummary(cycle);
            } catch (RuntimeException e) {
                log.warn("event=cycle_summary_failed cycle={} reason={}", cycle, e.getMessage());
            }
        }

        RiskVerdict verdict = riskGovernor.evaluate(agentSession.realizedPnl(), agentSession.elapsedHours());
        if (verdict == RiskVerdict.CIRCUIT_BREAKER) {
            tripCircuitBreaker();
            return verdict;
        }
        if (verdict == RiskVerdict.SESSION_TIMEOUT) {
            log.info(
                    "event=session_timeout session_hours={} realized_pnl={}",
                    agentProperties.sessionHours(),
                    agentLogService.sanitizeMetricForLog(agentSession.realizedPnl())
            );
            notificationService.notify(
                    "Session Complete - " + fixed(agentProperties.sessionHours(), 0) + "h",
                    "**Time's up!**\n\n"
                            + "- **Session PnL:** " + usd(agentSession.realizedPnl()) + "\n"
                            + "- **Duration:** " + fixed(agentProperties.sessionHours(), 1) + "h\n\n"
                            + "_Signing off. Open positions are left in place._",
                    "checkered_flag"
            );
            return verdict;
        }

        periodicReportService.runPeriodicTasks(cycle);
        return RiskVerdict.CONTINUE;
    }

    boolean isSentimentDue(long cycle) {
        boolean highVolatility = volatilityTracker.sleepMultiplier() < 1;
        return cycle == 1 || highVolatility || cycle % SENTIMENT_EVERY_CYCLES == 0;
    }

    private void refreshSentiment(long cycle) {
        if (!isSentimentDue(cycle)) {
            return;
        }
        sentimentService.fetchSentiment(agentProperties.coins()).ifPresent(snapshots -> {
            List<SentimentSignal> signals = sentimentSignalDetector.detect(snapshots, agentSession.currentSentiment());
            agentSession.updateSentiment(snapshots, signals);
            for (SentimentSignal signal : signals) {
                log.info(
                        "event=sentiment_signal coin={} type={} strength={} reason=\"{}\"",
                        signal.coin(),
                        signal.type(),
                        signal.strength(),
                        signal.reason()
                );
            }
        });
    }

    private void assessVolatility() {
        VolatilityAssessment assessment = volatilityTracker.assess();
        if (!assessment.transitioned()) {
            return;
        }
        long intervalSeconds = periodicReportService.effectiveInterval().toSeconds();
        agentLogService.logVolatility(assessment, intervalSeconds);

        if (assessment.state() == MarketVolatilityState.SPIKE) {
            String body = "**Market volatility spiking!**\n\n" + ratioLines(assessment.spiked())
                    + (assessment.elevated().isEmpty() ? "" : "\n\nAlso elevated: " + String.join(", ", assessment.elevated()))
                    + "\n\n_Interval -> " + intervalSeconds + "s for rapid exit checks._";
            notificationService.notify("Volatility Spike - rapid monitoring", body, "zap,warning");
        } else if (assessment.state() == MarketVolatilityState.ELEVATED) {
            String body = "**Elevated volatility detected.**\n\n" + ratioLines(assessment.elevated())
                    + "\n\n_Interval -> " + intervalSeconds + "s._";
            notificationService.notify("Volatility Rising - faster checks", body, "zap");
        } else {
            notificationService.notify(
                    "Volatility Normal - back to standard",
                    "**Markets calmed down.** All coins back to normal volatility.\n\n_Interval -> " + intervalSeconds + "s._",
                    "leaves"
            );
        }
    }

    private String ratioLines(List<String> coins) {
        return coins.stream()
                .map(coin -> {
                    OptionalDouble ratio = volatilityTracker.atrRatio(coin);
                    return "- **" + coin + "** ATR " + (ratio.isPresent() ? fixed(ratio.getAsDouble(), 1) : "?") + "x normal";
                })
                .collect(Collectors.joining("\n"));
    }

    private void tripCircuitBreaker() {
        // stop first; the close below is best-effort
        agentSession.stop(RiskVerdict.CIRCUIT_BREAKER.name());
        double realized = agentSession.realizedPnl();
        log.error(
                "event=circuit_breaker realized_pnl={} limit={}",
                agentLogService.sanitizeMetricForLog(realized),
                agentProperties.circuitBreakerUsd()
        );
        notificationService.notify(
                "CIRCUIT BREAKER",
                "**Session loss limit hit. All positions closed.**\n\n"
                        + "- **Session loss:** " + usd(realized) + "\n"
                        + "- **Record:** " + agentSession.wins() + "W-" + agentSession.losses() + "L\n"
                        + "- **Limit:** $" + fixed(agentProperties.circuitBreakerUsd(), 2) + "\n\n"
                        + "_Going dark. Review and restart manually._",
                "rotating_light,skull",
                NotificationService.PRIORITY_HIGH
        );

        List<String> closed;
        try {
            closed = retryExecutor.call("closeAllPositions", exchangeGateway::closeAllPositions);
        } catch (RuntimeException e) {
            log.error("event=emergency_close_failed reason={}", e.getMessage(), e);
            notificationService.notify(
                    "Emergency Close Failed",
                    "**Circuit breaker could not close positions.**\n\n"
                            + "- **Error:** " + e.getMessage() + "\n\n"
                            + "_Close remaining positions manually._",
                    "rotating_light,x",
                    NotificationService.PRIORITY_HIGH
            );
            return;
        }
        for (String coin : closed) {
            log.warn("event=emergency_close coin={}", coin);
            if (exchangeGateway.mode() == ExecutionMode.LIVE) {
                notificationService.notify(
                        "Emergency Close - " + coin,
                        "**Circuit breaker:** closed " + coin,
                        "rotating_light",
                        NotificationService.PRIORITY_HIGH
                );
            }
        }
        agentSession.clearPositions();
    }
}
