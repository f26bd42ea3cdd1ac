package org.nowstart.perpbot.service;

import static org.nowstart.perpbot.strategy.core.DecisionText.fixed;
import static org.nowstart.perpbot.strategy.core.DecisionText.usd;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.perpbot.data.dto.EntryProvenance;
import org.nowstart.perpbot.data.dto.ExitSignal;
import org.nowstart.perpbot.data.dto.IndicatorSnapshot;
import org.nowstart.perpbot.data.dto.OpenPosition;
import org.nowstart.perpbot.data.property.AgentProperties;
import org.nowstart.perpbot.service.exchange.ExchangeGateway;
import org.nowstart.perpbot.strategy.ExitSignalEvaluator;
import org.nowstart.perpbot.strategy.core.ExitInput;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class ExitService {

    static final double HIGH_PRIORITY_LOSS_USD = -10.0;

    private final AgentProperties agentProperties;
    private final AgentSession agentSession;
    private final ExchangeGateway exchangeGateway;
    private final RetryExecutor retryExecutor;
    private final MarketDataService marketDataService;
    private final VolatilityTracker volatilityTracker;
    private final ExitSignalEvaluator exitSignalEvaluator;
    private final TradeLogService tradeLogService;
    private final TrainingDataService trainingDataService;
    private final NotificationService notificationService;
    private final AgentLogService agentLogService;
    private final Clock clock;

    /**
     * Evaluates every open position independently; a failure on one coin never blocks the others.
     *
     * @return number of positions closed
     */
    public int checkExits(List<OpenPosition> positions) {
        int closed = 0;
        for (OpenPosition position : positions) {
            try {
                if (checkExit(position)) {
                    closed++;
                }
            } catch (RuntimeException e) {
                log.error("event=exit_check_failed coin={} reason={}", position.coin(), e.getMessage(), e);
            }
        }
        return closed;
    }

    private boolean checkExit(OpenPosition position) {
        String coin = position.coin();
        double currentPrice = retryExecutor.call("midPrice " + coin, () -> exchangeGateway.midPrice(coin));
        IndicatorSnapshot ind1h = retryExecutor.call(
                "indicators " + coin + " " + MarketDataService.INTERVAL_1H,
                () -> marketDataService.fetchIndicators(coin, MarketDataService.INTERVAL_1H)
        );
        if (ind1h == null) {
            log.debug("event=exit_skipped coin={} reason=insufficient_1h_data", coin);
            return false;
        }
        if (agentProperties.volatilityDetection()) {
            volatilityTracker.update(coin, ind1h.atr());
        }

        Optional<EntryProvenance> provenance = agentSession.provenance(coin);
        String entryRule = ExitInput.inferEntryRule(position, provenance.map(EntryProvenance::rule).orElse(null));
        boolean contrarian = agentSession.isContrarian(coin);

        Optional<ExitSignal> exitSignal = exitSignalEvaluator.evaluate(
                new ExitInput(position, entryRule, contrarian, currentPrice, ind1h, clock.instant()),
                agentSession.getAgentState()
        );
        double pnl = position.unrealizedPnl(currentPrice);
        double pnlPct = position.unrealizedPnlPct(currentPrice) * 100;
        if (exitSignal.isEmpty()) {
            log.debug(
                    "event=exit_hold coin={} side={} pnl={} pnl_pct={}",
                    coin,
                    position.side().wireName(),
                    fixed(pnl, 2),
                    fixed(pnlPct, 2)
            );
            return false;
        }

        ExitSignal exit = exitSignal.get();
        agentLogService.logExitSignal(position, exit, currentPrice, pnl, pnlPct);
        close(coin);

        String category = provenance.map(entry -> " [" + entry.category().wireName() + "]").orElse("");
        String signedPct = (pnlPct >= 0 ? "+" : "") + fixed(pnlPct, 2) + "%";
        tradeLogService.logTradeClose(
                provenance.map(EntryProvenance::tradeId).orElse(null),
                coin,
                currentPrice,
                pnl,
                exit.rule() + ": " + exit.reason()
                        + " | entry via " + entryRule + category
                        + " | PnL " + signedPct + " (" + usd(pnl) + ")"
        );
        provenance.ifPresent(entry -> trainingDataService.append(trainingDataService.buildRow(
                coin,
                position.side(),
                entryRule,
                pnl,
                exchangeGateway.mode(),
                entry.indicators(),
                agentSession.sentimentFor(coin)
        )));

        agentSession.recordExit(coin, entryRule, pnl);

        boolean win = pnl >= 0;
        String result = win ? "Win" : "Loss";
        notificationService.notify(
                coin + " " + position.side().wireName() + " closed - " + result,
                "**" + exit.rule() + "**\n\n"
                        + "- **Coin:** " + coin + " " + position.side().wireName() + "\n"
                        + "- **Entry:** $" + position.entryPrice() + " (" + entryRule + ")\n"
                        + "- **Exit:** $" + currentPrice + " (" + exit.rule() + ")\n"
                        + "- **PnL:** " + signedPct + " (" + usd(pnl) + ")\n"
                        + "- **Result:** " + result + "\n\n"
                        + "_" + agentSession.heldCount() + " positions remaining._",
                win ? "white_check_mark,moneybag"
                        : pnl < HIGH_PRIORITY_LOSS_USD ? "rotating_light,money_with_wings" : "x,money_with_wings",
                pnl < HIGH_PRIORITY_LOSS_USD ? NotificationService.PRIORITY_HIGH : NotificationService.PRIORITY_DEFAULT
        );
        return true;
    }

    private void close(String coin) {
        try {
            exchangeGateway.cancelOpenOrders(coin);
        } catch (RuntimeException e) {
            log.warn("event=cancel_triggers_failed coin={} reason={}", coin, e.getMessage());
        }
        retryExecutor.call("closePosition " + coin, () -> exchangeGateway.closePosition(coin));
    }
}
