package org.nowstart.perpbot.service;

import static org.nowstart.perpbot.strategy.core.DecisionText.fixed;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.perpbot.data.dto.AccountBalance;
import org.nowstart.perpbot.data.dto.AssetMeta;
import org.nowstart.perpbot.data.dto.EntryProvenance;
import org.nowstart.perpbot.data.dto.IndicatorSnapshot;
import org.nowstart.perpbot.data.dto.MlScore;
import org.nowstart.perpbot.data.dto.NearMiss;
import org.nowstart.perpbot.data.dto.OrderResult;
import org.nowstart.perpbot.data.dto.PositionSizing;
import org.nowstart.perpbot.data.dto.SentimentSignal;
import org.nowstart.perpbot.data.dto.SentimentSnapshot;
import org.nowstart.perpbot.data.dto.Signal;
import org.nowstart.perpbot.data.dto.TpSlConfig;
import org.nowstart.perpbot.data.property.AgentProperties;
import org.nowstart.perpbot.data.property.ExchangeProperties;
import org.nowstart.perpbot.data.type.ExecutionMode;
import org.nowstart.perpbot.service.exchange.ExchangeGateway;
import org.nowstart.perpbot.strategy.EntrySignalEvaluator;
import org.nowstart.perpbot.strategy.NearMissDetector;
import org.nowstart.perpbot.strategy.PositionSizer;
import org.nowstart.perpbot.strategy.ProtectiveOrderPolicy;
import org.nowstart.perpbot.strategy.SentimentEntryRules;
import org.nowstart.perpbot.strategy.core.ContrarianDecision;
import org.springframework.stereotype.Service;

/**
 * Scans every configured coin, keeps the single best candidate of the cycle and opens it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntryService {

    static final double MIN_AVAILABLE_USD = 20.0;
    static final double PREFLIGHT_TOLERANCE = 1.1;

    private final AgentProperties agentProperties;
    private final ExchangeProperties exchangeProperties;
    private final AgentSession agentSession;
    private final ExchangeGateway exchangeGateway;
    private final RetryExecutor retryExecutor;
    private final MarketDataService marketDataService;
    private final VolatilityTracker volatilityTracker;
    private final EntrySignalEvaluator entrySignalEvaluator;
    private final SentimentEntryRules sentimentEntryRules;
    private final NearMissDetector nearMissDetector;
    private final NearMissRecorder nearMissRecorder;
    private final ConfidenceScoringService confidenceScoringService;
    private final PositionSizer positionSizer;
    private final ProtectiveOrderPolicy protectiveOrderPolicy;
    private final TradeLogService tradeLogService;
    private final NotificationService notificationService;
    private final AgentLogService agentLogService;
    private final Random contrarianRandom;
    private final Clock clock;

    record Candidate(Signal signal, IndicatorSnapshot indicators, MlScore mlScore) {
    }

    /**
     * @return whether a position was opened this cycle
     */
    public boolean checkEntries() {
        int maxPositions = agentProperties.maxPositions();
        if (agentSession.heldCount() >= maxPositions) {
            log.debug("event=entry_skipped reason=max_positions held={} max={}", agentSession.heldCount(), maxPositions);
            return false;
        }

        AccountBalance balance = retryExecutor.call("fetchBalance", exchangeGateway::fetchBalance);
        double available = balance.available();
        if (available < MIN_AVAILABLE_USD) {
            log.debug("event=entry_skipped reason=low_balance available={}", agentLogService.sanitizeMetricForLog(available));
            return false;
        }

        Candidate best = null;
        for (String coin : agentProperties.coins()) {
            if (agentSession.isHeld(coin)) {
                continue;
            }
            if (agentSession.heldCount() >= maxPositions) {
                break;
            }
            try {
                Optional<Candidate> candidate = scan(coin);
                if (candidate.isPresent()
                        && (best == null || candidate.get().signal().confidence() > best.signal().confidence())) {
                    best = candidate.get();
                }
            } catch (RuntimeException e) {
                log.error("event=entry_scan_failed coin={} reason={}", coin, e.getMessage(), e);
            }
        }

        if (best == null) {
            log.debug("event=entry_none cycle={}", agentSession.cycleCount());
            return false;
        }
        return open(best, available);
    }

    Optional<Candidate> scan(String coin) {
        IndicatorSnapshot ind1h = retryExecutor.call(
                "indicators " + coin + " " + MarketDataService.INTERVAL_1H,
                () -> marketDataService.fetchIndicators(coin, MarketDataService.INTERVAL_1H)
        );
        if (ind1h == null) {
            log.debug("event=entry_skipped coin={} reason=insufficient_1h_data", coin);
            return Optional.empty();
        }
        if (agentProperties.volatilityDetection()) {
            volatilityTracker.update(coin, ind1h.atr());
        }
        IndicatorSnapshot ind15m = fetchSecondaryTimeframe(coin);
        agentLogService.logIndicators(ind1h);

        boolean sentimentAvailable = agentSession.sentimentAvailable();
        SentimentSnapshot sentiment = sentimentAvailable ? agentSession.sentimentFor(coin) : null;
        List<SentimentSignal> coinSignals = sentimentAvailable ? agentSession.sentimentSignalsFor(coin) : List.of();

        Optional<Signal> technical = entrySignalEvaluator.evaluate(ind1h, ind15m, coin, agentSession.getAgentState());
        if (technical.isEmpty() && sentiment != null) {
            technical = sentimentEntryRules.sentimentAssistedTrend(ind1h, sentiment);
        }
        if (technical.isEmpty() && sentiment != null) {
            technical = sentimentEntryRules.sentimentConfirmed(ind1h, sentiment);
        }
        if (technical.isEmpty()) {
            recordNearMisses(ind1h, sentiment, sentimentAvailable ? coinSignals : null);
            return Optional.empty();
        }

        Signal signal = sentimentEntryRules.applyBoost(technical.get(), sentiment, coinSignals);
        if (sentimentAvailable) {
            ContrarianDecision decision = sentimentEntryRules.contrarian(
                    signal,
                    ind1h,
                    sentiment,
                    agentProperties.contrarianPct(),
                    agentSession.openContrarianCount(),
                    agentProperties.contrarianSlots(),
                    contrarianRandom::nextDouble
            );
            switch (decision.outcome()) {
                case FLIPPED -> log.info(
                        "event=contrarian_flip coin={} rule={} side={} confidence={}",
                        coin,
                        decision.signal().rule(),
                        decision.signal().side().wireName(),
                        fixed(decision.signal().confidence(), 2)
                );
                case SLOTS_FULL -> log.debug(
                        "event=contrarian_slots_full coin={} open={} slots={}",
                        coin,
                        agentSession.openContrarianCount(),
                        agentProperties.contrarianSlots()
                );
                case BELOW_FLOOR -> {
                    Signal flipped = decision.signal();
                    nearMissRecorder.record(NearMiss.of(
                            ind1h,
                            flipped.side(),
                            flipped.rule(),
                            clock.instant(),
                            flipped.reason(),
                            "Contrarian confidence " + fixed(flipped.confidence(), 2)
                                    + " < " + SentimentEntryRules.CONTRARIAN_FLOOR
                    ));
                    return Optional.empty();
                }
                default -> {
                }
            }
            signal = decision.signal();
        }

        MlScore mlScore = confidenceScoringService.scoreSignal(coin, signal.side(), signal.rule(), ind1h, sentiment);
        if (mlScore.isPresent()) {
            double blended = mlScore.blend(signal.confidence());
            log.debug(
                    "event=ml_blend coin={} score={} samples={} confidence={} blended={}",
                    coin,
                    fixed(mlScore.score(), 3),
                    mlScore.modelSamples(),
                    fixed(signal.confidence(), 2),
                    fixed(blended, 2)
            );
            signal = signal.withConfidence(blended);
        }
        return Optional.of(new Candidate(signal, ind1h, mlScore));
    }

    private IndicatorSnapshot fetchSecondaryTimeframe(String coin) {
        try {
            return retryExecutor.call(
                    "indicators " + coin + " " + MarketDataService.INTERVAL_15M,
                    () -> marketDataService.fetchIndicators(coin, MarketDataService.INTERVAL_15M)
            );
        } catch (RuntimeException e) {
            log.debug("event=secondary_timeframe_unavailable coin={} reason={}", coin, e.getMessage());
            return null;
        }
    }

    /**
     * @param coinSignals sentiment signals for the coin, {@code null} while sentiment is unavailable
     */
    private void recordNearMisses(IndicatorSnapshot ind1h, SentimentSnapshot sentiment, List<SentimentSignal> coinSignals) {
        Instant now = clock.instant();
        Map<String, MlScore> scoreBySide = new HashMap<>();
        for (NearMiss miss : nearMissDetector.detect(ind1h, now)) {
            MlScore score = scoreBySide.computeIfAbsent(
                    miss.coin() + ":" + miss.side().wireName(),
                    key -> confidenceScoringService.scoreSignal(miss.coin(), miss.side(), miss.rule(), ind1h, sentiment)
            );
            nearMissRecorder.record(score.isPresent() ? miss.withMlScore(score.score()) : miss);
        }
        if (coinSignals != null) {
            nearMissDetector.detectSentimentOnly(ind1h, coinSignals, now).forEach(nearMissRecorder::record);
        }
    }

    private boolean open(Candidate candidate, double available) {
        Signal signal = candidate.signal();
        IndicatorSnapshot ind1h = candidate.indicators();
        String coin = signal.coin();
        int leverage = agentProperties.leverage();

        Optional<AssetMeta> meta = retryExecutor.call("assetMeta " + coin, () -> exchangeGateway.assetMeta(coin));
        int szDecimals = meta.map(AssetMeta::szDecimals).orElse(AssetMeta.DEFAULT_SZ_DECIMALS);
        Optional<PositionSizing> maybeSizing = positionSizer.size(
                available,
                signal,
                ind1h.price(),
                leverage,
                agentProperties.maxAllocPct(),
                szDecimals
        );
        if (maybeSizing.isEmpty()) {
            log.debug("event=entry_rejected coin={} reason=below_min_notional", coin);
            return false;
        }
        PositionSizing sizing = maybeSizing.get();

        double marginNeeded = sizing.notional() / leverage;
        double allocationCap = available * (agentProperties.maxAllocPct() / 100.0) * PREFLIGHT_TOLERANCE;
        if (marginNeeded > allocationCap) {
            log.debug(
                    "event=entry_rejected coin={} reason=margin_exceeds_allocation margin={} cap={}",
                    coin,
                    fixed(marginNeeded, 2),
                    fixed(allocationCap, 2)
            );
            return false;
        }

        int effectiveLeverage = meta.map(asset -> Math.min(leverage, asset.maxLeverage())).orElse(leverage);
        TpSlConfig tpSl = protectiveOrderPolicy.resolve(signal);
        agentLogService.logEntrySignal(signal, sizing, effectiveLeverage, tpSl, ind1h.price());

        OrderResult result;
        try {
            result = retryExecutor.call(
                    "placeMarketOrder " + coin,
                    () -> exchangeGateway.placeMarketOrder(
                            coin,
                            signal.side(),
                            sizing.size(),
                            effectiveLeverage,
                            exchangeProperties.slippageBps(),
                            tpSl
                    )
            );
        } catch (RuntimeException e) {
            log.error("event=entry_order_failed coin={} side={} reason={}", coin, signal.side().wireName(), e.getMessage(), e);
            notificationService.notify(
                    "Order Failed - " + coin + " " + signal.side().wireName(),
                    "**Order rejected!**\n\n"
                            + "- **Coin:** " + coin + " " + signal.side().wireName() + "\n"
                            + "- **Size:** " + sizing.size() + "\n"
                            + "- **Error:** " + e.getMessage() + "\n\n"
                            + "_Will retry next cycle._",
                    "warning,x",
                    NotificationService.PRIORITY_HIGH
            );
            return false;
        }

        ExecutionMode mode = exchangeGateway.mode();
        double entryPrice = result.averagePrice() > 0 ? result.averagePrice() : ind1h.price();
        Map<String, Object> indicators = ind1h.flatten();
        agentSession.recordEntry(new EntryProvenance(
                signal.rule(),
                signal.category(),
                signal.reason(),
                signal.confidence(),
                entryPrice,
                sizing.size(),
                effectiveLeverage,
                clock.instant(),
                indicators,
                null
        ), coin, signal.isContrarian());
        log.info(
                "event=entry_opened mode={} coin={} side={} rule={} order_id={} status={} entry={}",
                mode,
                coin,
                signal.side().wireName(),
                signal.rule(),
                result.orderId(),
                result.status(),
                agentLogService.sanitizeMetricForLog(entryPrice)
        );

        String paperPrefix = mode == ExecutionMode.PAPER ? "PAPER: " : "";
        tradeLogService.logTradeOpen(new TradeLogService.TradeOpen(
                agentSession.getSessionId(),
                mode,
                coin,
                signal.side(),
                entryPrice,
                sizing.size(),
                effectiveLeverage,
                signal.rule(),
                signal.category().wireName(),
                result.orderId(),
                paperPrefix + signal.reason()
                        + " | confidence=" + fixed(signal.confidence(), 2)
                        + " | regime=" + ind1h.regime().wireName()
                        + " ADX=" + fixed(ind1h.adx().value(), 1)
                        + " RSI=" + fixed(ind1h.rsi(), 1),
                indicators
        )).ifPresent(tradeId -> agentSession.attachTradeId(coin, tradeId));

        notificationService.notify(
                paperPrefix + coin + " " + signal.side().wireName().toUpperCase(Locale.ROOT) + " - " + signal.rule(),
                entryBody(signal, sizing, entryPrice, effectiveLeverage, candidate.mlScore(), mode),
                mode == ExecutionMode.PAPER
                        ? "test_tube,eyes"
                        : signal.side().isBuy() ? "chart_with_upwards_trend,loudspeaker" : "chart_with_downwards_trend,loudspeaker"
        );
        return true;
    }

    private String entryBody(
            Signal signal,
            PositionSizing sizing,
            double entryPrice,
            int leverage,
            MlScore mlScore,
            ExecutionMode mode
    ) {
        StringBuilder body = new StringBuilder(mode == ExecutionMode.PAPER ? "**Simulated position opened**" : "**New position!**")
                .append("\n\n- **Coin:** ").append(signal.coin()).append(' ')
                .append(signal.side().wireName().toUpperCase(Locale.ROOT))
                .append("\n- **Size:** ").append(sizing.size()).append(" @ $").append(fixed(entryPrice, 4))
                .append("\n- **Notional:** $").append(fixed(sizing.notional(), 0)).append(" (").append(leverage).append("x)")
                .append("\n- **Rule:** ").append(signal.rule()).append(" (confidence ").append(fixed(signal.confidence(), 2)).append(')');
        if (mlScore != null && mlScore.isPresent()) {
            body.append("\n- **ML score:** ").append(fixed(mlScore.score(), 3))
                    .append(" -> blended conf ").append(fixed(signal.confidence(), 2));
        }
        body.append("\n- **Why:** ").append(signal.reason())
                .append("\n\n_Now at ").append(agentSession.heldCount()).append(" positions._");
        return body.toString();
    }
}
