package org.nowstart.perpbot.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Getter;
import org.nowstart.perpbot.data.dto.EntryProvenance;
import org.nowstart.perpbot.data.dto.RuleStats;
import org.nowstart.perpbot.data.dto.SentimentSignal;
import org.nowstart.perpbot.data.dto.SentimentSnapshot;
import org.nowstart.perpbot.data.property.AgentProperties;
import org.nowstart.perpbot.strategy.core.AgentState;
import org.springframework.stereotype.Component;

/**
 * Session-scoped bookkeeping of the control loop. The loop thread is the only writer; readers
 * (status API, shutdown hook) go through the synchronized accessors.
 */
@Component
public class AgentSession {

    private static final DateTimeFormatter SESSION_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmm").withZone(ZoneOffset.UTC);

    private final Clock clock;

    @Getter
    private final String sessionId;
    @Getter
    private final Instant startedAt;
    @Getter
    private final AgentState agentState = new AgentState();

    private final Set<String> heldCoins = new LinkedHashSet<>();
    private final Map<String, EntryProvenance> provenanceByCoin = new HashMap<>();
    private final Set<String> contrarianCoins = new LinkedHashSet<>();
    private final Map<String, RuleStats> ruleStats = new LinkedHashMap<>();

    private long cycleCount;
    private double realizedPnl;
    private int wins;
    private int losses;
    private int contrarianWins;
    private int contrarianLosses;
    private int consecutiveErrors;

    private List<SentimentSnapshot> currentSentiment = List.of();
    private List<SentimentSnapshot> previousSentiment = List.of();
    private List<SentimentSignal> sentimentSignals = List.of();
    private boolean sentimentAvailable;

    private volatile boolean stopped;
    private volatile String stopReason;

    public AgentSession(AgentProperties agentProperties, Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
        this.sessionId = agentProperties.sessionPrefix() + "-" + SESSION_ID_FORMAT.format(startedAt);
    }

    public synchronized long nextCycle() {
        return ++cycleCount;
    }

    public synchronized long cycleCount() {
        return cycleCount;
    }

    public Duration elapsed() {
        return Duration.between(startedAt, clock.instant());
    }

    public double elapsedHours() {
        return elapsed().toMillis() / 3_600_000.0;
    }

    public synchronized List<String> heldCoins() {
        return new ArrayList<>(heldCoins);
    }

    public synchronized boolean isHeld(String coin) {
        return heldCoins.contains(coin);
    }

    public synchronized int heldCount() {
        return heldCoins.size();
    }

    public synchronized void resyncHeldCoins(List<String> coins) {
        heldCoins.clear();
        heldCoins.addAll(coins);
    }

    public synchronized void adopt(String coin, Instant at) {
        heldCoins.add(coin);
        agentState.openPosition(coin, at);
    }

    public synchronized void recordEntry(EntryProvenance provenance, String coin, boolean contrarian) {
        heldCoins.add(coin);
        agentState.openPosition(coin, provenance.openedAt());
        provenanceByCoin.put(coin, provenance);
        if (contrarian) {
            contrarianCoins.add(coin);
        }
    }

    public synchronized void attachTradeId(String coin, String tradeId) {
        EntryProvenance provenance = provenanceByCoin.get(coin);
        if (provenance == null) {
            return;
        }
        provenanceByCoin.put(coin, new EntryProvenance(
                provenance.rule(),
                provenance.category(),
                provenance.reason(),
                provenance.confidence(),
                provenance.entryPrice(),
                provenance.size(),
                provenance.leverage(),
                provenance.openedAt(),
                provenance.indicators(),
                tradeId
        ));
    }

    public synchronized Optional<EntryProvenance> provenance(String coin) {
        return Optional.ofNullable(provenanceByCoin.get(coin));
    }

    public synchronized boolean isContrarian(String coin) {
        return contrarianCoins.contains(coin);
    }

    public synchronized int openContrarianCount() {
        return contrarianCoins.size();
    }

    /**
     * Books a closed trade and drops every per-coin trace of it.
     */
    public synchronized void recordExit(String coin, String rule, double pnl) {
        boolean win = pnl >= 0;
        realizedPnl += pnl;
        if (win) {
            wins++;
        } else {
            losses++;
        }
        if (contrarianCoins.remove(coin)) {
            if (win) {
                contrarianWins++;
            } else {
                contrarianLosses++;
            }
        }
        ruleStats.merge(rule, RuleStats.empty(rule).record(pnl), (current, ignored) -> current.record(pnl));
        heldCoins.remove(coin);
        agentState.closePosition(coin);
        provenanceByCoin.remove(coin);
    }

    public synchronized void clearPositions() {
        heldCoins.clear();
        provenanceByCoin.clear();
        contrarianCoins.clear();
        agentState.clear();
    }

    public synchronized double realizedPnl() {
        return realizedPnl;
    }

    public synchronized int wins() {
        return wins;
    }

    public synchronized int losses() {
        return losses;
    }

    public synchronized int contrarianWins() {
        return contrarianWins;
    }

    public synchronized int contrarianLosses() {
        return contrarianLosses;
    }

    public synchronized int closedTrades() {
        return wins + losses;
    }

    public synchronized List<RuleStats> ruleStats() {
        return new ArrayList<>(ruleStats.values());
    }

    public synchronized Optional<RuleStats> ruleStats(String rule) {
        return Optional.ofNullable(ruleStats.get(rule));
    }

    public synchronized int recordCycleFailure() {
        return ++consecutiveErrors;
    }

    public synchronized void resetCycleFailures() {
        consecutiveErrors = 0;
    }

    public synchronized int consecutiveErrors() {
        return consecutiveErrors;
    }

    public synchronized void updateSentiment(List<SentimentSnapshot> snapshots, List<SentimentSignal> signals) {
        previousSentiment = currentSentiment;
        currentSentiment = List.copyOf(snapshots);
        sentimentSignals = List.copyOf(signals);
        sentimentAvailable = true;
    }

    public synchronized List<SentimentSnapshot> currentSentiment() {
        return currentSentiment;
    }

    public synchronized List<SentimentSnapshot> previousSentiment() {
        return previousSentiment;
    }

    public synchronized boolean sentimentAvailable() {
        return sentimentAvailable;
    }

    public synchronized SentimentSnapshot sentimentFor(String coin) {
        return currentSentiment.stream()
                .filter(snapshot -> snapshot.coin().equals(coin))
                .findFirst()
                .orElse(null);
    }

    public synchronized List<SentimentSignal> sentimentSignalsFor(String coin) {
        return sentimentSignals.stream()
                .filter(signal -> signal.coin().equals(coin))
                .toList();
    }

    public void stop(String reason) {
        stopReason = reason;
        stopped = true;
    }

    public boolean isStopped() {
        return stopped;
    }

    public String stopReason() {
        return stopReason;
    }
}
