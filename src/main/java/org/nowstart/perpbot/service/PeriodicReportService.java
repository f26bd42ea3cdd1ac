package org.nowstart.perpbot.service;

import static org.nowstart.perpbot.strategy.core.DecisionText.fixed;
import static org.nowstart.perpbot.strategy.core.DecisionText.plain;
import static org.nowstart.perpbot.strategy.core.DecisionText.usd;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.perpbot.data.dto.AccountBalance;
import org.nowstart.perpbot.data.dto.NearMiss;
import org.nowstart.perpbot.data.dto.NearMissReport;
import org.nowstart.perpbot.data.dto.OpenPosition;
import org.nowstart.perpbot.data.dto.RuleStats;
import org.nowstart.perpbot.data.dto.SentimentSnapshot;
import org.nowstart.perpbot.data.property.AgentProperties;
import org.nowstart.perpbot.service.exchange.ExchangeGateway;
import org.springframework.stereotype.Service;

/**
 * Wall-clock bookkeeping that runs inside the loop thread: hourly reports, near-miss grading,
 * lessons persistence and the style check-in.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PeriodicReportService {

    static final Duration HOURLY = Duration.ofHours(1);
    static final Duration LESSONS_PERIOD = Duration.ofHours(2);
    static final Duration STYLE_CHECKIN_PERIOD = Duration.ofHours(6);
    static final int STYLE_MIN_TRADES = 3;
    static final double CONTRARIAN_MIN_WIN_RATE = 0.4;
    static final double R3_MIN_WIN_RATE = 0.35;
    static final double ML_WANTS_IN = 0.5;

    private final AgentProperties agentProperties;
    private final AgentSession agentSession;
    private final ExchangeGateway exchangeGateway;
    private final RetryExecutor retryExecutor;
    private final NearMissRecorder nearMissRecorder;
    private final LessonsWriter lessonsWriter;
    private final VolatilityTracker volatilityTracker;
    private final NotificationService notificationService;
    private final AgentLogService agentLogService;
    private final Clock clock;

    /**
     * True when the period boundary fell inside the last effective interval.
     */
    public static boolean isDue(Duration elapsed, Duration effectiveInterval, Duration period) {
        long elapsedMs = elapsed.toMillis();
        if (elapsedMs <= 0) {
            return false;
        }
        long periodMs = period.toMillis();
        return Math.floorDiv(elapsedMs, periodMs) > Math.floorDiv(elapsedMs - effectiveInterval.toMillis(), periodMs);
    }

    public Duration effectiveInterval() {
        return Duration.ofMillis(Math.round(agentProperties.interval().toMillis() * volatilityTracker.sleepMultiplier()));
    }

    public long styleCheckinCycles() {
        return Math.max(1, STYLE_CHECKIN_PERIOD.toMillis() / agentProperties.interval().toMillis());
    }

    public void runPeriodicTasks(long cycle) {
        Duration elapsed = agentSession.elapsed();
        Duration effective = effectiveInterval();
        boolean hourlyDue = isDue(elapsed, effective, HOURLY);
        boolean lessonsDue = isDue(elapsed, effective, LESSONS_PERIOD);

        if (hourlyDue) {
            try {
                analyzeNearMisses();
            } catch (RuntimeException e) {
                log.error("event=near_miss_analysis_failed reason={}", e.getMessage(), e);
            }
        }
        if (lessonsDue) {
            persistLessons();
        }
        if (hourlyDue) {
            try {
                hourlyReport(cycle);
            } catch (RuntimeException e) {
                log.error("event=hourly_report_failed reason={}", e.getMessage(), e);
            }
        }
        if (cycle > 0 && cycle % styleCheckinCycles() == 0) {
            styleCheckIn(cycle);
        }
    }

    public void analyzeNearMisses() {
        NearMissReport report = nearMissRecorder.analyze(
                clock.instant(),
                coin -> retryExecutor.call("midPrice " + coin, () -> exchangeGateway.midPrice(coin))
        );
        if (report == null) {
            return;
        }
        String rightPct = fixed(report.rightToSkipPct(), 0);
        String ruleLines = report.lessons().stream()
                .map(lesson -> "- **" + lesson.key() + ":** "
                        + fixed(lesson.losses() * 100.0 / lesson.total(), 0) + "% right to skip (dodged "
                        + lesson.losses() + ", missed " + lesson.wins() + ") - "
                        + (lesson.losses() >= lesson.wins() ? "filters working" : "filters too strict"))
                .collect(Collectors.joining("\n"));
        StringBuilder body = new StringBuilder("**Filter accuracy on ").append(report.checked()).append(" near-misses:**\n")
                .append("Right to skip: **").append(report.rightToSkip()).append("** (dodged losses)\n")
                .append("Wrong to skip: **").append(report.wrongToSkip()).append("** (missed winners)\n\n")
                .append(ruleLines);
        if (report.mlScored() > 0) {
            body.append("\n\n**ML disagreements** (model wanted in, rule said no): **").append(report.mlWantedIn())
                    .append("** of ").append(report.mlScored()).append(" scored\n- Of those, **")
                    .append(report.mlWantedInWon()).append("** would have been winners (")
                    .append(report.mlWantedIn() > 0 ? fixed(report.mlWantedInWon() * 100.0 / report.mlWantedIn(), 0) : "0")
                    .append("% ML accuracy on misses)");
        }
        body.append("\n\n_").append(report.rightToSkipPct() >= 60
                ? "Filters are earning their keep."
                : "Might be leaving money on the table...").append('_');
        notificationService.notify("Near-Miss Report - " + rightPct + "% right to skip", body.toString(), "mag,brain");
    }

    /**
     * @return whether the lessons file was written
     */
    public boolean persistLessons() {
        LessonsWriter.LessonsContext context = new LessonsWriter.LessonsContext(
                nearMissRecorder.outcomes(),
                nearMissRecorder.trackedCount(),
                agentSession.getStartedAt(),
                agentSession.realizedPnl(),
                clock.instant()
        );
        return lessonsWriter.persist(Path.of(agentProperties.lessonsFile()), context);
    }

    public void hourlyReport(long cycle) {
        List<OpenPosition> positions = retryExecutor.call("fetchPositions", exchangeGateway::fetchPositions);
        PositionBook book = positionBook(positions, false);
        Optional<AccountBalance> balance = balance();

        int wins = agentSession.wins();
        int losses = agentSession.losses();
        double realized = agentSession.realizedPnl();
        String winRate = wins + losses > 0 ? " (" + fixed(wins * 100.0 / (wins + losses), 0) + "% win rate)" : "";

        StringBuilder body = new StringBuilder("**Hour check-in. Here's the book:**\n\n")
                .append(book.lines().isEmpty() ? "_No positions._" : String.join("\n", book.lines()))
                .append("\n\n**Stats:**")
                .append("\n- **Total value:** $").append(fixed(book.totalNotional(), 0))
                .append("\n- **Unrealized:** ").append(usd(book.unrealized()))
                .append("\n- **Realized:** ").append(usd(realized))
                .append("\n- **Record:** ").append(wins).append("W-").append(losses).append('L').append(winRate)
                .append("\n- **Net:** ").append(usd(book.unrealized() + realized))
                .append("\n- **Balance:** ").append(balance.map(this::balanceLine).orElse("unavailable"))
                .append("\n- **Elapsed:** ").append(fixed(agentSession.elapsedHours(), 1)).append('h');

        List<SentimentSnapshot> sentiment = agentSession.currentSentiment();
        if (agentSession.sentimentAvailable() && !sentiment.isEmpty()) {
            body.append("\n\n**Sentiment leaders:**\n").append(sentiment.stream()
                    .sorted(Comparator.comparingDouble(SentimentSnapshot::galaxyScore).reversed())
                    .limit(3)
                    .map(snapshot -> "- **" + snapshot.coin() + "** galaxy=" + plain(snapshot.galaxyScore())
                            + " sentiment=" + plain(snapshot.sentiment()) + "% rank=#" + plain(snapshot.altRank()))
                    .collect(Collectors.joining("\n")));
        }
        String backtrade = ruleBacktrade(agentSession.ruleStats());
        if (!backtrade.isEmpty()) {
            body.append("\n\n").append(backtrade);
        }

        log.info(
                "event=hourly_report cycle={} open={} unrealized_pnl={} realized_pnl={}",
                cycle,
                positions.size(),
                agentLogService.sanitizeMetricForLog(book.unrealized()),
                agentLogService.sanitizeMetricForLog(realized)
        );
        notificationService.notify("Hourly Report - Cycle " + cycle, body.toString(), "bar_chart,clock3");
    }

    /**
     * Status push for cycles in which a position was opened or closed.
     */
    public void cycleSummary(long cycle) {
        List<OpenPosition> positions = retryExecutor.call("fetchPositions", exchangeGateway::fetchPositions);
        PositionBook book = positionBook(positions, true);
        Optional<AccountBalance> balance = balance();
        Instant recentFrom = clock.instant().minus(agentProperties.interval().multipliedBy(2));
        List<NearMiss> recentMisses = nearMissRecorder.since(recentFrom);

        StringBuilder body = new StringBuilder(book.lines().isEmpty() ? "_No open positions._" : String.join("\n", book.lines()))
                .append("\n\n**Total value:** $").append(fixed(book.totalNotional(), 0))
                .append(" | **Unrealized:** ").append(usd(book.unrealized()))
                .append(" | **Realized:** ").append(usd(agentSession.realizedPnl()))
                .append("\n**Record:** ").append(record())
                .append("\n**Balance:** ").append(balance.map(this::balanceLine).orElse("unavailable"));
        String volatility = volatilityTracker.summary();
        if (volatility != null && !volatility.isEmpty()) {
            body.append("\n\n**").append(volatility).append("** | interval ")
                    .append(effectiveInterval().toSeconds()).append('s');
        }
        if (!recentMisses.isEmpty()) {
            body.append("\n\n**Near-misses this cycle:**\n").append(recentMisses.stream()
                    .map(miss -> "- **" + miss.coin() + "** " + miss.rule() + " " + miss.side().wireName()
                            + " - _" + miss.blockedBy() + "_")
                    .collect(Collectors.joining("\n")));
        }

        agentLogService.logCycleSummary(cycle, positions.size(), book.unrealized(), agentSession.realizedPnl(), recentMisses.size());
        notificationService.notify(
                "C" + cycle + " " + positions.size() + " positions | " + usd(book.unrealized()) + " unrealized",
                body.toString(),
                "eyes"
        );
    }

    public void styleCheckIn(long cycle) {
        List<String> suggestions = styleSuggestions(cycle);
        if (suggestions.isEmpty()) {
            return;
        }
        log.info("event=style_checkin cycle={} suggestions={}", cycle, suggestions.size());
        notificationService.notify(
                "Style check-in: trading suggestions",
                "**Advisory, no auto-changes made.**\n\n" + suggestions.stream()
                        .map(suggestion -> "- " + suggestion)
                        .collect(Collectors.joining("\n")),
                "bulb"
        );
    }

    public List<String> styleSuggestions(long cycle) {
        List<String> suggestions = new ArrayList<>();

        int contrarianTotal = agentSession.contrarianWins() + agentSession.contrarianLosses();
        if (agentProperties.contrarianPct() > 0 && contrarianTotal >= STYLE_MIN_TRADES
                && (double) agentSession.contrarianWins() / contrarianTotal < CONTRARIAN_MIN_WIN_RATE) {
            suggestions.add("Contrarian win rate " + fixed(agentSession.contrarianWins() * 100.0 / contrarianTotal, 0)
                    + "% (" + contrarianTotal + " trades), consider reducing perpbot.agent.contrarian-pct");
        }

        agentSession.ruleStats("R3-trend")
                .filter(stats -> stats.totalTrades() >= STYLE_MIN_TRADES
                        && (double) stats.wins() / stats.totalTrades() < R3_MIN_WIN_RATE)
                .ifPresent(stats -> suggestions.add("R3 (trend long) win rate " + fixed(stats.winRatePct(), 0)
                        + "% over " + stats.totalTrades() + " trades, market may be bearish/ranging"));

        if (agentSession.closedTrades() == 0 && cycle >= styleCheckinCycles()) {
            suggestions.add("No closed trades after " + cycle
                    + " cycles, consider expanding the coin list or checking the market regime");
        }
        return suggestions;
    }

    public static String ruleBacktrade(List<RuleStats> stats) {
        if (stats.isEmpty()) {
            return "";
        }
        List<RuleStats> sorted = new ArrayList<>(stats);
        sorted.sort(Comparator.comparingInt(RuleStats::totalTrades).reversed());

        StringBuilder builder = new StringBuilder("**Rule backtrade analysis:**\n").append(sorted.stream()
                .map(rule -> "- **" + rule.rule() + ":** " + fixed(rule.winRatePct(), 0) + "% W/R | avg "
                        + (rule.averagePnl() >= 0 ? "+" : "-") + "$" + fixed(Math.abs(rule.averagePnl()), 2)
                        + " | net " + usd(rule.totalPnl()) + " (" + rule.totalTrades() + " trades)")
                .collect(Collectors.joining("\n")));
        if (sorted.size() > 1) {
            RuleStats best = sorted.get(0);
            RuleStats worst = sorted.get(0);
            for (RuleStats rule : sorted) {
                if (rule.totalPnl() > best.totalPnl()) {
                    best = rule;
                }
                if (rule.totalPnl() < worst.totalPnl()) {
                    worst = rule;
                }
            }
            builder.append("\n_Best: **").append(best.rule()).append("** (").append(usd(best.totalPnl()))
                    .append(") | Worst: **").append(worst.rule()).append("** (").append(usd(worst.totalPnl())).append(")_");
        }
        return builder.toString();
    }

    private String record() {
        int wins = agentSession.wins();
        int losses = agentSession.losses();
        String record = wins + "W-" + losses + "L";
        int contrarianTotal = agentSession.contrarianWins() + agentSession.contrarianLosses();
        if (contrarianTotal > 0) {
            record += " (contrarian " + agentSession.contrarianWins() + "W-" + agentSession.contrarianLosses() + "L)";
        }
        return record;
    }

    private String balanceLine(AccountBalance balance) {
        return "$" + fixed(balance.accountValue(), 2) + " | avail $" + fixed(balance.available(), 2);
    }

    private Optional<AccountBalance> balance() {
        try {
            return Optional.of(retryExecutor.call("fetchBalance", exchangeGateway::fetchBalance));
        } catch (RuntimeException e) {
            log.warn("event=report_balance_unavailable reason={}", e.getMessage());
            return Optional.empty();
        }
    }

    private PositionBook positionBook(List<OpenPosition> positions, boolean withPrice) {
        List<String> lines = new ArrayList<>();
        double unrealized = 0;
        double totalNotional = 0;
        for (OpenPosition position : positions) {
            double mid;
            try {
                mid = exchangeGateway.midPrice(position.coin());
            } catch (RuntimeException e) {
                log.debug("event=report_price_unavailable coin={} reason={}", position.coin(), e.getMessage());
                continue;
            }
            double pnl = position.unrealizedPnl(mid);
            double pnlPct = position.unrealizedPnlPct(mid) * 100;
            double notional = position.size() * mid;
            unrealized += pnl;
            totalNotional += notional;
            String line = "- **" + position.coin() + "** " + position.side().wireName() + " $" + fixed(notional, 0)
                    + " -> " + (pnlPct >= 0 ? "+" : "") + fixed(pnlPct, 2) + "% (" + usd(pnl) + ")";
            if (withPrice) {
                line += " @ $" + fixed(mid, mid >= 100 ? 0 : mid >= 1 ? 2 : 4);
            }
            lines.add(line);
        }
        return new PositionBook(lines, unrealized, totalNotional);
    }

    private record PositionBook(List<String> lines, double unrealized, double totalNotional) {
    }
}
