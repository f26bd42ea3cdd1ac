package org.nowstart.perpbot.service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.perpbot.data.dto.NearMiss;
import org.nowstart.perpbot.data.dto.NearMissOutcome;
import org.nowstart.perpbot.data.dto.NearMissReport;
import org.nowstart.perpbot.data.type.TradeSide;
import org.nowstart.perpbot.strategy.core.DecisionText;
import org.springframework.stereotype.Service;

/**
 * Keeps the near-miss journal and grades entries once they are old enough to have a counterfactual outcome.
 */
@Slf4j
@Service
public class NearMissRecorder {

    static final Duration MIN_AGE = Duration.ofHours(1);
    static final int MAX_NEAR_MISSES = 100;
    static final int MAX_OUTCOMES = 200;
    static final int LESSON_MIN_SAMPLES = 3;
    static final int TOP_BLOCKERS = 3;

    private final List<NearMiss> nearMisses = new ArrayList<>();
    private final List<NearMissOutcome> outcomes = new ArrayList<>();

    public synchronized void record(NearMiss nearMiss) {
        nearMisses.add(nearMiss);
        log.info(
                "event=near_miss coin={} side={} rule={} price={} ml_score={} reason=\"{}\" blocked_by=\"{}\"",
                nearMiss.coin(),
                nearMiss.side().wireName(),
                nearMiss.rule(),
                nearMiss.price(),
                nearMiss.mlScore(),
                nearMiss.reason(),
                nearMiss.blockedBy()
        );
    }

    /**
     * Newest first.
     */
    public synchronized List<NearMiss> recent(int limit) {
        List<NearMiss> result = new ArrayList<>();
        for (int i = nearMisses.size() - 1; i >= 0 && result.size() < limit; i--) {
            result.add(nearMisses.get(i));
        }
        return result;
    }

    public synchronized List<NearMiss> since(Instant from) {
        return nearMisses.stream()
                .filter(nearMiss -> !nearMiss.timestamp().isBefore(from))
                .toList();
    }

    public synchronized int trackedCount() {
        return nearMisses.size();
    }

    public synchronized List<NearMissOutcome> outcomes() {
        return List.copyOf(outcomes);
    }

    /**
     * Grades every unchecked near-miss older than an hour against the current price, then prunes history.
     *
     * @param currentPrice mid price lookup; a failure skips that near-miss until the next run
     * @return {@code null} when nothing could be graded
     */
    public NearMissReport analyze(Instant now, ToDoubleFunction<String> currentPrice) {
        List<NearMiss> toCheck = dueForCheck(now);
        if (toCheck.isEmpty()) {
            return null;
        }
        log.info("event=near_miss_analysis due={}", toCheck.size());

        List<NearMissOutcome> graded = new ArrayList<>();
        for (NearMiss miss : toCheck) {
            try {
                double price = currentPrice.applyAsDouble(miss.coin());
                double pnlPct = miss.side() == TradeSide.LONG
                        ? (price - miss.price()) / miss.price() * 100
                        : (miss.price() - price) / miss.price() * 100;
                NearMissOutcome outcome = new NearMissOutcome(miss, price, pnlPct, pnlPct > 0, now);
                graded.add(outcome);
                log.info(
                        "event=near_miss_outcome coin={} rule={} side={} price={} price_later={} pnl_pct={} verdict={} blocked_by=\"{}\"",
                        miss.coin(),
                        miss.rule(),
                        miss.side().wireName(),
                        miss.price(),
                        price,
                        DecisionText.fixed(pnlPct, 2),
                        outcome.wouldHaveWon() ? "would_have_won" : "avoided_loss",
                        miss.blockedBy()
                );
            } catch (RuntimeException e) {
                log.warn("event=near_miss_price_failed coin={} reason={}", miss.coin(), e.getMessage());
            }
        }

        synchronized (this) {
            outcomes.addAll(graded);
            prune();
        }
        if (graded.isEmpty()) {
            return null;
        }

        NearMissReport report = summarize(toCheck, graded);
        logReport(report);
        return report;
    }

    private synchronized List<NearMiss> dueForCheck(Instant now) {
        Set<NearMiss> checked = new LinkedHashSet<>();
        outcomes.forEach(outcome -> checked.add(outcome.miss()));
        Instant cutoff = now.minus(MIN_AGE);
        return nearMisses.stream()
                .filter(nearMiss -> !nearMiss.timestamp().isAfter(cutoff))
                .filter(nearMiss -> !checked.contains(nearMiss))
                .toList();
    }

    private void prune() {
        if (nearMisses.size() > MAX_NEAR_MISSES) {
            nearMisses.subList(0, nearMisses.size() - MAX_NEAR_MISSES).clear();
        }
        if (outcomes.size() > MAX_OUTCOMES) {
            outcomes.subList(0, outcomes.size() - MAX_OUTCOMES).clear();
        }
    }

    private static NearMissReport summarize(List<NearMiss> toCheck, List<NearMissOutcome> graded) {
        int wins = 0;
        Map<String, int[]> counts = new LinkedHashMap<>();
        Map<String, Set<String>> blockers = new LinkedHashMap<>();
        for (NearMissOutcome outcome : graded) {
            String key = outcome.miss().lessonKey();
            int[] tally = counts.computeIfAbsent(key, ignored -> new int[2]);
            if (outcome.wouldHaveWon()) {
                wins++;
                tally[0]++;
            } else {
                tally[1]++;
            }
            blockers.computeIfAbsent(key, ignored -> new LinkedHashSet<>()).add(outcome.miss().blockedBy());
        }

        List<NearMissReport.RuleLesson> lessons = new ArrayList<>();
        counts.forEach((key, tally) -> lessons.add(new NearMissReport.RuleLesson(
                key,
                tally[0],
                tally[1],
                blockers.get(key).stream().limit(TOP_BLOCKERS).toList()
        )));

        int mlScored = 0;
        int mlWantedIn = 0;
        int mlWantedInWon = 0;
        for (NearMiss miss : toCheck) {
            if (miss.mlScore() == null) {
                continue;
            }
            mlScored++;
            if (miss.mlScore() > 0.5) {
                mlWantedIn++;
                boolean won = graded.stream().anyMatch(outcome -> outcome.miss().equals(miss) && outcome.wouldHaveWon());
                if (won) {
                    mlWantedInWon++;
                }
            }
        }

        return new NearMissReport(graded.size(), graded.size() - wins, wins, lessons, mlScored, mlWantedIn, mlWantedInWon);
    }

    private static void logReport(NearMissReport report) {
        log.info(
                "NEAR-MISS REPORT: {} checked - {} right to skip ({}%), {} wrong to skip",
                report.checked(),
                report.rightToSkip(),
                DecisionText.fixed(report.rightToSkipPct(), 0),
                report.wrongToSkip()
        );
        for (NearMissReport.RuleLesson lesson : report.lessons()) {
            String blockers = String.join(" | ", lesson.blockers());
            if (lesson.filtersTooStrict()) {
                log.info(
                        "event=near_miss_lesson key={} verdict=\"FILTERS TOO STRICT\" wrong_pct={} samples={} blockers=\"{}\"",
                        lesson.key(),
                        DecisionText.fixed(lesson.wins() * 100.0 / lesson.total(), 0),
                        lesson.total(),
                        blockers
                );
            } else if (lesson.filtersWorking()) {
                log.info(
                        "event=near_miss_lesson key={} verdict=\"FILTERS WORKING\" right_pct={} samples={}",
                        lesson.key(),
                        DecisionText.fixed(lesson.losses() * 100.0 / lesson.total(), 0),
                        lesson.total()
                );
            }
        }
    }
}
