package org.nowstart.perpbot.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.perpbot.data.dto.NearMissOutcome;
import org.nowstart.perpbot.strategy.core.DecisionText;
import org.springframework.stereotype.Service;

/**
 * Renders graded near-misses into the markdown lessons file read by later sessions.
 */
@Slf4j
@Service
public class LessonsWriter {

    static final int MIN_OUTCOMES = 5;
    static final int INSIGHT_MIN_SAMPLES = 5;
    private static final DateTimeFormatter MINUTE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm").withZone(ZoneOffset.UTC);

    public record LessonsContext(
            List<NearMissOutcome> outcomes,
            int nearMissesTracked,
            Instant sessionStartedAt,
            double realizedPnl,
            Instant now
    ) {
    }

    public Optional<String> render(LessonsContext context) {
        List<NearMissOutcome> outcomes = context.outcomes();
        if (outcomes.size() < MIN_OUTCOMES) {
            return Optional.empty();
        }

        int total = outcomes.size();
        int wrongToSkip = (int) outcomes.stream().filter(NearMissOutcome::wouldHaveWon).count();
        int rightToSkip = total - wrongToSkip;

        Map<String, RuleTally> tallies = new LinkedHashMap<>();
        for (NearMissOutcome outcome : outcomes) {
            tallies.computeIfAbsent(outcome.miss().lessonKey(), ignored -> new RuleTally()).add(outcome);
        }

        List<String> lines = new ArrayList<>(List.of(
                "# Live Trading Lessons (auto-updated)",
                "",
                "_Updated by agent at " + MINUTE_FORMAT.format(context.now()) + ". " + total + " near-miss outcomes analyzed._",
                "",
                "## Filter Accuracy Summary",
                "",
                "- **Right to skip:** " + rightToSkip + "/" + total + " (" + percent(rightToSkip, total) + "%) - correctly dodged losses",
                "- **Wrong to skip:** " + wrongToSkip + "/" + total + " - missed profitable trades",
                "",
                "## Per-Rule Analysis",
                ""
        ));

        List<String> insights = new ArrayList<>();
        List<Map.Entry<String, RuleTally>> ordered = new ArrayList<>(tallies.entrySet());
        ordered.sort(Comparator.comparingInt((Map.Entry<String, RuleTally> entry) -> entry.getValue().samples()).reversed());
        for (Map.Entry<String, RuleTally> entry : ordered) {
            String key = entry.getKey();
            RuleTally tally = entry.getValue();
            int samples = tally.samples();
            String rightPct = percent(tally.right, samples);

            lines.add("### " + key + " - " + (tally.right >= tally.wrong ? "filters working" : "filters too strict"));
            lines.add("- **Right to skip:** " + rightPct + "% (" + tally.right + " dodged, " + tally.wrong + " missed)");
            lines.add("- **Avg PnL if taken:** " + DecisionText.fixed(tally.pnlSum / samples, 2) + "%");
            lines.add("- **Common blockers:** " + tally.topBlockers().stream()
                    .map(blocker -> blocker.getKey() + " (" + blocker.getValue() + "x)")
                    .collect(Collectors.joining(", ")));
            lines.add("");

            if (samples < INSIGHT_MIN_SAMPLES) {
                continue;
            }
            if (tally.wrong > tally.right) {
                String topBlocker = tally.topBlockers().stream().findFirst().map(Map.Entry::getKey).orElse("unknown");
                insights.add("- **RELAX " + key + ":** Wrong to skip " + percent(tally.wrong, samples) + "% of the time ("
                        + samples + " samples). Top blocker: " + topBlocker + ". Consider lowering the threshold.");
            } else if (tally.right > tally.wrong) {
                insights.add("- **KEEP " + key + " STRICT:** Right to skip " + rightPct + "% of the time ("
                        + samples + " samples). Filters are protecting us.");
            } else {
                insights.add("- **" + key + " is borderline:** " + rightPct + "% right on " + samples + " samples. Need more data.");
            }
        }

        if (!insights.isEmpty()) {
            lines.add("## Actionable Insights");
            lines.add("");
            lines.addAll(insights);
            lines.add("");
        }

        lines.add("## Raw Stats");
        lines.add("");
        lines.add("- Session started: " + MINUTE_FORMAT.format(context.sessionStartedAt()));
        lines.add("- Total near-misses tracked: " + context.nearMissesTracked());
        lines.add("- Total outcomes checked: " + total);
        lines.add("- Realized PnL this session: " + DecisionText.usd(context.realizedPnl()));
        lines.add("");
        return Optional.of(String.join("\n", lines));
    }

    /**
     * @return whether the file was written
     */
    public boolean persist(Path target, LessonsContext context) {
        Optional<String> content = render(context);
        if (content.isEmpty()) {
            return false;
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, content.get(), StandardCharsets.UTF_8);
            log.info("event=lessons_persisted path={} outcomes={}", target, context.outcomes().size());
            return true;
        } catch (IOException e) {
            log.warn("event=lessons_persist_failed path={} reason={}", target, e.getMessage());
            return false;
        }
    }

    private static String percent(int part, int total) {
        return DecisionText.fixed(total == 0 ? 0.0 : part * 100.0 / total, 0);
    }

    private static final class RuleTally {
        private int right;
        private int wrong;
        private double pnlSum;
        private final Map<String, Integer> blockers = new LinkedHashMap<>();

        void add(NearMissOutcome outcome) {
            if (outcome.wouldHaveWon()) {
                wrong++;
            } else {
                right++;
            }
            pnlSum += outcome.pnlPct();
            blockers.merge(outcome.miss().blockedBy(), 1, Integer::sum);
        }

        int samples() {
            return right + wrong;
        }

        List<Map.Entry<String, Integer>> topBlockers() {
            return blockers.entrySet().stream()
                    .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                    .limit(3)
                    .toList();
        }
    }
}
