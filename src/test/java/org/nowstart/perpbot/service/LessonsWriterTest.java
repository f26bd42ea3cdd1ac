package org.nowstart.perpbot.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.nowstart.perpbot.data.dto.NearMiss;
import org.nowstart.perpbot.data.dto.NearMissOutcome;
import org.nowstart.perpbot.data.type.TradeSide;
import org.nowstart.perpbot.fixture.IndicatorFixtures;

class LessonsWriterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Instant STARTED = Instant.parse("2026-03-01T08:00:00Z");

    private final LessonsWriter writer = new LessonsWriter();

    @Test
    void render_fewerThanFiveOutcomes_returnsEmpty() {
        assertThat(writer.render(context(outcomes("R3-trend", TradeSide.LONG, 2, 2)))).isEmpty();
    }

    @Test
    void render_mostlyMissedWinners_recommendsRelaxing() {
        Optional<String> content = writer.render(context(outcomes("R4-trend", TradeSide.SHORT, 4, 1)));

        assertThat(content).isPresent();
        assertThat(content.get())
                .startsWith("# Live Trading Lessons (auto-updated)")
                .contains("_Updated by agent at 2026-03-01T12:00. 5 near-miss outcomes analyzed._")
                .contains("- **Right to skip:** 1/5 (20%)")
                .contains("### R4-trend-short - filters too strict")
                .contains("**RELAX R4-trend-short:** Wrong to skip 80% of the time (5 samples)")
                .contains("- Session started: 2026-03-01T08:00")
                .contains("- Realized PnL this session: -$4.50");
    }

    @Test
    void render_mostlyDodgedLosses_recommendsKeepingStrict() {
        List<NearMissOutcome> outcomes = new ArrayList<>(outcomes("R1-mean-reversion", TradeSide.LONG, 1, 5));
        outcomes.addAll(outcomes("R3-trend", TradeSide.LONG, 1, 1));

        String content = writer.render(context(outcomes)).orElseThrow();

        assertThat(content).contains("**KEEP R1-mean-reversion-long STRICT:** Right to skip 83%");
        assertThat(content).doesNotContain("RELAX R3-trend-long");
        assertThat(content.indexOf("### R1-mean-reversion-long")).isLessThan(content.indexOf("### R3-trend-long"));
    }

    @Test
    void persist_writesFileAndCreatesParentDirectories(@TempDir Path tempDir) throws IOException {
        Path target = tempDir.resolve("knowledge").resolve("lessons.md");

        boolean written = writer.persist(target, context(outcomes("R3-trend", TradeSide.LONG, 3, 3)));

        assertThat(written).isTrue();
        assertThat(Files.readString(target, StandardCharsets.UTF_8)).contains("## Per-Rule Analysis");
    }

    @Test
    void persist_notEnoughData_skipsWrite(@TempDir Path tempDir) {
        Path target = tempDir.resolve("lessons.md");

        assertThat(writer.persist(target, context(List.of()))).isFalse();
        assertThat(target).doesNotExist();
    }

    private static LessonsWriter.LessonsContext context(List<NearMissOutcome> outcomes) {
        return new LessonsWriter.LessonsContext(outcomes, 12, STARTED, -4.5, NOW);
    }

    private static List<NearMissOutcome> outcomes(String rule, TradeSide side, int won, int lost) {
        List<NearMissOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < won + lost; i++) {
            boolean win = i < won;
            NearMiss miss = NearMiss.of(
                    IndicatorFixtures.quiet("BTC", 100 + i, 50),
                    side,
                    rule,
                    NOW.minusSeconds(7200 + i),
                    "almost",
                    "RSI gate"
            );
            outcomes.add(new NearMissOutcome(miss, win ? 102 : 98, win ? 2.0 : -2.0, win, NOW));
        }
        return outcomes;
    }
}
