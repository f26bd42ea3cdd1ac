package org.nowstart.perpbot.data.dto;

import java.util.List;

public record NearMissReport(
        int checked,
        int rightToSkip,
        int wrongToSkip,
        List<RuleLesson> lessons,
        int mlScored,
        int mlWantedIn,
        int mlWantedInWon
) {

    public record RuleLesson(
            String key,
            int wins,
            int losses,
            List<String> blockers
    ) {
        public int total() {
            return wins + losses;
        }

        public boolean filtersTooStrict() {
            return wins > losses && total() >= 3;
        }

        public boolean filtersWorking() {
            return losses > wins && total() >= 3;
        }
    }

    public double rightToSkipPct() {
        return checked == 0 ? 0.0 : rightToSkip * 100.0 / checked;
    }
}
