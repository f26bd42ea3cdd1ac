package org.nowstart.perpbot.strategy;

import static org.nowstart.perpbot.strategy.core.DecisionText.fixed;
import static org.nowstart.perpbot.strategy.core.DecisionText.plain;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.nowstart.perpbot.data.dto.SentimentSignal;
import org.nowstart.perpbot.data.dto.SentimentSnapshot;
import org.nowstart.perpbot.data.type.SentimentSignalType;
import org.nowstart.perpbot.data.type.SignalStrength;
import org.springframework.stereotype.Component;

/**
 * Compares consecutive sentiment snapshots and reports large shifts. Without a baseline nothing is reported.
 */
@Component
public class SentimentSignalDetector {

    public List<SentimentSignal> detect(List<SentimentSnapshot> current, List<SentimentSnapshot> previous) {
        if (previous == null || previous.isEmpty()) {
            return List.of();
        }
        Map<String, SentimentSnapshot> previousByCoin = previous.stream()
                .collect(Collectors.toMap(SentimentSnapshot::coin, Function.identity(), (first, second) -> second));

        List<SentimentSignal> signals = new ArrayList<>();
        for (SentimentSnapshot cur : current) {
            SentimentSnapshot prev = previousByCoin.get(cur.coin());

            if (prev != null) {
                double galaxyDelta = cur.galaxyScore() - prev.galaxyScore();
                if (galaxyDelta >= 20) {
                    signals.add(signal(cur, SentimentSignalType.BULLISH, galaxyDelta >= 30,
                            "Galaxy score spiked to " + plain(cur.galaxyScore()) + " (was " + plain(prev.galaxyScore())
                                    + ", +" + plain(galaxyDelta) + ")"));
                }
                if (-galaxyDelta >= 20) {
                    signals.add(signal(cur, SentimentSignalType.BEARISH, -galaxyDelta >= 30,
                            "Galaxy score crashed to " + plain(cur.galaxyScore()) + " (was " + plain(prev.galaxyScore())
                                    + ", " + plain(galaxyDelta) + ")"));
                }
                if (cur.sentiment() > 80 && prev.socialVolume() > 0 && cur.socialVolume() > prev.socialVolume() * 2) {
                    signals.add(signal(cur, SentimentSignalType.BULLISH, cur.sentiment() > 90,
                            "Extreme bullish sentiment " + plain(cur.sentiment()) + "% with "
                                    + plain(cur.socialVolume()) + " social volume ("
                                    + fixed(cur.socialVolume() / prev.socialVolume(), 1) + "x previous)"));
                }
            }

            // socially oversold reads as a contrarian bullish cue
            if (cur.sentiment() > 0 && cur.sentiment() < 30) {
                signals.add(signal(cur, SentimentSignalType.BULLISH, cur.sentiment() < 20,
                        "Contrarian: sentiment only " + plain(cur.sentiment()) + "% positive (socially oversold)"));
            }

            if (prev != null && prev.socialVolume() > 0 && cur.socialVolume() > prev.socialVolume() * 3) {
                signals.add(signal(cur, SentimentSignalType.ALERT, cur.socialVolume() > prev.socialVolume() * 5,
                        "Social volume surge: " + plain(cur.socialVolume()) + " ("
                                + fixed(cur.socialVolume() / prev.socialVolume(), 1) + "x previous)"));
            }

            if (prev != null && prev.altRank() - cur.altRank() >= 50) {
                double improvement = prev.altRank() - cur.altRank();
                signals.add(signal(cur, SentimentSignalType.BULLISH, improvement >= 100,
                        "Alt rank surged to #" + plain(cur.altRank()) + " (was #" + plain(prev.altRank())
                                + ", improved " + plain(improvement) + " positions)"));
            }
        }
        return signals;
    }

    private static SentimentSignal signal(SentimentSnapshot snapshot, SentimentSignalType type, boolean strong, String reason) {
        return new SentimentSignal(
                snapshot.coin(),
                type,
                strong ? SignalStrength.STRONG : SignalStrength.MODERATE,
                reason,
                snapshot
        );
    }
}
