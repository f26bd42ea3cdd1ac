package org.nowstart.perpbot.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.perpbot.data.dto.SentimentSnapshot;
import org.nowstart.perpbot.data.property.AgentProperties;
import org.nowstart.perpbot.data.type.ExecutionMode;
import org.nowstart.perpbot.data.type.TradeSide;
import org.springframework.stereotype.Service;

/**
 * Appends one JSONL row per closed trade for offline model training.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingDataService {

    private final AgentProperties agentProperties;
    private final ObjectMapper objectMapper;

    public Map<String, Object> buildRow(
            String coin,
            TradeSide side,
            String rule,
            double pnl,
            ExecutionMode mode,
            Map<String, Object> entryIndicators,
            SentimentSnapshot sentiment
    ) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("coin", coin);
        row.put("side", side.wireName());
        row.put("rule", rule);
        row.put("won", pnl >= 0 ? 1 : 0);
        row.put("pnl", pnl);
        row.put("source", mode == ExecutionMode.LIVE ? "live" : "paper");
        row.putAll(entryIndicators);
        row.put("galaxy_score", sentiment == null ? ConfidenceScoringService.DEFAULT_GALAXY_SCORE : sentiment.galaxyScore());
        row.put("sentiment_pct", sentiment == null ? ConfidenceScoringService.DEFAULT_SENTIMENT_PCT : sentiment.sentiment());
        row.put("alt_rank", sentiment == null ? ConfidenceScoringService.DEFAULT_ALT_RANK : sentiment.altRank());
        return row;
    }

    public void append(Map<String, Object> row) {
        Path target = Path.of(agentProperties.trainingDataFile());
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(
                    target,
                    objectMapper.writeValueAsString(row) + "\n",
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            );
            log.debug("event=training_row_appended path={} coin={}", target, row.get("coin"));
        } catch (JsonProcessingException e) {
            log.warn("event=training_row_failed coin={} reason={}", row.get("coin"), e.getMessage());
        } catch (IOException e) {
            log.warn("event=training_row_failed path={} reason={}", target, e.getMessage());
        }
    }
}
