package org.nowstart.perpbot.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.perpbot.data.dto.TradeLogCloseRequest;
import org.nowstart.perpbot.data.dto.TradeLogOpenRequest;
import org.nowstart.perpbot.data.dto.TradeLogOpenResponse;
import org.nowstart.perpbot.data.dto.TradeLogSessionEndRequest;
import org.nowstart.perpbot.data.dto.TradeLogSessionRequest;
import org.nowstart.perpbot.data.property.IntegrationProperties;
import org.nowstart.perpbot.data.type.ExecutionMode;
import org.nowstart.perpbot.data.type.TradeSide;
import org.nowstart.perpbot.repository.TradeLogFeignClient;
import org.springframework.stereotype.Service;

/**
 * Session and trade persistence in the trade-log backend. Failures are logged and never block trading.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeLogService {

    static final String MARKETPLACE = "hyperliquid";

    private final TradeLogFeignClient tradeLogFeignClient;
    private final IntegrationProperties integrationProperties;
    private final ObjectMapper objectMapper;

    public record TradeOpen(
            String sessionId,
            ExecutionMode mode,
            String coin,
            TradeSide side,
            double entryPrice,
            double size,
            int leverage,
            String rule,
            String category,
            String orderId,
            String comment,
            Map<String, Object> indicators
    ) {
    }

    public void registerSession(String sessionId, ExecutionMode mode, Map<String, Object> profile) {
        if (!enabled()) {
            return;
        }
        try {
            tradeLogFeignClient.registerSession(new TradeLogSessionRequest(
                    sessionId,
                    MARKETPLACE,
                    mode.tradeLogMode(),
                    integrationProperties.tradeLog().env(),
                    toJson(profile)
            ));
            log.info("event=session_registered session_id={}", sessionId);
        } catch (RuntimeException e) {
            log.warn("event=session_register_failed session_id={} reason={}", sessionId, e.getMessage());
        }
    }

    public void closeSession(String sessionId, int wins, int losses, double realizedPnl) {
        if (!enabled()) {
            return;
        }
        try {
            tradeLogFeignClient.endSession(sessionId, new TradeLogSessionEndRequest(toJson(Map.of(
                    "wins", wins,
                    "losses", losses,
                    "pnl", realizedPnl
            ))));
            log.info("event=session_closed session_id={}", sessionId);
        } catch (RuntimeException e) {
            log.warn("event=session_close_failed session_id={} reason={}", sessionId, e.getMessage());
        }
    }

    public Optional<String> logTradeOpen(TradeOpen trade) {
        if (!enabled()) {
            return Optional.empty();
        }
        try {
            TradeLogOpenResponse response = tradeLogFeignClient.openTrade(new TradeLogOpenRequest(
                    trade.sessionId(),
                    MARKETPLACE,
                    trade.mode().tradeLogMode(),
                    trade.coin(),
                    trade.side().wireName(),
                    trade.entryPrice(),
                    trade.size(),
                    trade.leverage(),
                    trade.rule() + " [" + trade.category() + "]",
                    trade.orderId(),
                    trade.comment(),
                    toJson(trade.indicators())
            ));
            return Optional.ofNullable(response).map(TradeLogOpenResponse::id);
        } catch (RuntimeException e) {
            log.warn("event=trade_open_log_failed coin={} reason={}", trade.coin(), e.getMessage());
            return Optional.empty();
        }
    }

    public void logTradeClose(String tradeId, String coin, double exitPrice, double realizedPnl, String comment) {
        if (!enabled()) {
            return;
        }
        if (tradeId == null) {
            log.debug("event=trade_close_log_skipped coin={} reason=no_trade_id", coin);
            return;
        }
        try {
            tradeLogFeignClient.closeTrade(tradeId, new TradeLogCloseRequest(exitPrice, realizedPnl, comment));
        } catch (RuntimeException e) {
            log.warn("event=trade_close_log_failed coin={} trade_id={} reason={}", coin, tradeId, e.getMessage());
        }
    }

    private boolean enabled() {
        return integrationProperties.tradeLog().enabled();
    }

    private String toJson(Map<String, Object> value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize trade log payload", e);
        }
    }
}
