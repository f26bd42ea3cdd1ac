package org.nowstart.perpbot.data.dto;

import java.util.List;
import org.nowstart.perpbot.data.type.ExecutionMode;
import org.nowstart.perpbot.data.type.MarketVolatilityState;

public record AgentStatusDto(
        String sessionId,
        ExecutionMode mode,
        long cycleCount,
        double elapsedHours,
        List<String> heldCoins,
        double realizedPnl,
        int wins,
        int losses,
        int contrarianWins,
        int contrarianLosses,
        MarketVolatilityState volatilityState,
        double sleepMultiplier,
        boolean sentimentAvailable,
        boolean stopped
) {
}
