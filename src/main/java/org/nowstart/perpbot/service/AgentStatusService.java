package org.nowstart.perpbot.service;

import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.perpbot.data.dto.AgentStatusDto;
import org.nowstart.perpbot.data.dto.NearMiss;
import org.nowstart.perpbot.data.dto.RuleStats;
import org.nowstart.perpbot.data.exception.AgentApiException;
import org.nowstart.perpbot.service.exchange.ExchangeGateway;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AgentStatusService {

    static final int MAX_NEAR_MISS_LIMIT = 100;

    private final AgentSession agentSession;
    private final ExchangeGateway exchangeGateway;
    private final VolatilityTracker volatilityTracker;
    private final NearMissRecorder nearMissRecorder;

    public AgentStatusDto status() {
        return new AgentStatusDto(
                agentSession.getSessionId(),
                exchangeGateway.mode(),
                agentSession.cycleCount(),
                agentSession.elapsedHours(),
                agentSession.heldCoins(),
                agentSession.realizedPnl(),
                agentSession.wins(),
                agentSession.losses(),
                agentSession.contrarianWins(),
                agentSession.contrarianLosses(),
                volatilityTracker.state(),
                volatilityTracker.sleepMultiplier(),
                agentSession.sentimentAvailable(),
                agentSession.isStopped()
        );
    }

    public List<NearMiss> recentNearMisses(int limit) {
        if (limit < 1 || limit > MAX_NEAR_MISS_LIMIT) {
            throw new AgentApiException(
                    HttpStatus.BAD_REQUEST,
                    "invalid_limit",
                    "limit must be between 1 and " + MAX_NEAR_MISS_LIMIT
            );
        }
        return nearMissRecorder.recent(limit);
    }

    /**
     * Rules with the most closed trades first.
     */
    public List<RuleStats> ruleStats() {
        return agentSession.ruleStats()
                .stream()
                .sorted(Comparator.comparingInt(RuleStats::totalTrades).reversed())
                .toList();
    }
}
