package org.nowstart.perpbot.service;

import lombok.RequiredArgsConstructor;
import org.nowstart.perpbot.data.property.AgentProperties;
import org.nowstart.perpbot.data.type.RiskVerdict;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RiskGovernor {

    private final AgentProperties agentProperties;

    /**
     * Circuit breaker wins over the session timeout when both trip in the same cycle.
     */
    public RiskVerdict evaluate(double realizedPnl, double elapsedHours) {
        if (realizedPnl < -agentProperties.circuitBreakerUsd()) {
            return RiskVerdict.CIRCUIT_BREAKER;
        }
        if (elapsedHours >= agentProperties.sessionHours()) {
            return RiskVerdict.SESSION_TIMEOUT;
        }
        return RiskVerdict.CONTINUE;
    }
}
