package org.nowstart.perpbot.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.perpbot.data.type.ExecutionMode;
import org.nowstart.perpbot.data.type.RiskVerdict;
import org.nowstart.perpbot.fixture.PropertyFixtures;

class RiskGovernorTest {

    private final RiskGovernor riskGovernor = new RiskGovernor(
            PropertyFixtures.agent(ExecutionMode.PAPER, List.of("BTC"), 30, 24, 0)
    );

    @Test
    void evaluate_lossBeyondLimit_tripsCircuitBreaker() {
        assertThat(riskGovernor.evaluate(-30.01, 1)).isEqualTo(RiskVerdict.CIRCUIT_BREAKER);
    }

    @Test
    void evaluate_lossExactlyAtLimit_continues() {
        assertThat(riskGovernor.evaluate(-30.0, 1)).isEqualTo(RiskVerdict.CONTINUE);
    }

    @Test
    void evaluate_circuitBreakerIsAPureThreshold() {
        for (double pnl = -100; pnl <= 100; pnl += 0.5) {
            RiskVerdict verdict = riskGovernor.evaluate(pnl, 0);
            assertThat(verdict == RiskVerdict.CIRCUIT_BREAKER).isEqualTo(pnl < -30);
            assertThat(riskGovernor.evaluate(pnl, 0)).isEqualTo(verdict);
        }
    }

    @Test
    void evaluate_sessionElapsed_timesOut() {
        assertThat(riskGovernor.evaluate(5, 24)).isEqualTo(RiskVerdict.SESSION_TIMEOUT);
        assertThat(riskGovernor.evaluate(5, 23.99)).isEqualTo(RiskVerdict.CONTINUE);
    }

    @Test
    void evaluate_bothLimitsHit_prefersCircuitBreaker() {
        assertThat(riskGovernor.evaluate(-50, 30)).isEqualTo(RiskVerdict.CIRCUIT_BREAKER);
        assertThat(RiskVerdict.CIRCUIT_BREAKER.isTerminal()).isTrue();
        assertThat(RiskVerdict.CONTINUE.isTerminal()).isFalse();
    }
}
