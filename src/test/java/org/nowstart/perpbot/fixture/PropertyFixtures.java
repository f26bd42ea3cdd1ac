package org.nowstart.perpbot.fixture;

import java.time.Duration;
import java.util.List;
import org.nowstart.perpbot.data.property.AgentProperties;
import org.nowstart.perpbot.data.property.ExchangeProperties;
import org.nowstart.perpbot.data.property.IntegrationProperties;
import org.nowstart.perpbot.data.type.ExecutionMode;

public final class PropertyFixtures {

    private PropertyFixtures() {
    }

    public static AgentProperties agent() {
        return agent(ExecutionMode.PAPER, List.of("BTC", "ETH", "SOL"), 30, 24, 0);
    }

    public static AgentProperties agent(
            ExecutionMode mode,
            List<String> coins,
            double circuitBreakerUsd,
            double sessionHours,
            double contrarianPct
    ) {
        return new AgentProperties(
                mode,
                Duration.ofMinutes(5),
                coins,
                3,
                20,
                3,
                circuitBreakerUsd,
                sessionHours,
                contrarianPct,
                true,
                200,
                42L,
                "knowledge/live-trading-lessons.md",
                "ml/data/live_trades.jsonl",
                "agent",
                Duration.ofMinutes(5),
                2,
                Duration.ZERO
        );
    }

    public static ExchangeProperties exchange() {
        return new ExchangeProperties("https://api.hyperliquid.xyz", false, "", "", 50);
    }

    public static IntegrationProperties integration(boolean sentiment, boolean mlScorer, boolean tradeLog, boolean ntfy) {
        return new IntegrationProperties(
                new IntegrationProperties.Sentiment(sentiment, "https://lunarcrush.com", sentiment ? "lc-key" : ""),
                new IntegrationProperties.MlScorer(mlScorer, "http://localhost:8100"),
                new IntegrationProperties.TradeLog(tradeLog, "http://localhost:3000", "testnet"),
                new IntegrationProperties.Ntfy(ntfy, "https://ntfy.sh", ntfy ? "perpbot-alerts" : "")
        );
    }
}
