package org.nowstart.perpbot.strategy;

import org.nowstart.perpbot.data.dto.Signal;
import org.nowstart.perpbot.data.dto.TpSlConfig;
import org.nowstart.perpbot.data.type.StrategyCategory;
import org.nowstart.perpbot.data.type.TradeSide;
import org.nowstart.perpbot.strategy.core.ExitThresholds;
import org.nowstart.perpbot.strategy.core.VolatileCoins;
import org.springframework.stereotype.Component;

/**
 * Exchange-side take-profit / stop-loss placed with each entry as a safety net behind the exit rules.
 */
@Component
public class ProtectiveOrderPolicy {

    public TpSlConfig resolve(Signal signal) {
        boolean volatileCoin = VolatileCoins.contains(signal.coin());
        if (signal.category() == StrategyCategory.CONTRARIAN) {
            return new TpSlConfig(ExitThresholds.CONTRARIAN.takeProfitCap(), ExitThresholds.CONTRARIAN_STOP_LOSS);
        }
        if (signal.category() == StrategyCategory.SENTIMENT_CONFIRMED) {
            return new TpSlConfig(volatileCoin ? 0.03 : 0.02, -0.015);
        }
        double takeProfit = volatileCoin ? 0.05 : 0.03;
        if (signal.rule().contains("R3") && signal.side() == TradeSide.LONG) {
            return new TpSlConfig(takeProfit, -0.015);
        }
        return new TpSlConfig(takeProfit, -0.02);
    }
}
