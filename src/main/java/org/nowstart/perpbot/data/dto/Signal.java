package org.nowstart.perpbot.data.dto;

import org.nowstart.perpbot.data.type.StrategyCategory;
import org.nowstart.perpbot.data.type.TradeSide;

public record Signal(
        String coin,
        TradeSide side,
        String rule,
        StrategyCategory category,
        double confidence,
        String reason
) {

    public Signal withConfidence(double newConfidence) {
        return new Signal(coin, side, rule, category, newConfidence, reason);
    }

    public Signal boosted(double delta, String note) {
        return new Signal(coin, side, rule, category, Math.min(confidence + delta, 1.0), reason + " | " + note);
    }

    public Signal flippedContrarian(double discount, String note) {
        return new Signal(
                coin,
                side.opposite(),
                "C-" + rule,
                StrategyCategory.CONTRARIAN,
                confidence * discount,
                "CONTRARIAN: " + reason + " | " + note
        );
    }

    public boolean isContrarian() {
        return category == StrategyCategory.CONTRARIAN;
    }
}
