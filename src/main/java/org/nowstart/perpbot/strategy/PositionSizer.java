package org.nowstart.perpbot.strategy;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import org.nowstart.perpbot.data.dto.PositionSizing;
import org.nowstart.perpbot.data.dto.Signal;
import org.nowstart.perpbot.data.type.StrategyCategory;
import org.springframework.stereotype.Component;

@Component
public class PositionSizer {

    public static final double MIN_NOTIONAL_USD = 10.0;

    public Optional<PositionSizing> size(
            double availableBalance,
            Signal signal,
            double price,
            int leverage,
            double maxAllocPct,
            int sizeDecimals
    ) {
        double margin = availableBalance * (maxAllocPct / 100.0) * scaleFactor(signal);
        double notional = margin * leverage;
        if (notional < MIN_NOTIONAL_USD || price <= 0) {
            return Optional.empty();
        }

        double size = BigDecimal.valueOf(notional / price)
                .setScale(sizeDecimals, RoundingMode.HALF_UP)
                .doubleValue();
        if (size <= 0) {
            return Optional.empty();
        }
        return Optional.of(new PositionSizing(size, notional));
    }

    public double scaleFactor(Signal signal) {
        if (signal.category() == StrategyCategory.CONTRARIAN) {
            return 0.4;
        }
        if (signal.category() == StrategyCategory.SENTIMENT_CONFIRMED) {
            return 0.3;
        }
        String rule = signal.rule();
        if (rule.contains("R4")) {
            return 1.0;
        }
        if (rule.contains("R3")) {
            return 0.7;
        }
        if (rule.contains("R1") || rule.contains("R2")) {
            return 0.6;
        }
        return 0.5;
    }
}
