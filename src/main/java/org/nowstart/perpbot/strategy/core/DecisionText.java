package org.nowstart.perpbot.strategy.core;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Number rendering for human-readable signal reasons.
 */
public final class DecisionText {

    private DecisionText() {
    }

    public static String fixed(double value, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }

    public static String pct(double fraction) {
        return fixed(fraction * 100, 2) + "%";
    }

    public static String plain(double value) {
        if (!Double.isFinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    public static String usd(double value) {
        return (value >= 0 ? "+$" : "-$") + fixed(Math.abs(value), 2);
    }
}
