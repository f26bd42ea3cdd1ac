package org.nowstart.perpbot.service.exchange;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Price and size strings accepted by the exchange: prices carry at most 5 significant figures
 * and {@code 6 - szDecimals} decimals, sizes at most {@code szDecimals} decimals.
 */
public final class HyperliquidWireFormat {

    private static final int MAX_PRICE_DECIMALS = 6;
    private static final MathContext PRICE_PRECISION = new MathContext(5, RoundingMode.HALF_EVEN);

    private HyperliquidWireFormat() {
    }

    public static String price(double price, int szDecimals) {
        int decimals = Math.max(0, MAX_PRICE_DECIMALS - szDecimals);
        return BigDecimal.valueOf(price)
                .round(PRICE_PRECISION)
                .setScale(decimals, RoundingMode.HALF_EVEN)
                .stripTrailingZeros()
                .toPlainString();
    }

    public static String size(double size, int szDecimals) {
        return BigDecimal.valueOf(size)
                .setScale(Math.max(0, szDecimals), RoundingMode.HALF_EVEN)
                .stripTrailingZeros()
                .toPlainString();
    }

    public static double slippagePrice(double mid, boolean buy, int slippageBps) {
        double slippage = slippageBps / 10_000.0;
        return buy ? mid * (1 + slippage) : mid * (1 - slippage);
    }
}
