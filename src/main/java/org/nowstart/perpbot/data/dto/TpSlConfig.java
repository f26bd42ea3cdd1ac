package org.nowstart.perpbot.data.dto;

/**
 * Protective trigger offsets relative to the entry mid. {@code stopLossPct} is negative.
 */
public record TpSlConfig(
        double takeProfitPct,
        double stopLossPct
) {
}
