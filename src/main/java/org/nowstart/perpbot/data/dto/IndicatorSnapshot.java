package org.nowstart.perpbot.data.dto;

import java.util.LinkedHashMap;
import java.util.Map;
import org.nowstart.perpbot.data.type.MarketRegime;

public record IndicatorSnapshot(
        String coin,
        String interval,
        double price,
        double rsi,
        Macd macd,
        Bollinger bollinger,
        double atr,
        Adx adx,
        MarketRegime regime
) {

    public record Macd(double line, double signal, double histogram) {
    }

    public record Bollinger(double upper, double middle, double lower, double width) {
    }

    public record Adx(double value, double plusDi, double minusDi) {
    }

    public double atrPct() {
        return price > 0 ? atr / price : 0.0;
    }

    public Map<String, Object> flatten() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("adx", adx.value());
        fields.put("plus_di", adx.plusDi());
        fields.put("minus_di", adx.minusDi());
        fields.put("rsi", rsi);
        fields.put("macd_histogram", macd.histogram());
        fields.put("bb_width", bollinger.width());
        fields.put("atr_pct", atrPct());
        fields.put("regime", regime.wireName());
        return fields;
    }
}
