package org.nowstart.perpbot.data.dto;

public record MlScoreRequest(
        String coin,
        String side,
        String rule,
        double adx,
        double plus_di,
        double minus_di,
        double rsi,
        double macd_histogram,
        double bb_width,
        double atr_pct,
        String regime,
        double galaxy_score,
        double sentiment_pct,
        double alt_rank
) {
}
