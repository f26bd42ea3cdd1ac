package org.nowstart.perpbot.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LunarCrushCoinListResponse(
        List<Coin> data
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Coin(
            String symbol,
            Double galaxy_score,
            Double sentiment,
            Double social_volume_24h,
            Double interactions_24h,
            Double social_dominance,
            Double alt_rank
    ) {
    }
}
