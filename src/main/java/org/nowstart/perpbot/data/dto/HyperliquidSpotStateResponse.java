package org.nowstart.perpbot.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HyperliquidSpotStateResponse(
        List<Balance> balances
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Balance(
            String coin,
            String total,
            String hold
    ) {
    }
}
