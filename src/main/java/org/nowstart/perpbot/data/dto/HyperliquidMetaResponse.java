package org.nowstart.perpbot.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HyperliquidMetaResponse(
        List<Asset> universe
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Asset(
            String name,
            int szDecimals,
            int maxLeverage,
            Boolean isDelisted
    ) {
    }
}
