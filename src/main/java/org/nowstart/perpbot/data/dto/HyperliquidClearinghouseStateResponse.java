package org.nowstart.perpbot.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HyperliquidClearinghouseStateResponse(
        List<AssetPosition> assetPositions,
        MarginSummary marginSummary,
        String withdrawable
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AssetPosition(
            String type,
            Position position
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Position(
            String coin,
            String szi,
            String entryPx,
            Leverage leverage
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Leverage(
            String type,
            int value
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MarginSummary(
            String accountValue,
            String totalMarginUsed
    ) {
    }
}
