package org.nowstart.perpbot.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HyperliquidCandleResponse(
        long t,
        String o,
        String h,
        String l,
        String c,
        String v
) {
}
