package org.nowstart.perpbot.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code response} is an object on success and a plain error string when {@code status} is "err".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HyperliquidExchangeResponse(
        String status,
        JsonNode response
) {

    public boolean ok() {
        return "ok".equals(status);
    }
}
