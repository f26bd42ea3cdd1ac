package org.nowstart.perpbot.data.dto;

import java.util.Map;

/**
 * Signed envelope posted to {@code /exchange}. {@code vaultAddress} is serialized as an explicit null.
 */
public record HyperliquidExchangeRequest(
        Map<String, Object> action,
        long nonce,
        Signature signature,
        String vaultAddress
) {

    public record Signature(
            String r,
            String s,
            int v
    ) {
    }
}
