package org.nowstart.perpbot.data.dto;

public record AssetMeta(
        int assetId,
        String name,
        int szDecimals,
        int maxLeverage,
        boolean delisted
) {
    public static final int DEFAULT_SZ_DECIMALS = 4;
}
