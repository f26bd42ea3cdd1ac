package org.nowstart.perpbot.data.dto;

public record OrderResult(
        String coin,
        String status,
        String orderId,
        double filledSize,
        double averagePrice
) {
}
