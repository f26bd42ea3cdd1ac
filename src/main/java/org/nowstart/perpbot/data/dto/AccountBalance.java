package org.nowstart.perpbot.data.dto;

public record AccountBalance(
        double available,
        double accountValue,
        double marginUsed
) {
}
