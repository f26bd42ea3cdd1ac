package org.nowstart.perpbot.data.dto;

public record PositionSizing(
        double size,
        double notional
) {
}
