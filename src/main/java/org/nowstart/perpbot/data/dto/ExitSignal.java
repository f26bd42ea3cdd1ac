package org.nowstart.perpbot.data.dto;

public record ExitSignal(
        String rule,
        String reason
) {
}
