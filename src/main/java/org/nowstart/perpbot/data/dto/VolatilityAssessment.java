package org.nowstart.perpbot.data.dto;

import java.util.List;
import org.nowstart.perpbot.data.type.MarketVolatilityState;

public record VolatilityAssessment(
        MarketVolatilityState state,
        MarketVolatilityState previousState,
        List<String> spiked,
        List<String> elevated
) {

    public boolean transitioned() {
        return state != previousState;
    }

    public double sleepMultiplier() {
        return state.sleepMultiplier();
    }

    public String summary() {
        if (spiked.isEmpty() && elevated.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder("VOL: ");
        if (!spiked.isEmpty()) {
            builder.append(spiked.size()).append(" spike (").append(String.join(",", spiked)).append(")");
        }
        if (!elevated.isEmpty()) {
            if (!spiked.isEmpty()) {
                builder.append(", ");
            }
            builder.append(elevated.size()).append(" elevated (").append(String.join(",", elevated)).append(")");
        }
        return builder.toString();
    }
}
