package org.nowstart.perpbot.strategy.core;

import org.nowstart.perpbot.data.dto.Signal;

public record ContrarianDecision(
        Outcome outcome,
        Signal signal
) {

    public enum Outcome {
        UNCHANGED,
        FLIPPED,
        SLOTS_FULL,
        BELOW_FLOOR
    }

    public static ContrarianDecision unchanged(Signal signal) {
        return new ContrarianDecision(Outcome.UNCHANGED, signal);
    }

    public boolean tradeable() {
        return outcome != Outcome.BELOW_FLOOR;
    }
}
