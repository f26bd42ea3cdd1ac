package org.nowstart.perpbot.data.type;

public enum SignalStrength {
    STRONG,
    MODERATE
}
