package org.nowstart.perpbot.strategy.core;

import java.util.Set;

/**
 * Coins that get wider trailing stops and take-profit targets.
 */
public final class VolatileCoins {

    private static final Set<String> COINS = Set.of("MOODENG", "TAO", "HYPE", "WIF", "POPCAT", "DOGE", "SUI");

    private VolatileCoins() {
    }

    public static boolean contains(String coin) {
        return coin != null && COINS.contains(coin);
    }
}
