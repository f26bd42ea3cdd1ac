package org.nowstart.perpbot.data.dto;

public record RuleStats(
        String rule,
        int wins,
        int losses,
        double totalPnl
) {

    public static RuleStats empty(String rule) {
        return new RuleStats(rule, 0, 0, 0.0);
    }

    public RuleStats record(double pnl) {
        boolean win = pnl >= 0;
        return new RuleStats(rule, win ? wins + 1 : wins, win ? losses : losses + 1, totalPnl + pnl);
    }

    public int totalTrades() {
        return wins + losses;
    }

    public double winRatePct() {
        return totalTrades() == 0 ? 0.0 : wins * 100.0 / totalTrades();
    }

    public double averagePnl() {
        return totalTrades() == 0 ? 0.0 : totalPnl / totalTrades();
    }
}
