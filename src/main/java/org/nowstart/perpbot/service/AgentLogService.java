package org.nowstart.perpbot.service;

import lombok.extern.slf4j.Slf4j;
import org.nowstart.perpbot.data.dto.ExitSignal;
import org.nowstart.perpbot.data.dto.IndicatorSnapshot;
import org.nowstart.perpbot.data.dto.OpenPosition;
import org.nowstart.perpbot.data.dto.PositionSizing;
import org.nowstart.perpbot.data.dto.Signal;
import org.nowstart.perpbot.data.dto.TpSlConfig;
import org.nowstart.perpbot.data.dto.VolatilityAssessment;
import org.springframework.stereotype.Service;

/**
 * Single-line {@code event=... key=value} decision records.
 */
@Slf4j
@Service
public class AgentLogService {

    public void logCycleStart(long cycle, double elapsedHours, int held, int maxPositions, double realizedPnl) {
        log.info(
                "event=cycle_start cycle={} elapsed_hours={} positions={}/{} realized_pnl={}",
                cycle,
                sanitizeMetricForLog(elapsedHours),
                held,
                maxPositions,
                sanitizeMetricForLog(realizedPnl)
        );
    }

    public void logIndicators(IndicatorSnapshot snapshot) {
        log.debug(
                "event=indicators coin={} interval={} price={} regime={} adx={} plus_di={} minus_di={} rsi={} macd_hist={} bb_width={} atr={}",
                snapshot.coin(),
                snapshot.interval(),
                sanitizeMetricForLog(snapshot.price()),
                snapshot.regime().wireName(),
                sanitizeMetricForLog(snapshot.adx().value()),
                sanitizeMetricForLog(snapshot.adx().plusDi()),
                sanitizeMetricForLog(snapshot.adx().minusDi()),
                sanitizeMetricForLog(snapshot.rsi()),
                sanitizeMetricForLog(snapshot.macd().histogram()),
                sanitizeMetricForLog(snapshot.bollinger().width()),
                sanitizeMetricForLog(snapshot.atr())
        );
    }

    public void logEntrySignal(Signal signal, PositionSizing sizing, int leverage, TpSlConfig tpSl, double price) {
        log.info(
                "event=entry_signal coin={} side={} rule={} category={} confidence={} size={} price={} notional={} leverage={} tp_pct={} sl_pct={} reason=\"{}\"",
                signal.coin(),
                signal.side().wireName(),
                signal.rule(),
                signal.category().wireName(),
                sanitizeMetricForLog(signal.confidence()),
                sizing.size(),
                sanitizeMetricForLog(price),
                sanitizeMetricForLog(sizing.notional()),
                leverage,
                tpSl.takeProfitPct(),
                tpSl.stopLossPct(),
                signal.reason()
        );
    }

    public void logExitSignal(OpenPosition position, ExitSignal exitSignal, double exitPrice, double pnl, double pnlPct) {
        log.info(
                "event=exit_signal coin={} side={} rule={} entry={} exit={} size={} pnl={} pnl_pct={} reason=\"{}\"",
                position.coin(),
                position.side().wireName(),
                exitSignal.rule(),
                sanitizeMetricForLog(position.entryPrice()),
                sanitizeMetricForLog(exitPrice),
                position.size(),
                sanitizeMetricForLog(pnl),
                sanitizeMetricForLog(pnlPct),
                exitSignal.reason()
        );
    }

    public void logVolatility(VolatilityAssessment assessment, long effectiveIntervalSeconds) {
        log.info(
                "event=volatility_state state={} previous={} multiplier={} interval_seconds={} summary=\"{}\"",
                assessment.state(),
                assessment.previousState(),
                assessment.sleepMultiplier(),
                effectiveIntervalSeconds,
                assessment.summary()
        );
    }

    public void logCycleSummary(long cycle, int positions, double unrealized, double realized, int nearMisses) {
        log.info(
                "event=cycle_summary cycle={} positions={} unrealized_pnl={} realized_pnl={} near_misses={}",
                cycle,
                positions,
                sanitizeMetricForLog(unrealized),
                sanitizeMetricForLog(realized),
                nearMisses
        );
    }

    public double sanitizeMetricForLog(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        if (value == 0.0) {
            return 0.0;
        }
        return value;
    }
}
