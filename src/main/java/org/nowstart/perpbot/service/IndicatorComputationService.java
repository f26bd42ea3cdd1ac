package org.nowstart.perpbot.service;

import java.util.List;
import org.nowstart.perpbot.data.dto.IndicatorSnapshot;
import org.nowstart.perpbot.data.type.MarketRegime;
import org.nowstart.perpbot.strategy.core.OhlcvCandle;
import org.springframework.stereotype.Service;

@Service
public class IndicatorComputationService {

    public static final int MIN_CANDLES = 50;
    static final int RSI_PERIOD = 14;
    static final int ATR_PERIOD = 14;
    static final int ADX_PERIOD = 14;
    static final int MACD_FAST = 12;
    static final int MACD_SLOW = 26;
    static final int MACD_SIGNAL = 9;
    static final int BOLLINGER_PERIOD = 20;
    static final double BOLLINGER_STD_DEV = 2.0;

    /**
     * @return {@code null} when fewer than {@link #MIN_CANDLES} candles are available
     */
    public IndicatorSnapshot compute(String coin, String interval, List<OhlcvCandle> candles) {
        if (candles == null || candles.size() < MIN_CANDLES) {
            return null;
        }

        int n = candles.size();
        double[] close = new double[n];
        double[] high = new double[n];
        double[] low = new double[n];
        for (int i = 0; i < n; i++) {
            OhlcvCandle candle = candles.get(i);
            close[i] = candle.close();
            high[i] = candle.high();
            low[i] = candle.low();
        }

        IndicatorSnapshot.Bollinger bollinger = bollinger(close, BOLLINGER_PERIOD, BOLLINGER_STD_DEV);
        IndicatorSnapshot.Adx adx = adx(high, low, close, ADX_PERIOD);
        return new IndicatorSnapshot(
                coin,
                interval,
                close[n - 1],
                rsi(close, RSI_PERIOD),
                macd(close),
                bollinger,
                atr(high, low, close, ATR_PERIOD),
                adx,
                MarketRegime.classify(adx.value(), bollinger.width())
        );
    }

    public double rsi(double[] close, int period) {
        if (close.length <= period) {
            return 50.0;
        }

        double gain = 0.0;
        double loss = 0.0;
        for (int i = 1; i <= period; i++) {
            double diff = close[i] - close[i - 1];
            if (diff > 0) {
                gain += diff;
            } else {
                loss -= diff;
            }
        }
        double avgGain = gain / period;
        double avgLoss = loss / period;

        for (int i = period + 1; i < close.length; i++) {
            double diff = close[i] - close[i - 1];
            avgGain = (avgGain * (period - 1) + Math.max(diff, 0.0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-diff, 0.0)) / period;
        }

        if (avgLoss == 0.0) {
            return 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    public IndicatorSnapshot.Macd macd(double[] close) {
        double[] fast = exponentialMovingAverage(close, MACD_FAST);
        double[] slow = exponentialMovingAverage(close, MACD_SLOW);
        int start = MACD_SLOW - 1;
        if (close.length <= start) {
            return new IndicatorSnapshot.Macd(0.0, 0.0, 0.0);
        }

        double[] line = new double[close.length - start];
        for (int i = start; i < close.length; i++) {
            line[i - start] = fast[i] - slow[i];
        }
        double[] signal = exponentialMovingAverage(line, MACD_SIGNAL);
        double lastLine = line[line.length - 1];
        double lastSignal = signal[signal.length - 1];
        if (!Double.isFinite(lastSignal)) {
            lastSignal = 0.0;
        }
        return new IndicatorSnapshot.Macd(lastLine, lastSignal, lastLine - lastSignal);
    }

    public IndicatorSnapshot.Bollinger bollinger(double[] close, int period, double stdDevMultiplier) {
        int n = close.length;
        int window = Math.min(period, n);
        double sum = 0.0;
        for (int i = n - window; i < n; i++) {
            sum += close[i];
        }
        double middle = sum / window;

        double variance = 0.0;
        for (int i = n - window; i < n; i++) {
            variance += (close[i] - middle) * (close[i] - middle);
        }
        double stdDev = Math.sqrt(variance / window);

        double upper = middle + stdDevMultiplier * stdDev;
        double lower = middle - stdDevMultiplier * stdDev;
        double width = middle == 0.0 ? 0.0 : (upper - lower) / middle;
        return new IndicatorSnapshot.Bollinger(upper, middle, lower, width);
    }

    public double atr(double[] high, double[] low, double[] close, int period) {
        double[] tr = trueRanges(high, low, close);
        if (tr.length < period) {
            return 0.0;
        }

        double total = 0.0;
        for (int i = 0; i < period; i++) {
            total += tr[i];
        }
        double atr = total / period;
        for (int i = period; i < tr.length; i++) {
            atr = ((atr * (period - 1)) + tr[i]) / period;
        }
        return atr;
    }

    public IndicatorSnapshot.Adx adx(double[] high, double[] low, double[] close, int period) {
        int n = close.length;
        if (n < 2 * period + 1) {
            return new IndicatorSnapshot.Adx(0.0, 0.0, 0.0);
        }

        double[] tr = trueRanges(high, low, close);
        double[] plusDm = new double[n - 1];
        double[] minusDm = new double[n - 1];
        for (int i = 1; i < n; i++) {
            double upMove = high[i] - high[i - 1];
            double downMove = low[i - 1] - low[i];
            plusDm[i - 1] = upMove > downMove && upMove > 0 ? upMove : 0.0;
            minusDm[i - 1] = downMove > upMove && downMove > 0 ? downMove : 0.0;
        }

        double smoothTr = 0.0;
        double smoothPlus = 0.0;
        double smoothMinus = 0.0;
        for (int i = 0; i < period; i++) {
            smoothTr += tr[i];
            smoothPlus += plusDm[i];
            smoothMinus += minusDm[i];
        }

        double[] dx = new double[tr.length - period];
        double plusDi = 0.0;
        double minusDi = 0.0;
        for (int i = period; i < tr.length; i++) {
            if (i > period) {
                smoothTr = smoothTr - smoothTr / period + tr[i];
                smoothPlus = smoothPlus - smoothPlus / period + plusDm[i];
                smoothMinus = smoothMinus - smoothMinus / period + minusDm[i];
            }
            plusDi = smoothTr == 0.0 ? 0.0 : 100.0 * smoothPlus / smoothTr;
            minusDi = smoothTr == 0.0 ? 0.0 : 100.0 * smoothMinus / smoothTr;
            double diSum = plusDi + minusDi;
            dx[i - period] = diSum == 0.0 ? 0.0 : 100.0 * Math.abs(plusDi - minusDi) / diSum;
        }

        double adx = 0.0;
        for (int i = 0; i < period; i++) {
            adx += dx[i];
        }
        adx /= period;
        for (int i = period; i < dx.length; i++) {
            adx = ((adx * (period - 1)) + dx[i]) / period;
        }
        return new IndicatorSnapshot.Adx(adx, plusDi, minusDi);
    }

    public double[] exponentialMovingAverage(double[] values, int length) {
        int n = values.length;
        double[] ema = fillNaN(n);
        if (length <= 0 || n < length) {
            return ema;
        }

        double seed = 0.0;
        for (int i = 0; i < length; i++) {
            seed += values[i];
        }
        ema[length - 1] = seed / length;

        double alpha = 2.0 / (length + 1.0);
        for (int i = length; i < n; i++) {
            ema[i] = (alpha * values[i]) + ((1.0 - alpha) * ema[i - 1]);
        }
        return ema;
    }

    private double[] trueRanges(double[] high, double[] low, double[] close) {
        int n = close.length;
        double[] tr = new double[Math.max(n - 1, 0)];
        for (int i = 1; i < n; i++) {
            double highLow = high[i] - low[i];
            double highPrevClose = Math.abs(high[i] - close[i - 1]);
            double lowPrevClose = Math.abs(low[i] - close[i - 1]);
            tr[i - 1] = Math.max(highLow, Math.max(highPrevClose, lowPrevClose));
        }
        return tr;
    }

    private double[] fillNaN(int size) {
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = Double.NaN;
        }
        return values;
    }
}
