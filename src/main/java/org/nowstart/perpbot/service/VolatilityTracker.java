package org.nowstart.perpbot.service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.perpbot.data.dto.VolatilityAssessment;
import org.nowstart.perpbot.data.type.MarketVolatilityState;
import org.nowstart.perpbot.data.type.VolatilityClass;
import org.springframework.stereotype.Service;

/**
 * Rolling ATR window per coin and the global volatility state derived from it.
 */
@Slf4j
@Service
public class VolatilityTracker {

    static final int HISTORY_SIZE = 20;
    static final int MIN_SAMPLES = 5;
    static final double SPIKE_RATIO = 2.5;
    static final double ELEVATED_RATIO = 1.5;
    static final double CALM_RATIO = 1.0;
    static final int HOT_COINS_FOR_SPIKE = 3;

    private final Map<String, Deque<Double>> atrHistory = new LinkedHashMap<>();
    private final Map<String, VolatilityClass> classByCoin = new LinkedHashMap<>();

    private volatile MarketVolatilityState state = MarketVolatilityState.NORMAL;
    private volatile String summary = "";

    public synchronized VolatilityClass update(String coin, double atr) {
        Deque<Double> history = atrHistory.computeIfAbsent(coin, key -> new ArrayDeque<>());
        history.addLast(atr);
        if (history.size() > HISTORY_SIZE) {
            history.removeFirst();
        }

        VolatilityClass volatilityClass = classify(atr, history);
        classByCoin.put(coin, volatilityClass);
        log.debug("event=volatility_sample coin={} atr={} samples={} class={}", coin, atr, history.size(), volatilityClass);
        return volatilityClass;
    }

    public synchronized VolatilityAssessment assess() {
        List<String> spiked = new ArrayList<>();
        List<String> elevated = new ArrayList<>();
        classByCoin.forEach((coin, volatilityClass) -> {
            if (volatilityClass == VolatilityClass.SPIKE) {
                spiked.add(coin);
            } else if (volatilityClass == VolatilityClass.ELEVATED) {
                elevated.add(coin);
            }
        });

        int hot = spiked.size() + elevated.size();
        MarketVolatilityState next;
        if (!spiked.isEmpty() || hot >= HOT_COINS_FOR_SPIKE) {
            next = MarketVolatilityState.SPIKE;
        } else if (hot > 0) {
            next = MarketVolatilityState.ELEVATED;
        } else {
            next = MarketVolatilityState.NORMAL;
        }

        VolatilityAssessment assessment = new VolatilityAssessment(next, state, List.copyOf(spiked), List.copyOf(elevated));
        state = next;
        summary = assessment.summary();
        return assessment;
    }

    /**
     * Latest ATR relative to the window mean, empty until enough samples exist.
     */
    public synchronized OptionalDouble atrRatio(String coin) {
        Deque<Double> history = atrHistory.get(coin);
        if (history == null || history.size() < MIN_SAMPLES) {
            return OptionalDouble.empty();
        }
        double average = average(history);
        return OptionalDouble.of(average > 0 ? history.peekLast() / average : 1.0);
    }

    public MarketVolatilityState state() {
        return state;
    }

    public double sleepMultiplier() {
        return state.sleepMultiplier();
    }

    public String summary() {
        return summary;
    }

    private static VolatilityClass classify(double atr, Deque<Double> history) {
        if (history.size() < MIN_SAMPLES) {
            return VolatilityClass.NORMAL;
        }
        double average = average(history);
        double ratio = average > 0 ? atr / average : 1.0;
        if (ratio > SPIKE_RATIO) {
            return VolatilityClass.SPIKE;
        }
        if (ratio > ELEVATED_RATIO) {
            return VolatilityClass.ELEVATED;
        }
        if (ratio < CALM_RATIO) {
            return VolatilityClass.CALM;
        }
        return VolatilityClass.NORMAL;
    }

    private static double average(Deque<Double> history) {
        double sum = 0.0;
        for (double value : history) {
            sum += value;
        }
        return sum / history.size();
    }
}
