package com.signalpro.chart.service;

import com.signalpro.chart.model.ChartPattern;
import com.signalpro.chart.model.ChartSeries;
import com.signalpro.shared.exception.SignalValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * 走勢合成器：用形狀名稱 + 現價產生一組看起來合理的圖表資料
 *
 * 歷史 20 點依形狀產生，最後一點落在現價附近（誤差 = 該形狀的雜訊上限）；
 * 未來 20 點的三條情境帶與形狀無關，index 0 三條都等於現價。
 *
 * 雜訊不需要可重現，沒有共享可變狀態（java.util.Random 本身執行緒安全），
 * 可以平行呼叫。
 */
@Slf4j
@Service
public class TrajectorySynthesizer {

    private final Random random;

    public TrajectorySynthesizer() {
        this(new Random());
    }

    /** 測試用：注入固定 seed */
    TrajectorySynthesizer(Random random) {
        this.random = random;
    }

    /**
     * @param symbol      只用於 log，不影響計算
     * @param currentPrice 現價，必須 > 0
     * @param patternName momentum / volatile / breakout / decline，其他一律當 decline
     */
    public ChartSeries synthesize(String symbol, double currentPrice, String patternName) {
        return synthesize(symbol, currentPrice, ChartPattern.fromName(patternName));
    }

    public ChartSeries synthesize(String symbol, double currentPrice, ChartPattern pattern) {
        if (!(currentPrice > 0) || Double.isInfinite(currentPrice)) {
            throw new SignalValidationException("現價必須為正數: " + currentPrice);
        }

        List<Double> historical = switch (pattern) {
            case MOMENTUM -> momentum(currentPrice);
            case VOLATILE -> oscillating(currentPrice);
            case BREAKOUT -> breakout(currentPrice);
            case DECLINE -> decline(currentPrice);
        };

        List<Double> upper = new ArrayList<>(ChartSeries.POINTS);
        List<Double> base = new ArrayList<>(ChartSeries.POINTS);
        List<Double> lower = new ArrayList<>(ChartSeries.POINTS);
        for (int i = 0; i < ChartSeries.POINTS; i++) {
            double progress = (double) i / ChartSeries.POINTS;
            upper.add(currentPrice + currentPrice * 0.3 * progress + Math.pow(i, 1.1));
            base.add(currentPrice + currentPrice * 0.1 * progress);
            lower.add(currentPrice - currentPrice * 0.2 * progress - Math.pow(i, 1.05));
        }

        log.debug("合成走勢: {} @ {} pattern={}", symbol, currentPrice, pattern.getName());

        return ChartSeries.builder()
                .historical(historical)
                .bandUpper(upper)
                .bandBase(base)
                .bandLower(lower)
                .eventLabel(String.format(Locale.US, "Signal @ $%.2f", currentPrice))
                .accentColor(ChartSeries.DEFAULT_ACCENT_COLOR)
                .build();
    }

    // 0.8P → P 線性上漲 15 點（±2），最後 5 點在 P 附近（±3）
    private List<Double> momentum(double p) {
        double start = p * 0.8;
        List<Double> points = new ArrayList<>(ChartSeries.POINTS);
        for (int i = 0; i < ChartSeries.POINTS; i++) {
            if (i < 15) {
                points.add(start + (p - start) * (i / 15.0) + noise(2));
            } else {
                points.add(p + noise(3));
            }
        }
        return points;
    }

    // 振幅 0.1P、週期約 12.6 點的正弦波（±5）
    private List<Double> oscillating(double p) {
        List<Double> points = new ArrayList<>(ChartSeries.POINTS);
        for (int i = 0; i < ChartSeries.POINTS; i++) {
            points.add(p + Math.sin(i * 0.5) * p * 0.1 + noise(5));
        }
        return points;
    }

    // 前 15 點在 0.9P 盤整（±2），後 5 點無雜訊拉到 P
    private List<Double> breakout(double p) {
        double plateau = p * 0.9;
        List<Double> points = new ArrayList<>(ChartSeries.POINTS);
        for (int i = 0; i < ChartSeries.POINTS; i++) {
            if (i < 15) {
                points.add(plateau + noise(2));
            } else {
                points.add(plateau + (p - plateau) * ((i - 15) / 4.0));
            }
        }
        return points;
    }

    // 1.2P → P 線性下跌（±2），最後一點落在 P
    private List<Double> decline(double p) {
        double start = p * 1.2;
        List<Double> points = new ArrayList<>(ChartSeries.POINTS);
        for (int i = 0; i < ChartSeries.POINTS; i++) {
            points.add(start - (start - p) * (i / (double) (ChartSeries.POINTS - 1)) + noise(2));
        }
        return points;
    }

    /** [-bound, bound) 均勻分布 */
    private double noise(double bound) {
        return (random.nextDouble() * 2 - 1) * bound;
    }
}
