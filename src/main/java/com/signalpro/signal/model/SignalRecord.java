package com.signalpro.signal.model;

import com.signalpro.chart.model.ChartSeries;
import com.signalpro.shared.exception.SignalValidationException;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 一則訊號的完整資料（渲染的輸入）
 *
 * 必要欄位在 build() 時一次檢查，缺任何一個直接丟 {@link SignalValidationException}，
 * DocumentCompositor 不再做驗證。選填欄位的預設值也只在這裡決定。
 */
@Getter
public class SignalRecord {

    public static final String DEFAULT_TIMESTAMP_LABEL = "Just now";

    /** 手機版面一列只放得下 3 個數據 */
    public static final int MAX_RENDERED_STATISTICS = 3;

    // 必要欄位
    private final String ticker;
    private final String displayName;
    private final SignalKind kind;
    private final double currentPrice;
    private final double priceChangeAbsolute;
    private final double priceChangePercent;

    // 選填欄位
    private final PriorityLevel priority;
    private final List<KeyStatistic> keyStatistics;
    @Getter(AccessLevel.NONE)
    private final StrategyNote strategy;
    @Getter(AccessLevel.NONE)
    private final ChartSeries chartSeries;
    private final String timestampLabel;
    private final boolean notificationsDefaultOn;
    private final boolean riskStyleEnabled;
    private final BorderVariant borderVariant;

    @Builder(toBuilder = true)
    private SignalRecord(String ticker, String displayName, SignalKind kind,
                         Double currentPrice, Double priceChangeAbsolute, Double priceChangePercent,
                         PriorityLevel priority, List<KeyStatistic> keyStatistics,
                         StrategyNote strategy, ChartSeries chartSeries, String timestampLabel,
                         Boolean notificationsDefaultOn, Boolean riskStyleEnabled,
                         BorderVariant borderVariant) {
        List<String> missing = new ArrayList<>();
        if (ticker == null || ticker.isBlank()) missing.add("ticker");
        if (displayName == null || displayName.isBlank()) missing.add("displayName");
        if (kind == null) missing.add("kind");
        if (currentPrice == null) missing.add("currentPrice");
        if (priceChangeAbsolute == null) missing.add("priceChangeAbsolute");
        if (priceChangePercent == null) missing.add("priceChangePercent");
        if (!missing.isEmpty()) {
            throw new SignalValidationException("缺少必要欄位: " + String.join(", ", missing));
        }
        requireFinite("currentPrice", currentPrice);
        requireFinite("priceChangeAbsolute", priceChangeAbsolute);
        requireFinite("priceChangePercent", priceChangePercent);

        this.ticker = ticker;
        this.displayName = displayName;
        this.kind = kind;
        this.currentPrice = currentPrice;
        this.priceChangeAbsolute = priceChangeAbsolute;
        this.priceChangePercent = priceChangePercent;

        this.priority = priority != null ? priority : PriorityLevel.NORMAL;
        this.keyStatistics = keyStatistics != null ? List.copyOf(keyStatistics) : List.of();
        this.strategy = strategy;
        this.chartSeries = chartSeries;
        this.timestampLabel = timestampLabel != null ? timestampLabel : DEFAULT_TIMESTAMP_LABEL;
        this.notificationsDefaultOn = notificationsDefaultOn == null || notificationsDefaultOn;
        this.riskStyleEnabled = riskStyleEnabled != null && riskStyleEnabled;
        this.borderVariant = borderVariant != null ? borderVariant : BorderVariant.SOLID;
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new SignalValidationException(name + " 必須是有限數值，收到: " + value);
        }
    }

    public Optional<StrategyNote> getStrategy() {
        return Optional.ofNullable(strategy);
    }

    public Optional<ChartSeries> getChartSeries() {
        return Optional.ofNullable(chartSeries);
    }

    /** 實際會渲染的數據（最多 3 個），原始清單不截斷 */
    public List<KeyStatistic> renderedStatistics() {
        return keyStatistics.size() <= MAX_RENDERED_STATISTICS
                ? keyStatistics
                : keyStatistics.subList(0, MAX_RENDERED_STATISTICS);
    }

    public KindStyle style() {
        return SignalKindStyles.of(kind);
    }
}
