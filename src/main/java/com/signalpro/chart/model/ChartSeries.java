package com.signalpro.chart.model;

import com.signalpro.shared.exception.SignalValidationException;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 以「現在」為中心的走勢資料
 *
 * 前 20 點是歷史（最後一點 = 現在），後 20 點分成上 / 基準 / 下三條情境帶。
 * 建立後不可變；要改 eventLabel 或 accentColor 請用 with* 產生新物件。
 */
@Getter
public class ChartSeries {

    public static final int POINTS = 20;
    public static final String DEFAULT_ACCENT_COLOR = "#00ff88";

    private final List<Double> historical;
    private final List<Double> bandUpper;
    private final List<Double> bandBase;
    private final List<Double> bandLower;
    private final String eventLabel;
    /** 單獨使用時的主色；放進 SignalRecord 渲染時一律改用類別主色 */
    private final String accentColor;

    @Builder(toBuilder = true)
    private ChartSeries(List<Double> historical, List<Double> bandUpper, List<Double> bandBase,
                        List<Double> bandLower, String eventLabel, String accentColor) {
        this.historical = requirePoints("historical", historical);
        this.bandUpper = requirePoints("bandUpper", bandUpper);
        this.bandBase = requirePoints("bandBase", bandBase);
        this.bandLower = requirePoints("bandLower", bandLower);
        this.eventLabel = eventLabel != null ? eventLabel : "";
        this.accentColor = accentColor != null ? accentColor : DEFAULT_ACCENT_COLOR;
    }

    public ChartSeries withEventLabel(String eventLabel) {
        return toBuilder().eventLabel(eventLabel).build();
    }

    public ChartSeries withAccentColor(String accentColor) {
        return toBuilder().accentColor(accentColor).build();
    }

    public double lastHistorical() {
        return historical.get(POINTS - 1);
    }

    private static List<Double> requirePoints(String name, List<Double> values) {
        if (values == null || values.size() != POINTS) {
            throw new SignalValidationException(
                    name + " 必須剛好 " + POINTS + " 點，收到: " + (values == null ? "null" : values.size()));
        }
        for (Double v : values) {
            if (v == null || !Double.isFinite(v)) {
                throw new SignalValidationException(name + " 含有無效數值: " + v);
            }
        }
        return List.copyOf(values);
    }
}
