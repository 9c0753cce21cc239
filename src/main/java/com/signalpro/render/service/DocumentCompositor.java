package com.signalpro.render.service;

import com.signalpro.chart.model.ChartSeries;
import com.signalpro.render.config.RenderConfig;
import com.signalpro.signal.model.BorderVariant;
import com.signalpro.signal.model.KeyStatistic;
import com.signalpro.signal.model.KindStyle;
import com.signalpro.signal.model.SignalRecord;
import com.signalpro.signal.model.StrategyNote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 訊號頁面組版：SignalRecord → 單一、自給自足的 HTML 文件
 *
 * 純函式：不寫檔、不改 record，同樣輸入（含同一份 ChartSeries）輸出逐位元組相同。
 * record 的必要欄位已在建立時驗證，這裡不再檢查。
 *
 * 條件區塊：
 * - 優先度 badge：priority 不是 NORMAL 才出現
 * - 走勢圖：有 chartSeries 才出現
 * - 關鍵數據：最多 3 個，沒有就整段省略
 * - 策略說明：有 strategy 才出現
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentCompositor {

    static final String NOW_CAPTION = "← now | prediction →";

    private final RenderConfig renderConfig;
    private final StaticPayloads payloads;
    private final StyleSheetBuilder styleSheetBuilder;
    private final ChartConfigWriter chartConfigWriter;

    public String compose(SignalRecord signal) {
        KindStyle style = signal.style();
        String ticker = esc(signal.getTicker());

        StringBuilder html = new StringBuilder(32 * 1024);
        html.append("<!DOCTYPE html>\n")
                .append("<html lang=\"en\">\n")
                .append("<head>\n")
                .append("    <meta charset=\"UTF-8\">\n")
                .append("    <meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n")
                .append("    <title>").append(ticker).append(" - ").append(esc(documentTitle(signal))).append("</title>\n")
                .append("    <script src=\"").append(esc(renderConfig.getChartLibraryUrl())).append("\"></script>\n")
                .append("    <style>\n")
                .append(styleSheetBuilder.build(signal))
                .append("    </style>\n")
                .append("</head>\n")
                .append("<body>\n");

        appendHeader(html);

        html.append("    <div class=\"").append(String.join(" ", cardClasses(signal))).append("\">\n");
        appendPriorityLabel(html, signal);
        appendSignalHeader(html, signal, style, ticker);
        signal.getChartSeries().ifPresent(series -> appendChartSection(html, signal, series));
        appendKeyStatistics(html, signal.renderedStatistics());
        signal.getStrategy().ifPresent(strategy -> appendStrategy(html, strategy));
        appendFooter(html, signal);
        html.append("    </div>\n\n");

        html.append("    <script>\n");
        signal.getChartSeries().ifPresent(series -> appendChartScript(html, signal, series, style));
        html.append(payloads.getClientScript())
                .append("    </script>\n")
                .append("</body>\n")
                .append("</html>\n");

        log.debug("組版完成: {} ({}) {} chars", signal.getTicker(), signal.getKind(), html.length());
        return html.toString();
    }

    /** 有策略用策略標題，否則用類別名稱 */
    static String documentTitle(SignalRecord signal) {
        return signal.getStrategy()
                .map(StrategyNote::getTitle)
                .orElse(signal.getKind().getDisplayName());
    }

    /** 卡片 class；風險與虛線可同時存在 */
    static List<String> cardClasses(SignalRecord signal) {
        List<String> classes = new ArrayList<>();
        classes.add("signal-card");
        if (signal.isRiskStyleEnabled()) {
            classes.add(StyleSheetBuilder.RISK_CLASS);
        }
        if (signal.getBorderVariant() == BorderVariant.DASHED) {
            classes.add(StyleSheetBuilder.DASHED_CLASS);
        }
        return classes;
    }

    static String canvasId(String ticker) {
        return "chart-" + ticker.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
    }

    static String formatPrice(double price) {
        return String.format(Locale.US, "$%,.2f", price);
    }

    /** 正數加上 + 號；0 與負數沒有 */
    static String formatPercent(double percent) {
        return (percent > 0 ? "+" : "") + String.format(Locale.US, "%.1f", percent) + "%";
    }

    // ==================== 區塊 ====================

    private void appendHeader(StringBuilder html) {
        html.append("    <div class=\"header\">\n")
                .append("        <div class=\"logo\">").append(esc(renderConfig.getBrandName())).append("</div>\n")
                .append("        <a href=\"").append(esc(renderConfig.getBackLinkUrl())).append("\" class=\"back-button haptic\">\n")
                .append("            <svg width=\"16\" height=\"16\" viewBox=\"0 0 24 24\" fill=\"none\" stroke=\"currentColor\" stroke-width=\"2\">\n")
                .append("                <path d=\"M19 12H5M12 19l-7-7 7-7\"/>\n")
                .append("            </svg>\n")
                .append("            Back\n")
                .append("        </a>\n")
                .append("    </div>\n\n");
    }

    private void appendPriorityLabel(StringBuilder html, SignalRecord signal) {
        if (signal.getPriority().hasBadge()) {
            html.append("        <div class=\"hot-label\">").append(esc(signal.getPriority().getLabel())).append("</div>\n");
        }
    }

    private void appendSignalHeader(StringBuilder html, SignalRecord signal, KindStyle style, String ticker) {
        String changeClass = signal.getPriceChangePercent() > 0 ? "positive" : "negative";
        html.append("        <div class=\"signal-header\">\n")
                .append("            <div class=\"ticker-main\">\n")
                .append("                <span class=\"ticker\">").append(ticker).append("</span>\n")
                .append("                <span class=\"strategy-badge ").append(style.badgeClass()).append("\">")
                .append(esc(signal.getKind().getDisplayName())).append("</span>\n")
                .append("            </div>\n")
                .append("            <div class=\"company-name\">").append(esc(signal.getDisplayName())).append("</div>\n")
                .append("            <div class=\"price-row\">\n")
                .append("                <span class=\"price\">").append(formatPrice(signal.getCurrentPrice())).append("</span>\n")
                .append("                <span class=\"change ").append(changeClass).append("\">")
                .append(formatPercent(signal.getPriceChangePercent())).append("</span>\n")
                .append("            </div>\n")
                .append("        </div>\n");
    }

    private void appendChartSection(StringBuilder html, SignalRecord signal, ChartSeries series) {
        html.append("        <div class=\"chart-section\">\n")
                .append("            <canvas id=\"").append(canvasId(signal.getTicker())).append("\"></canvas>\n")
                .append("            <div class=\"event-label\">").append(esc(series.getEventLabel())).append("</div>\n")
                .append("            <div class=\"prediction-indicator\">").append(NOW_CAPTION).append("</div>\n")
                .append("        </div>\n");
    }

    // 只看 favorable 旗標決定顏色，不檢查文字是否以 "-" 開頭
    private void appendKeyStatistics(StringBuilder html, List<KeyStatistic> statistics) {
        if (statistics.isEmpty()) {
            return;
        }
        html.append("        <div class=\"key-stats\">\n");
        for (KeyStatistic stat : statistics) {
            html.append("            <div class=\"stat\">\n")
                    .append("                <div class=\"stat-value").append(stat.favorable() ? " positive" : "").append("\">")
                    .append(esc(stat.displayValue())).append("</div>\n")
                    .append("                <div class=\"stat-label\">").append(esc(stat.label())).append("</div>\n")
                    .append("            </div>\n");
        }
        html.append("        </div>\n");
    }

    private void appendStrategy(StringBuilder html, StrategyNote strategy) {
        html.append("        <div class=\"strategy-info\">\n")
                .append("            <div class=\"strategy-title\">").append(esc(strategy.getTitle())).append("</div>\n")
                .append("            <div class=\"strategy-desc\">").append(esc(strategy.getDescription())).append("</div>\n")
                .append("            <a href=\"").append(esc(strategy.getLinkUrl())).append("\" class=\"strategy-link\">")
                .append(esc(strategy.getLinkText())).append("</a>\n")
                .append("        </div>\n");
    }

    private void appendFooter(StringBuilder html, SignalRecord signal) {
        html.append("        <div class=\"signal-footer\">\n")
                .append("            <div class=\"notify-toggle\">\n")
                .append("                <span>Exit alert</span>\n")
                .append("                <div class=\"toggle").append(signal.isNotificationsDefaultOn() ? " on" : "")
                .append(" haptic\" onclick=\"toggleNotify(this)\">\n")
                .append("                    <div class=\"toggle-knob\"></div>\n")
                .append("                </div>\n")
                .append("            </div>\n")
                .append("            <span class=\"timestamp\">").append(esc(signal.getTimestampLabel())).append("</span>\n")
                .append("        </div>\n");
    }

    private void appendChartScript(StringBuilder html, SignalRecord signal, ChartSeries series, KindStyle style) {
        html.append("        const chartCtx = document.getElementById('").append(canvasId(signal.getTicker()))
                .append("')?.getContext('2d');\n")
                .append("        if (chartCtx) {\n")
                .append("            new Chart(chartCtx, ").append(chartConfigWriter.write(series, style.accentColor())).append(");\n")
                .append("        }\n\n");
    }

    private static String esc(String text) {
        return text == null ? "" : HtmlUtils.htmlEscape(text, "UTF-8");
    }
}
