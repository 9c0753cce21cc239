package com.signalpro.render.service;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.signalpro.chart.model.ChartSeries;
import com.signalpro.render.config.RenderConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 產生嵌入頁面的 Chart.js 設定（JSON）
 *
 * X 軸共 40 格（-20 … 19）：歷史線佔前 20 格，三條情境帶佔後 20 格，
 * 其餘補 null 讓線段斷開。Gson 預設會把 < > 等字元轉成 unicode escape，
 * 所以輸出可以直接放進 &lt;script&gt;。
 */
@Component
@RequiredArgsConstructor
public class ChartConfigWriter {

    private static final String BAND_COLOR = "rgba(255, 71, 87, 0.3)";
    private static final String BAND_FILL = "rgba(255, 71, 87, 0.1)";

    private final RenderConfig renderConfig;
    private final Gson gson = new Gson();

    /**
     * @param series      走勢資料
     * @param accentColor 歷史線與基準線的顏色（取自訊號類別）
     */
    public String write(ChartSeries series, String accentColor) {
        JsonArray datasets = new JsonArray();

        JsonObject historical = line("Historical", leading(series.getHistorical()), accentColor, 2);
        historical.addProperty("backgroundColor", "transparent");
        historical.addProperty("tension", 0.3);
        datasets.add(historical);

        JsonObject upper = dashed(line("Upper Band", trailing(series.getBandUpper()), BAND_COLOR, 1));
        datasets.add(upper);

        JsonObject base = dashed(line("Base Case", trailing(series.getBandBase()), accentColor, 2));
        datasets.add(base);

        JsonObject lower = dashed(line("Lower Band", trailing(series.getBandLower()), BAND_COLOR, 1));
        datasets.add(lower);

        // 上下帶往基準線填色
        if (renderConfig.isShadeBands()) {
            upper.addProperty("fill", "+1");
            upper.addProperty("backgroundColor", BAND_FILL);
            lower.addProperty("fill", "-1");
            lower.addProperty("backgroundColor", BAND_FILL);
        } else {
            upper.addProperty("fill", false);
            lower.addProperty("fill", false);
        }

        JsonArray labels = new JsonArray();
        for (int i = -ChartSeries.POINTS; i < ChartSeries.POINTS; i++) {
            labels.add(i);
        }

        JsonObject data = new JsonObject();
        data.add("labels", labels);
        data.add("datasets", datasets);

        JsonObject config = new JsonObject();
        config.addProperty("type", "line");
        config.add("data", data);
        config.add("options", miniChartOptions());
        return gson.toJson(config);
    }

    private JsonObject line(String label, JsonArray data, String color, int width) {
        JsonObject dataset = new JsonObject();
        dataset.addProperty("label", label);
        dataset.add("data", data);
        dataset.addProperty("borderColor", color);
        dataset.addProperty("borderWidth", width);
        dataset.addProperty("pointRadius", 0);
        return dataset;
    }

    private JsonObject dashed(JsonObject dataset) {
        JsonArray dash = new JsonArray();
        dash.add(5);
        dash.add(5);
        dataset.add("borderDash", dash);
        return dataset;
    }

    /** 資料放前 20 格，後 20 格 null */
    private JsonArray leading(List<Double> values) {
        JsonArray array = new JsonArray();
        values.forEach(array::add);
        padNulls(array);
        return array;
    }

    /** 前 20 格 null，資料放後 20 格 */
    private JsonArray trailing(List<Double> values) {
        JsonArray array = new JsonArray();
        padNulls(array);
        values.forEach(array::add);
        return array;
    }

    private void padNulls(JsonArray array) {
        for (int i = 0; i < ChartSeries.POINTS; i++) {
            array.add(JsonNull.INSTANCE);
        }
    }

    // 迷你圖：不顯示圖例、tooltip、座標軸
    private JsonObject miniChartOptions() {
        JsonObject hidden = new JsonObject();
        hidden.addProperty("display", false);

        JsonObject plugins = new JsonObject();
        plugins.add("legend", hidden.deepCopy());
        JsonObject tooltip = new JsonObject();
        tooltip.addProperty("enabled", false);
        plugins.add("tooltip", tooltip);

        JsonObject axis = new JsonObject();
        axis.addProperty("display", false);
        axis.add("grid", hidden.deepCopy());
        JsonObject scales = new JsonObject();
        scales.add("x", axis.deepCopy());
        scales.add("y", axis.deepCopy());

        JsonObject point = new JsonObject();
        point.addProperty("radius", 0);
        JsonObject lineElement = new JsonObject();
        lineElement.addProperty("borderWidth", 2);
        JsonObject elements = new JsonObject();
        elements.add("point", point);
        elements.add("line", lineElement);

        JsonObject interaction = new JsonObject();
        interaction.addProperty("intersect", false);

        JsonObject options = new JsonObject();
        options.addProperty("responsive", true);
        options.addProperty("maintainAspectRatio", false);
        options.add("plugins", plugins);
        options.add("scales", scales);
        options.add("elements", elements);
        options.add("interaction", interaction);
        return options;
    }
}
