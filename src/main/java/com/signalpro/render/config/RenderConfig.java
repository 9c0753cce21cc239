package com.signalpro.render.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 頁面渲染設定（signal.render.*）
 */
@Getter
@ConfigurationProperties(prefix = "signal.render")
public class RenderConfig {

    private final String brandName;
    private final String backLinkUrl;
    private final String chartLibraryUrl;
    private final boolean shadeBands;

    public RenderConfig(
            @DefaultValue("SignalPro") String brandName,
            @DefaultValue("../summary.html") String backLinkUrl,
            @DefaultValue("https://cdnjs.cloudflare.com/ajax/libs/Chart.js/4.4.0/chart.umd.js") String chartLibraryUrl,
            @DefaultValue("true") boolean shadeBands
    ) {
        this.brandName = brandName;
        this.backLinkUrl = backLinkUrl;
        this.chartLibraryUrl = chartLibraryUrl;
        this.shadeBands = shadeBands;
    }

    /** 全部使用預設值，供測試與 CLI 直接建立 */
    public static RenderConfig defaults() {
        return new RenderConfig("SignalPro", "../summary.html",
                "https://cdnjs.cloudflare.com/ajax/libs/Chart.js/4.4.0/chart.umd.js", true);
    }
}
