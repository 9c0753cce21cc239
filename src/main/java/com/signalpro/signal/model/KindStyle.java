package com.signalpro.signal.model;

import java.util.Locale;

/**
 * 單一訊號類別的樣式：badge class、背景、主色
 *
 * @param badgeClass  badge 的 CSS class（多個類別可共用）
 * @param background  badge 背景，純色（#rrggbb）或 linear-gradient(...)
 * @param accentColor 卡片邊框 / 圖表主線顏色
 * @param darkText    淺色背景（黃、橘）上的 badge 文字改用黑色
 */
public record KindStyle(String badgeClass, String background, String accentColor, boolean darkText) {

    public static KindStyle flat(String badgeClass, String color) {
        return new KindStyle(badgeClass, color, color, false);
    }

    public static KindStyle light(String badgeClass, String color) {
        return new KindStyle(badgeClass, color, color, true);
    }

    public static KindStyle gradient(String badgeClass, String gradient, String accentColor) {
        return new KindStyle(badgeClass, gradient, accentColor, false);
    }

    public boolean isGradient() {
        return background.toLowerCase(Locale.ROOT).contains("gradient");
    }
}
