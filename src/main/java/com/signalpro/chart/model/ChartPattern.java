package com.signalpro.chart.model;

import java.util.Locale;

/**
 * 歷史走勢的形狀
 */
public enum ChartPattern {

    /** 先前一路上漲到現價 */
    MOMENTUM,
    /** 圍繞現價震盪，沒有方向 */
    VOLATILE,
    /** 盤整平台後，最後幾根突破到現價 */
    BREAKOUT,
    /** 從高處一路跌到現價 */
    DECLINE;

    /**
     * 不認得的名稱一律回傳 DECLINE
     */
    public static ChartPattern fromName(String name) {
        if (name == null) {
            return DECLINE;
        }
        try {
            return ChartPattern.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return DECLINE;
        }
    }

    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
