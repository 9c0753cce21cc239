package com.signalpro.signal.model;

/**
 * 關鍵數據（純展示，不解析 displayValue 的數值）
 *
 * @param favorable 為 true 時數值套用綠色，否則不上色
 */
public record KeyStatistic(String displayValue, String label, boolean favorable) {

    public KeyStatistic(String displayValue, String label) {
        this(displayValue, label, true);
    }
}
