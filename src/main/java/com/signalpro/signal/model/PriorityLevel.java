package com.signalpro.signal.model;

import com.signalpro.shared.exception.SignalValidationException;

import java.util.Locale;

/**
 * 訊號優先度；NORMAL 的標籤為空字串，不顯示 badge
 */
public enum PriorityLevel {

    URGENT("⚡ URGENT"),
    HOT("🔥 HOT"),
    WATCH("👀 WATCH"),
    NORMAL("");

    private final String label;

    PriorityLevel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean hasBadge() {
        return !label.isEmpty();
    }

    /** 空值視為 NORMAL */
    public static PriorityLevel fromName(String name) {
        if (name == null || name.isBlank()) {
            return NORMAL;
        }
        try {
            return PriorityLevel.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new SignalValidationException("未知的優先度: " + name);
        }
    }
}
