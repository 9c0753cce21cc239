package com.signalpro.signal.model;

import com.signalpro.shared.exception.SignalValidationException;

import java.util.Locale;

public enum BorderVariant {
    SOLID, DASHED;

    /** 空值視為 SOLID */
    public static BorderVariant fromName(String name) {
        if (name == null || name.isBlank()) {
            return SOLID;
        }
        try {
            return BorderVariant.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new SignalValidationException("未知的邊框樣式: " + name);
        }
    }
}
