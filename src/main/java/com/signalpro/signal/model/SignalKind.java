package com.signalpro.signal.model;

import com.signalpro.shared.exception.SignalValidationException;

import java.util.Locale;

/**
 * 訊號類別
 *
 * 只描述「是什麼」，視覺樣式放在 {@link SignalKindStyles} 的對照表。
 */
public enum SignalKind {

    IPO_DEBUT("IPO Debut"),
    YOLO_CALLS("YOLO Calls"),         // 高風險衍生品
    PRE_MARKET("Pre Market"),
    STOCK_SPLIT("Stock Split"),
    CREDIT_SPREAD("Credit Spread"),
    CRYPTO_YIELD("Crypto Yield"),
    FDA_EVENT("FDA Event"),           // 監管催化
    EARNINGS("Earnings"),
    UNUSUAL_OPTIONS("Unusual Options"),
    MEME_SQUEEZE("Meme Squeeze");

    private final String displayName;

    SignalKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** 檔名用的小寫代號，例如 ipo_debut */
    public String slug() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 依名稱解析（不分大小寫，接受 - 或 _）
     *
     * @throws SignalValidationException 名稱為空或不存在
     */
    public static SignalKind fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new SignalValidationException("訊號類型不可為空");
        }
        String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return SignalKind.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new SignalValidationException("未知的訊號類型: " + name);
        }
    }
}
