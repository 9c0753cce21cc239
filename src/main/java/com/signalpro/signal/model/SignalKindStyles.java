package com.signalpro.signal.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 訊號類別 → 樣式 對照表
 *
 * 固定資料，類別載入時建立一次，之後唯讀。
 */
public final class SignalKindStyles {

    private static final Map<SignalKind, KindStyle> STYLES;

    static {
        EnumMap<SignalKind, KindStyle> styles = new EnumMap<>(SignalKind.class);
        styles.put(SignalKind.IPO_DEBUT,
                KindStyle.gradient("ipo-debut", "linear-gradient(135deg, #ff4757, #ff6348)", "#ff4757"));
        styles.put(SignalKind.YOLO_CALLS,
                KindStyle.gradient("yolo-play", "linear-gradient(135deg, #ff00ff, #ff4757)", "#ff00ff"));
        styles.put(SignalKind.PRE_MARKET, KindStyle.light("pre-market", "#ffd93d"));
        styles.put(SignalKind.STOCK_SPLIT, KindStyle.flat("stock-split", "#3498db"));
        styles.put(SignalKind.CREDIT_SPREAD, KindStyle.flat("option-spread", "#e74c3c"));
        styles.put(SignalKind.CRYPTO_YIELD, KindStyle.light("crypto-play", "#f7931a"));
        styles.put(SignalKind.FDA_EVENT, KindStyle.flat("fda-event", "#16a085"));
        styles.put(SignalKind.EARNINGS, KindStyle.flat("post-market", "#95a5a6"));
        styles.put(SignalKind.UNUSUAL_OPTIONS, KindStyle.flat("indicator-signal", "#d35400"));
        styles.put(SignalKind.MEME_SQUEEZE,
                KindStyle.gradient("yolo-play", "linear-gradient(135deg, #ff00ff, #ff4757)", "#ff00ff"));
        STYLES = Collections.unmodifiableMap(styles);
    }

    private SignalKindStyles() {
    }

    public static KindStyle of(SignalKind kind) {
        KindStyle style = STYLES.get(kind);
        if (style == null) {
            throw new IllegalStateException("訊號類別缺少樣式設定: " + kind);
        }
        return style;
    }

    public static Map<SignalKind, KindStyle> all() {
        return STYLES;
    }
}
