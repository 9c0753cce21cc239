package com.signalpro.render.service;

import com.signalpro.signal.model.BorderVariant;
import com.signalpro.signal.model.KindStyle;
import com.signalpro.signal.model.SignalRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 依訊號組出頁面 CSS
 *
 * 固定部分來自 {@link StaticPayloads}，後面再接上會隨訊號變化的規則：
 * 1. 卡片底色（一律深色漸層）+ 類別主色邊框
 * 2. 該類別的 badge 顏色（漸層只用在 badge）
 * 3. elevated-risk：紫色邊框 + 呼吸光暈
 * 4. dashed-border：只改 border-style，可與 3 疊加
 */
@Component
@RequiredArgsConstructor
public class StyleSheetBuilder {

    public static final String CARD_BACKGROUND = "linear-gradient(135deg, #1a1a1a 0%, #2a2a2a 100%)";
    public static final String RISK_CLASS = "elevated-risk";
    public static final String DASHED_CLASS = "dashed-border";

    private final StaticPayloads payloads;

    public String build(SignalRecord signal) {
        KindStyle style = signal.style();
        StringBuilder css = new StringBuilder(payloads.getStyleSheet());

        css.append("""

                .signal-card {
                    background: %s;
                    border: 1px solid %s;
                }
        """.formatted(CARD_BACKGROUND, style.accentColor()));

        css.append(badgeRule(style));

        if (signal.isRiskStyleEnabled()) {
            css.append("""

                .signal-card.%s {
                    background: linear-gradient(135deg, #1a1a1a 0%%, #2d0d2d 100%%);
                    border-color: #ff00ff;
                    animation: risk-glow 3s ease-in-out infinite;
                }

                @keyframes risk-glow {
                    0%%, 100%% { box-shadow: 0 0 10px rgba(255, 0, 255, 0.3); }
                    50%% { box-shadow: 0 0 20px rgba(255, 0, 255, 0.5); }
                }
        """.formatted(RISK_CLASS));
        }

        if (signal.getBorderVariant() == BorderVariant.DASHED) {
            css.append("""

                .signal-card.%s {
                    border-style: dashed;
                }
        """.formatted(DASHED_CLASS));
        }

        return css.toString();
    }

    private String badgeRule(KindStyle style) {
        StringBuilder rule = new StringBuilder()
                .append("\n        .").append(style.badgeClass()).append(" {\n")
                .append("            background: ").append(style.background()).append(";\n");
        if (style.darkText()) {
            rule.append("            color: #000;\n");
        }
        if (style.isGradient()) {
            rule.append("            animation: color-shift 3s infinite;\n");
        }
        rule.append("        }\n");

        if (style.isGradient()) {
            rule.append("""

                @keyframes color-shift {
                    0%, 100% { filter: hue-rotate(0deg); }
                    50% { filter: hue-rotate(30deg); }
                }
        """);
        }
        return rule.toString();
    }
}
