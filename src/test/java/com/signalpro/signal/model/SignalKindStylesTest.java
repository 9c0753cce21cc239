package com.signalpro.signal.model;

import com.signalpro.shared.exception.SignalValidationException;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class SignalKindStylesTest {

    @ParameterizedTest
    @EnumSource(SignalKind.class)
    @DisplayName("每個類別都有樣式")
    void everyKindHasStyle(SignalKind kind) {
        KindStyle style = SignalKindStyles.of(kind);

        assertThat(style.badgeClass()).isNotBlank();
        assertThat(style.accentColor()).startsWith("#");
    }

    @Test
    @DisplayName("對照表涵蓋全部類別")
    void tableIsComplete() {
        assertThat(SignalKindStyles.all()).hasSize(SignalKind.values().length);
    }

    @Test
    @DisplayName("漸層判斷 — IPO / YOLO / MEME 為漸層")
    void gradientKinds() {
        assertThat(SignalKindStyles.of(SignalKind.IPO_DEBUT).isGradient()).isTrue();
        assertThat(SignalKindStyles.of(SignalKind.YOLO_CALLS).isGradient()).isTrue();
        assertThat(SignalKindStyles.of(SignalKind.MEME_SQUEEZE).isGradient()).isTrue();
        assertThat(SignalKindStyles.of(SignalKind.STOCK_SPLIT).isGradient()).isFalse();
    }

    @Test
    @DisplayName("淺色背景改黑字 — 只有 PRE_MARKET 與 CRYPTO_YIELD")
    void darkTextOnlyForLightBackgrounds() {
        for (SignalKind kind : SignalKind.values()) {
            boolean expected = kind == SignalKind.PRE_MARKET || kind == SignalKind.CRYPTO_YIELD;
            assertThat(SignalKindStyles.of(kind).darkText())
                    .as(kind.name())
                    .isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("名稱解析")
    class FromName {

        @ParameterizedTest
        @ValueSource(strings = {"ipo_debut", "IPO_DEBUT", "ipo-debut", " Ipo-Debut "})
        @DisplayName("不分大小寫，接受 - 或 _")
        void kind_variants(String name) {
            assertThat(SignalKind.fromName(name)).isEqualTo(SignalKind.IPO_DEBUT);
        }

        @Test
        @DisplayName("未知或空白類別 — 驗證錯誤")
        void kind_unknown() {
            assertThatThrownBy(() -> SignalKind.fromName("penny_stock"))
                    .isInstanceOf(SignalValidationException.class)
                    .hasMessageContaining("penny_stock");
            assertThatThrownBy(() -> SignalKind.fromName(""))
                    .isInstanceOf(SignalValidationException.class);
        }

        @Test
        @DisplayName("優先度 — 空白為 NORMAL，NORMAL 沒有 badge")
        void priority_defaults() {
            assertThat(PriorityLevel.fromName(null)).isEqualTo(PriorityLevel.NORMAL);
            assertThat(PriorityLevel.fromName("hot")).isEqualTo(PriorityLevel.HOT);
            assertThat(PriorityLevel.NORMAL.hasBadge()).isFalse();
            assertThat(PriorityLevel.URGENT.getLabel()).isEqualTo("⚡ URGENT");
            assertThatThrownBy(() -> PriorityLevel.fromName("critical"))
                    .isInstanceOf(SignalValidationException.class);
        }

        @Test
        @DisplayName("邊框 — 空白為 SOLID")
        void border_defaults() {
            assertThat(BorderVariant.fromName(" ")).isEqualTo(BorderVariant.SOLID);
            assertThat(BorderVariant.fromName("dashed")).isEqualTo(BorderVariant.DASHED);
        }

        @Test
        @DisplayName("slug 為小寫底線")
        void slug() {
            assertThat(SignalKind.UNUSUAL_OPTIONS.slug()).isEqualTo("unusual_options");
        }
    }
}
