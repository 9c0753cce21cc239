package com.signalpro.signal.service;

import com.signalpro.chart.model.ChartSeries;
import com.signalpro.chart.service.TrajectorySynthesizer;
import com.signalpro.shared.exception.SignalValidationException;
import com.signalpro.signal.dto.GenerateSignalRequest;
import com.signalpro.signal.dto.KeyStatisticInput;
import com.signalpro.signal.dto.SignalPreviewResponse;
import com.signalpro.signal.model.*;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * SignalRequestMapper 單元測試
 *
 * 覆蓋：欄位正規化、數據過濾、策略條件、走勢圖參數、預覽截斷
 */
class SignalRequestMapperTest {

    private TrajectorySynthesizer synthesizer;
    private SignalRequestMapper mapper;

    @BeforeEach
    void setUp() {
        synthesizer = mock(TrajectorySynthesizer.class);
        mapper = new SignalRequestMapper(synthesizer);

        List<Double> flat = Collections.nCopies(ChartSeries.POINTS, 69.0);
        ChartSeries series = ChartSeries.builder()
                .historical(flat).bandUpper(flat).bandBase(flat).bandLower(flat)
                .eventLabel("Signal @ $69.00")
                .build();
        when(synthesizer.synthesize(anyString(), anyDouble(), anyString())).thenReturn(series);
    }

    private static GenerateSignalRequest request() {
        GenerateSignalRequest request = new GenerateSignalRequest();
        request.setTicker(" crcl ");
        request.setCompanyName("Circle Internet Group");
        request.setSignalType("ipo_debut");
        request.setCurrentPrice(69.0);
        request.setChangePercent(122.6);
        return request;
    }

    // ==================== 基本欄位 ====================

    @Nested
    @DisplayName("基本欄位")
    class BasicFields {

        @Test
        @DisplayName("ticker 轉大寫，計算變動金額")
        void toRecord_normalizes() {
            SignalRecord signal = mapper.toRecord(request());

            assertThat(signal.getTicker()).isEqualTo("CRCL");
            assertThat(signal.getKind()).isEqualTo(SignalKind.IPO_DEBUT);
            assertThat(signal.getPriceChangeAbsolute()).isCloseTo(69.0 * 1.226, within(1e-9));
            assertThat(signal.getPriority()).isEqualTo(PriorityLevel.NORMAL);
            assertThat(signal.getBorderVariant()).isEqualTo(BorderVariant.SOLID);
            assertThat(signal.getTimestampLabel()).isEqualTo(SignalRecord.DEFAULT_TIMESTAMP_LABEL);
            assertThat(signal.isNotificationsDefaultOn()).isTrue();
        }

        @Test
        @DisplayName("選填欄位照樣帶入")
        void toRecord_optionalFields() {
            GenerateSignalRequest request = request();
            request.setPriority("hot");
            request.setBorderStyle("dashed");
            request.setRiskStyle(true);
            request.setTimestamp("15 min ago");
            request.setNotificationsEnabled(false);

            SignalRecord signal = mapper.toRecord(request);

            assertThat(signal.getPriority()).isEqualTo(PriorityLevel.HOT);
            assertThat(signal.getBorderVariant()).isEqualTo(BorderVariant.DASHED);
            assertThat(signal.isRiskStyleEnabled()).isTrue();
            assertThat(signal.getTimestampLabel()).isEqualTo("15 min ago");
            assertThat(signal.isNotificationsDefaultOn()).isFalse();
        }

        @Test
        @DisplayName("未知訊號類型 — 驗證錯誤")
        void toRecord_unknownKind() {
            GenerateSignalRequest request = request();
            request.setSignalType("penny_stock");

            assertThatThrownBy(() -> mapper.toRecord(request))
                    .isInstanceOf(SignalValidationException.class);
        }
    }

    // ==================== 數據與策略 ====================

    @Nested
    @DisplayName("數據與策略")
    class StatisticsAndStrategy {

        @Test
        @DisplayName("value 或 label 空白的數據被過濾")
        void toRecord_filtersBlankStats() {
            GenerateSignalRequest request = request();
            request.setStats(new ArrayList<>(List.of(
                    new KeyStatisticInput("223%", "Day 1 High", true),
                    new KeyStatisticInput("", "Valuation", null),
                    new KeyStatisticInput("46M", " ", null),
                    new KeyStatisticInput("$6.8B", "Valuation", null))));

            SignalRecord signal = mapper.toRecord(request);

            assertThat(signal.getKeyStatistics()).extracting(KeyStatistic::displayValue)
                    .containsExactly("223%", "$6.8B");
            assertThat(signal.getKeyStatistics().get(1).favorable()).isTrue();
        }

        @Test
        @DisplayName("策略缺 description — 不建立")
        void toRecord_incompleteStrategy() {
            GenerateSignalRequest request = request();
            request.setStrategyTitle("Hot IPO Momentum Play");

            assertThat(mapper.toRecord(request).getStrategy()).isEmpty();
        }

        @Test
        @DisplayName("策略完整 — 連結預設值")
        void toRecord_strategy() {
            GenerateSignalRequest request = request();
            request.setStrategyTitle("Hot IPO Momentum Play");
            request.setStrategyDesc("Wait for a dip.");

            StrategyNote strategy = mapper.toRecord(request).getStrategy().orElseThrow();

            assertThat(strategy.getTitle()).isEqualTo("Hot IPO Momentum Play");
            assertThat(strategy.getLinkText()).isEqualTo(StrategyNote.DEFAULT_LINK_TEXT);
        }
    }

    // ==================== 走勢圖 ====================

    @Nested
    @DisplayName("走勢圖")
    class Chart {

        @Test
        @DisplayName("預設 momentum，使用合成器的 eventLabel")
        void toRecord_defaultChart() {
            SignalRecord signal = mapper.toRecord(request());

            verify(synthesizer).synthesize("CRCL", 69.0, "momentum");
            ChartSeries series = signal.getChartSeries().orElseThrow();
            assertThat(series.getEventLabel()).isEqualTo("Signal @ $69.00");
        }

        @Test
        @DisplayName("指定形狀與 eventLabel")
        void toRecord_customChart() {
            GenerateSignalRequest request = request();
            request.setChartPattern("breakout");
            request.setEventLabel("IPO $69 → peak");

            SignalRecord signal = mapper.toRecord(request);

            verify(synthesizer).synthesize("CRCL", 69.0, "breakout");
            assertThat(signal.getChartSeries().orElseThrow().getEventLabel()).isEqualTo("IPO $69 → peak");
        }

        @Test
        @DisplayName("includeChart = false — 不合成")
        void toRecord_noChart() {
            GenerateSignalRequest request = request();
            request.setIncludeChart(false);

            SignalRecord signal = mapper.toRecord(request);

            assertThat(signal.getChartSeries()).isEmpty();
            verifyNoInteractions(synthesizer);
        }
    }

    // ==================== 預覽 ====================

    @Test
    @DisplayName("預覽 — 描述超過 200 字截斷")
    void toPreview_truncates() {
        GenerateSignalRequest request = request();
        request.setStrategyTitle("Long");
        request.setStrategyDesc("x".repeat(250));

        SignalPreviewResponse preview = mapper.toPreview(mapper.toRecord(request));

        assertThat(preview.getTicker()).isEqualTo("CRCL");
        assertThat(preview.getSignalType()).isEqualTo("IPO_DEBUT");
        assertThat(preview.getStrategy().getDescription()).hasSize(203).endsWith("...");
    }

    @Test
    @DisplayName("預覽 — 短描述不變，沒有策略為 null")
    void toPreview_shortOrMissing() {
        assertThat(SignalRequestMapper.truncate("short")).isEqualTo("short");
        assertThat(mapper.toPreview(mapper.toRecord(request())).getStrategy()).isNull();
    }
}
