package com.signalpro.signal.service;

import com.signalpro.chart.model.ChartSeries;
import com.signalpro.chart.service.TrajectorySynthesizer;
import com.signalpro.signal.dto.GenerateSignalRequest;
import com.signalpro.signal.dto.KeyStatisticInput;
import com.signalpro.signal.dto.SignalPreviewResponse;
import com.signalpro.signal.model.BorderVariant;
import com.signalpro.signal.model.KeyStatistic;
import com.signalpro.signal.model.PriorityLevel;
import com.signalpro.signal.model.SignalKind;
import com.signalpro.signal.model.SignalRecord;
import com.signalpro.signal.model.StrategyNote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 表單請求 → SignalRecord
 *
 * 規則：
 * - ticker 轉大寫
 * - 數據只保留 value 與 label 都有填的
 * - 策略要 title 與 description 都有填才建立
 * - 價格變動金額 = 現價 × 百分比 / 100
 * - 走勢圖預設 momentum，eventLabel 有填就覆蓋預設標籤
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SignalRequestMapper {

    static final String DEFAULT_PATTERN = "momentum";
    static final int PREVIEW_DESCRIPTION_LIMIT = 200;

    private final TrajectorySynthesizer trajectorySynthesizer;

    public SignalRecord toRecord(GenerateSignalRequest request) {
        String ticker = request.getTicker().trim().toUpperCase(Locale.ROOT);
        SignalKind kind = SignalKind.fromName(request.getSignalType());
        double price = request.getCurrentPrice();
        double percent = request.getChangePercent();

        SignalRecord.SignalRecordBuilder builder = SignalRecord.builder()
                .ticker(ticker)
                .displayName(request.getCompanyName())
                .kind(kind)
                .currentPrice(price)
                .priceChangeAbsolute(price * (percent / 100))
                .priceChangePercent(percent)
                .priority(PriorityLevel.fromName(request.getPriority()))
                .keyStatistics(toStatistics(request.getStats()))
                .timestampLabel(isBlank(request.getTimestamp()) ? null : request.getTimestamp())
                .notificationsDefaultOn(request.getNotificationsEnabled())
                .riskStyleEnabled(request.isRiskStyle())
                .borderVariant(BorderVariant.fromName(request.getBorderStyle()));

        if (!isBlank(request.getStrategyTitle()) && !isBlank(request.getStrategyDesc())) {
            builder.strategy(StrategyNote.builder()
                    .title(request.getStrategyTitle())
                    .description(request.getStrategyDesc())
                    .linkText(request.getStrategyLinkText())
                    .linkUrl(request.getStrategyLinkUrl())
                    .build());
        }

        if (request.isIncludeChart()) {
            String pattern = isBlank(request.getChartPattern()) ? DEFAULT_PATTERN : request.getChartPattern();
            ChartSeries series = trajectorySynthesizer.synthesize(ticker, price, pattern);
            if (!isBlank(request.getEventLabel())) {
                series = series.withEventLabel(request.getEventLabel());
            }
            builder.chartSeries(series);
        }

        SignalRecord signal = builder.build();
        log.debug("請求轉換完成: {} {} priority={}", ticker, kind, signal.getPriority());
        return signal;
    }

    public SignalPreviewResponse toPreview(SignalRecord signal) {
        return SignalPreviewResponse.builder()
                .ticker(signal.getTicker())
                .companyName(signal.getDisplayName())
                .signalType(signal.getKind().name())
                .priority(signal.getPriority().name())
                .currentPrice(signal.getCurrentPrice())
                .priceChangePercent(signal.getPriceChangePercent())
                .keyStats(signal.getKeyStatistics().stream()
                        .map(s -> new KeyStatisticInput(s.displayValue(), s.label(), s.favorable()))
                        .collect(Collectors.toList()))
                .strategy(signal.getStrategy()
                        .map(s -> SignalPreviewResponse.StrategyPreview.builder()
                                .title(s.getTitle())
                                .description(truncate(s.getDescription()))
                                .build())
                        .orElse(null))
                .timestamp(signal.getTimestampLabel())
                .riskStyle(signal.isRiskStyleEnabled())
                .build();
    }

    private List<KeyStatistic> toStatistics(List<KeyStatisticInput> inputs) {
        if (inputs == null) {
            return List.of();
        }
        return inputs.stream()
                .filter(s -> s != null && !isBlank(s.getValue()) && !isBlank(s.getLabel()))
                .map(s -> new KeyStatistic(s.getValue(), s.getLabel(), s.getFavorable() == null || s.getFavorable()))
                .collect(Collectors.toList());
    }

    static String truncate(String description) {
        if (description.length() <= PREVIEW_DESCRIPTION_LIMIT) {
            return description;
        }
        return description.substring(0, PREVIEW_DESCRIPTION_LIMIT) + "...";
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
