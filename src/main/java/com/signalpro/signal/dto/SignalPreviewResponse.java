package com.signalpro.signal.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * 預覽結果（不組版、不寫檔）
 */
@Data
@Builder
public class SignalPreviewResponse {

    private String ticker;
    private String companyName;
    private String signalType;
    private String priority;
    private double currentPrice;
    private double priceChangePercent;
    private List<KeyStatisticInput> keyStats;
    private StrategyPreview strategy;     // 沒有策略時為 null
    private String timestamp;
    private boolean riskStyle;

    @Data
    @Builder
    public static class StrategyPreview {
        private String title;
        private String description;       // 超過 200 字截斷
    }
}
