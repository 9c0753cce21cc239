package com.signalpro.signal.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 網頁表單送來的訊號資料（POST /api/generate、/api/preview）
 */
@Data
public class GenerateSignalRequest {

    @NotBlank(message = "ticker 不可為空")
    private String ticker;

    @NotBlank(message = "companyName 不可為空")
    private String companyName;

    @NotBlank(message = "signalType 不可為空")
    private String signalType;       // SignalKind 名稱，例如 IPO_DEBUT

    @NotNull(message = "currentPrice 不可為空")
    @Positive(message = "currentPrice 必須大於 0")
    private Double currentPrice;

    @NotNull(message = "changePercent 不可為空")
    private Double changePercent;

    private String priority;         // URGENT / HOT / WATCH / NORMAL，預設 NORMAL

    @Valid
    private List<KeyStatisticInput> stats = new ArrayList<>();

    private String strategyTitle;
    private String strategyDesc;
    private String strategyLinkText;
    private String strategyLinkUrl;

    private boolean includeChart = true;
    private String chartPattern;     // momentum / volatile / breakout / decline，預設 momentum
    private String eventLabel;       // 覆蓋預設的 "Signal @ $xx.xx"

    private String timestamp;
    private Boolean notificationsEnabled;
    private boolean riskStyle;
    private String borderStyle;      // solid / dashed
}
