package com.signalpro.output.dto;

import com.signalpro.signal.model.SignalRecord;
import lombok.Builder;
import lombok.Data;

/**
 * 機器可讀的訊號摘要
 *
 * 直接從 SignalRecord 取值，不需要重新組版。
 */
@Data
@Builder
public class SignalSummary {

    private String ticker;
    private String signalType;
    private String priority;
    private double price;
    private double changePercent;
    private String timestamp;
    private String filename;

    public static SignalSummary of(SignalRecord signal, String filename) {
        return SignalSummary.builder()
                .ticker(signal.getTicker())
                .signalType(signal.getKind().name())
                .priority(signal.getPriority().name())
                .price(signal.getCurrentPrice())
                .changePercent(signal.getPriceChangePercent())
                .timestamp(signal.getTimestampLabel())
                .filename(filename)
                .build();
    }
}
