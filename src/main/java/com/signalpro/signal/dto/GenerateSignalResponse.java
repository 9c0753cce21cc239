package com.signalpro.signal.dto;

import com.signalpro.output.dto.SignalSummary;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class GenerateSignalResponse {

    private boolean success;
    private String filename;
    private String filePath;
    private long fileSize;
    private String absolutePath;
    private String downloadUrl;
    private String viewUrl;
    private SignalSummary signalData;
}
