package com.signalpro.output.dto;

import lombok.Builder;
import lombok.Data;

/**
 * 單一頁面的寫入結果
 */
@Data
@Builder
public class GeneratedPage {

    private String filename;
    private String filePath;       // 相對於工作目錄
    private String absolutePath;
    private long fileSize;         // bytes
}
