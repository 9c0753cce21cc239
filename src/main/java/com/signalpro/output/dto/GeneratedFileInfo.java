package com.signalpro.output.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class GeneratedFileInfo {

    private String filename;
    private long size;
    private String created;        // ISO-8601，應用時區
    private String downloadUrl;
    private String viewUrl;
}
