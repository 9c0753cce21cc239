package com.signalpro.signal.dto;

import com.signalpro.output.dto.GeneratedPage;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class SuiteResponse {

    private int generatedCount;
    private long totalSize;
    private String outputDirectory;
    private List<GeneratedPage> pages;
}
