package com.signalpro.output.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;

/**
 * 輸出目錄設定（signal.output.*）
 */
@Getter
@ConfigurationProperties(prefix = "signal.output")
public class OutputConfig {

    /** 單次 API 產生的頁面 */
    private final Path directory;

    /** 範例套組的頁面 */
    private final Path suiteDirectory;

    public OutputConfig(
            @DefaultValue("web_generated") Path directory,
            @DefaultValue("complete_signals") Path suiteDirectory
    ) {
        this.directory = directory;
        this.suiteDirectory = suiteDirectory;
    }
}
