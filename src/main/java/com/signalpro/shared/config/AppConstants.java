package com.signalpro.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

/**
 * 全域應用常數
 *
 * 啟動時從 application.yml 讀取 app.timezone，
 * 寫入 static 欄位，讓檔名時間戳記等靜態 context 使用同一個時區。
 *
 * 使用方式：{@code LocalDateTime.now(AppConstants.ZONE_ID)}
 */
@Component
public class AppConstants {

    /** 應用時區（美股交易時段以紐約時間為準） */
    public static ZoneId ZONE_ID = ZoneId.of("America/New_York");

    @Value("${app.timezone:America/New_York}")
    public void setTimezone(String tz) {
        ZONE_ID = ZoneId.of(tz);
    }
}
