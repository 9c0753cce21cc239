package com.signalpro.render.service;

import lombok.Getter;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * 頁面中固定不變的 CSS / JS（classpath: payload/）
 *
 * 啟動時讀一次，之後每次渲染原樣嵌入。
 */
@Getter
@Component
public class StaticPayloads {

    static final String STYLE_SHEET = "payload/signal-page.css";
    static final String CLIENT_SCRIPT = "payload/signal-page.js";

    private final String styleSheet;
    private final String clientScript;

    public StaticPayloads() {
        this.styleSheet = read(STYLE_SHEET);
        this.clientScript = read(CLIENT_SCRIPT);
    }

    private static String read(String path) {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("無法讀取靜態資源: " + path, e);
        }
    }
}
