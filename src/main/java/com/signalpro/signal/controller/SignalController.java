package com.signalpro.signal.controller;

import com.signalpro.chart.model.ChartPattern;
import com.signalpro.output.dto.GeneratedFileInfo;
import com.signalpro.output.dto.GeneratedPage;
import com.signalpro.output.dto.SignalSummary;
import com.signalpro.output.service.SignalPageWriter;
import com.signalpro.render.service.DocumentCompositor;
import com.signalpro.shared.config.AppConstants;
import com.signalpro.signal.dto.GenerateSignalRequest;
import com.signalpro.signal.dto.GenerateSignalResponse;
import com.signalpro.signal.dto.SignalPreviewResponse;
import com.signalpro.signal.dto.SuiteResponse;
import com.signalpro.signal.model.PriorityLevel;
import com.signalpro.signal.model.SignalKind;
import com.signalpro.signal.model.SignalRecord;
import com.signalpro.signal.service.SignalRequestMapper;
import com.signalpro.signal.service.SignalSuiteService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 訊號頁面 API
 *
 * 給網頁表單用：
 * - GET  /api/types          : 可選的訊號類型 / 優先度 / 走勢形狀
 * - POST /api/preview        : 預覽（不組版、不寫檔）
 * - POST /api/generate       : 產生頁面並寫檔
 * - GET  /api/files          : 已產生的頁面清單
 * - POST /api/suite          : 產生整套範例
 * - GET  /download/{file}    : 下載
 * - GET  /view/{file}        : 直接瀏覽
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class SignalController {

    private final SignalRequestMapper requestMapper;
    private final DocumentCompositor documentCompositor;
    private final SignalPageWriter pageWriter;
    private final SignalSuiteService suiteService;

    /**
     * 訊號類型與優先度
     * GET /api/types
     */
    @GetMapping("/api/types")
    public ResponseEntity<Map<String, Object>> getTypes() {
        List<Map<String, String>> kinds = Arrays.stream(SignalKind.values())
                .map(k -> Map.of("value", k.name(), "label", k.getDisplayName()))
                .collect(Collectors.toList());
        List<Map<String, String>> priorities = Arrays.stream(PriorityLevel.values())
                .map(p -> Map.of("value", p.name(), "label", p.hasBadge() ? p.getLabel() : p.name()))
                .collect(Collectors.toList());
        List<String> patterns = Arrays.stream(ChartPattern.values())
                .map(ChartPattern::getName)
                .collect(Collectors.toList());

        return ResponseEntity.ok(Map.of(
                "signalTypes", kinds,
                "priorities", priorities,
                "chartPatterns", patterns));
    }

    /**
     * 預覽訊號資料
     * POST /api/preview
     */
    @PostMapping("/api/preview")
    public ResponseEntity<Map<String, Object>> preview(@Valid @RequestBody GenerateSignalRequest request) {
        SignalRecord signal = requestMapper.toRecord(request);
        SignalPreviewResponse preview = requestMapper.toPreview(signal);
        return ResponseEntity.ok(Map.of("success", true, "preview", preview));
    }

    /**
     * 產生訊號頁面
     * POST /api/generate
     *
     * 檔名帶時間戳記，同一檔訊號重複產生不會互相覆蓋。
     */
    @PostMapping("/api/generate")
    public ResponseEntity<GenerateSignalResponse> generate(@Valid @RequestBody GenerateSignalRequest request) {
        log.info("收到產生請求: {} - {}", request.getTicker(), request.getSignalType());

        SignalRecord signal = requestMapper.toRecord(request);
        String html = documentCompositor.compose(signal);
        String filename = SignalPageWriter.timestampedFilename(signal, LocalDateTime.now(AppConstants.ZONE_ID));
        GeneratedPage page = pageWriter.write(filename, html);

        return ResponseEntity.ok(GenerateSignalResponse.builder()
                .success(true)
                .filename(page.getFilename())
                .filePath(page.getFilePath())
                .fileSize(page.getFileSize())
                .absolutePath(page.getAbsolutePath())
                .downloadUrl("/download/" + page.getFilename())
                .viewUrl("/view/" + page.getFilename())
                .signalData(SignalSummary.of(signal, page.getFilename()))
                .build());
    }

    /**
     * 已產生的頁面（新的在前）
     * GET /api/files
     */
    @GetMapping("/api/files")
    public ResponseEntity<Map<String, Object>> listFiles() {
        List<GeneratedFileInfo> files = pageWriter.listPages();
        return ResponseEntity.ok(Map.of(
                "success", true,
                "files", files,
                "totalCount", files.size()));
    }

    /**
     * 產生整套範例（每個訊號類型一則）
     * POST /api/suite
     */
    @PostMapping("/api/suite")
    public ResponseEntity<SuiteResponse> generateSuite() {
        return ResponseEntity.ok(suiteService.generateSuite());
    }

    /**
     * 下載頁面
     * GET /download/{filename}
     */
    @GetMapping("/download/{filename}")
    public ResponseEntity<Resource> download(@PathVariable String filename) {
        Resource file = new FileSystemResource(pageWriter.locate(filename));
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(filename, StandardCharsets.UTF_8).build().toString())
                .contentType(MediaType.TEXT_HTML)
                .body(file);
    }

    /**
     * 直接瀏覽頁面
     * GET /view/{filename}
     */
    @GetMapping("/view/{filename}")
    public ResponseEntity<String> view(@PathVariable String filename) {
        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.TEXT_HTML, StandardCharsets.UTF_8))
                .body(pageWriter.read(filename));
    }
}
