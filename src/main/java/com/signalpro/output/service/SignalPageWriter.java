package com.signalpro.output.service;

import com.signalpro.output.config.OutputConfig;
import com.signalpro.output.dto.GeneratedFileInfo;
import com.signalpro.output.dto.GeneratedPage;
import com.signalpro.shared.config.AppConstants;
import com.signalpro.shared.exception.SignalFileNotFoundException;
import com.signalpro.shared.exception.SignalWriteException;
import com.signalpro.signal.model.SignalRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 訊號頁面的檔案輸出
 *
 * 負責：檔名、建立目錄、寫檔、列出 / 讀取已產生的頁面。
 *
 * 寫入是 all-or-nothing：先寫暫存檔再 atomic move，
 * 失敗時刪掉暫存檔，目標檔不會留下半截內容。
 * 同一路徑的並行寫入由 {@link DestinationLockRegistry} 排隊。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalPageWriter {

    private static final DateTimeFormatter STAMP_FMT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final Pattern SAFE_FILENAME = Pattern.compile("[A-Za-z0-9._-]+\\.html");

    private final OutputConfig outputConfig;
    private final DestinationLockRegistry lockRegistry;

    /** 預設檔名：TICKER_kind.html */
    public static String defaultFilename(SignalRecord signal) {
        return safeTicker(signal.getTicker()) + "_" + signal.getKind().slug() + ".html";
    }

    /** 帶時間戳記的檔名：TICKER_kind_yyyyMMdd_HHmmss.html，API 用來避免覆蓋 */
    public static String timestampedFilename(SignalRecord signal, LocalDateTime time) {
        return safeTicker(signal.getTicker()) + "_" + signal.getKind().slug() + "_" + time.format(STAMP_FMT) + ".html";
    }

    public GeneratedPage write(String filename, String html) {
        return write(outputConfig.getDirectory(), filename, html);
    }

    /**
     * 寫入頁面
     *
     * @throws SignalWriteException 目錄建立或寫檔失敗
     */
    public GeneratedPage write(Path directory, String filename, String html) {
        Path target = resolve(directory, filename);
        byte[] bytes = html.getBytes(StandardCharsets.UTF_8);

        lockRegistry.acquire(target);
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, ".signal-", ".tmp");
            try {
                Files.write(temp, bytes);
                moveIntoPlace(temp, target);
            } catch (IOException e) {
                deleteQuietly(temp);
                throw e;
            }
        } catch (IOException e) {
            log.error("頁面寫入失敗: {} - {}", target, e.getMessage());
            throw new SignalWriteException("頁面寫入失敗: " + filename, e);
        } finally {
            lockRegistry.release(target);
        }

        log.info("已產生頁面: {} ({} bytes)", target, bytes.length);
        return GeneratedPage.builder()
                .filename(filename)
                .filePath(target.toString())
                .absolutePath(target.toAbsolutePath().toString())
                .fileSize(bytes.length)
                .build();
    }

    /**
     * 列出輸出目錄下的 .html，新的在前；目錄不存在時回傳空清單
     */
    public List<GeneratedFileInfo> listPages() {
        Path directory = outputConfig.getDirectory();
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(".html"))
                    .filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(SignalPageWriter::lastModified).reversed())
                    .map(this::toFileInfo)
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new SignalWriteException("無法列出輸出目錄: " + directory, e);
        }
    }

    /**
     * 取得已存在的頁面路徑
     *
     * @throws SignalFileNotFoundException 檔名不合法、跳出輸出目錄或檔案不存在
     */
    public Path locate(String filename) {
        Path target;
        try {
            target = resolve(outputConfig.getDirectory(), filename);
        } catch (IllegalArgumentException e) {
            log.warn("拒絕不合法的檔名: {}", filename);
            throw new SignalFileNotFoundException(filename);
        }
        if (!Files.isRegularFile(target)) {
            throw new SignalFileNotFoundException(filename);
        }
        return target;
    }

    public String read(String filename) {
        Path target = locate(filename);
        try {
            return Files.readString(target, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SignalWriteException("頁面讀取失敗: " + filename, e);
        }
    }

    // ==================== 內部 ====================

    private static Path resolve(Path directory, String filename) {
        if (filename == null || !SAFE_FILENAME.matcher(filename).matches()) {
            throw new IllegalArgumentException("不合法的檔名: " + filename);
        }
        Path base = directory.toAbsolutePath().normalize();
        Path target = base.resolve(filename).normalize();
        if (!base.equals(target.getParent())) {
            throw new IllegalArgumentException("檔名跳出輸出目錄: " + filename);
        }
        return directory.resolve(filename);
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("暫存檔刪除失敗: {} - {}", temp, e.getMessage());
        }
    }

    private static String safeTicker(String ticker) {
        return ticker.trim().replaceAll("[^A-Za-z0-9.-]", "_");
    }

    private static long lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private GeneratedFileInfo toFileInfo(Path path) {
        String filename = path.getFileName().toString();
        long size;
        try {
            size = Files.size(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        LocalDateTime created = LocalDateTime.ofInstant(
                Instant.ofEpochMilli(lastModified(path)), AppConstants.ZONE_ID);
        return GeneratedFileInfo.builder()
                .filename(filename)
                .size(size)
                .created(created.toString())
                .downloadUrl("/download/" + filename)
                .viewUrl("/view/" + filename)
                .build();
    }
}
