package com.signalpro.shared.handler;

import com.signalpro.shared.dto.ErrorResponse;
import com.signalpro.shared.exception.SignalFileNotFoundException;
import com.signalpro.shared.exception.SignalValidationException;
import com.signalpro.shared.exception.SignalWriteException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全域例外處理
 *
 * - 輸入驗證錯誤 → 400
 * - 找不到頁面 → 404
 * - 寫檔失敗 → 500
 * 一律回傳 {@link ErrorResponse}。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(SignalValidationException.class)
    public ResponseEntity<ErrorResponse> handleSignalValidation(SignalValidationException e) {
        log.warn("訊號資料驗證失敗: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of("訊號資料不完整", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("參數驗證失敗");
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of("參數驗證失敗", message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of("請求格式錯誤", "無法解析 JSON 內容"));
    }

    @ExceptionHandler(SignalFileNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(SignalFileNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of("找不到檔案", e.getMessage()));
    }

    @ExceptionHandler(SignalWriteException.class)
    public ResponseEntity<ErrorResponse> handleWrite(SignalWriteException e) {
        log.error("頁面輸出失敗: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("頁面輸出失敗", e.getMessage()));
    }
}
