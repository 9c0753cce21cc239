package com.signalpro.shared.handler;

import com.signalpro.shared.dto.ErrorResponse;
import com.signalpro.shared.exception.SignalFileNotFoundException;
import com.signalpro.shared.exception.SignalValidationException;
import com.signalpro.shared.exception.SignalWriteException;
import org.junit.jupiter.api.*;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * GlobalExceptionHandler 單元測試
 */
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("訊號資料驗證失敗 — 400 並帶原始訊息")
    void signalValidation() {
        ResponseEntity<ErrorResponse> response =
                handler.handleSignalValidation(new SignalValidationException("缺少必要欄位: ticker"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getError()).isEqualTo("訊號資料不完整");
        assertThat(response.getBody().getMessage()).isEqualTo("缺少必要欄位: ticker");
    }

    @Test
    @DisplayName("@Valid 失敗 — 400，欄位錯誤以分號串接")
    void beanValidation() {
        BeanPropertyBindingResult bindingResult = new BeanPropertyBindingResult(new Object(), "request");
        bindingResult.addError(new FieldError("request", "ticker", "ticker 不可為空"));
        bindingResult.addError(new FieldError("request", "currentPrice", "currentPrice 必須大於 0"));
        MethodArgumentNotValidException e =
                new MethodArgumentNotValidException(mock(MethodParameter.class), bindingResult);

        ResponseEntity<ErrorResponse> response = handler.handleValidation(e);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getMessage())
                .isEqualTo("ticker: ticker 不可為空; currentPrice: currentPrice 必須大於 0");
    }

    @Test
    @DisplayName("找不到檔案 — 404")
    void notFound() {
        ResponseEntity<ErrorResponse> response =
                handler.handleNotFound(new SignalFileNotFoundException("missing.html"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().getError()).isEqualTo("找不到檔案");
        assertThat(response.getBody().getMessage()).contains("missing.html");
    }

    @Test
    @DisplayName("寫檔失敗 — 500")
    void writeFailure() {
        ResponseEntity<ErrorResponse> response = handler.handleWrite(
                new SignalWriteException("頁面寫入失敗: A.html", new IOException("disk full")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getError()).isEqualTo("頁面輸出失敗");
    }
}
