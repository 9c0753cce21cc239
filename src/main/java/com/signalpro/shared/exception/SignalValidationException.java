package com.signalpro.shared.exception;

/**
 * 輸入驗證錯誤
 *
 * 缺少必要欄位、未知的列舉名稱、非正數價格等，
 * 在產生任何輸出之前就直接丟回呼叫端，不重試。
 */
public class SignalValidationException extends RuntimeException {

    public SignalValidationException(String message) {
        super(message);
    }
}
