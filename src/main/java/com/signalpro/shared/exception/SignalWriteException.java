package com.signalpro.shared.exception;

/**
 * 頁面寫入失敗（目錄建立 / 檔案寫入 / 讀取）
 */
public class SignalWriteException extends RuntimeException {

    public SignalWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
