package com.signalpro.shared.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 訊號頁面 API 的錯誤回應
 *
 * 產生表單只看 error 決定要標紅哪一區（訊號資料 / 參數 / 檔案），
 * message 原樣顯示在表單下方，例如「缺少必要欄位: ticker, kind」。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    /** 分類標題，例如「訊號資料不完整」「找不到檔案」 */
    private String error;

    /** 給使用者看的細節 */
    private String message;

    public static ErrorResponse of(String error, String message) {
        return ErrorResponse.builder().error(error).message(message).build();
    }
}
