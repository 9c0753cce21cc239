package com.signalpro.shared.exception;

public class SignalFileNotFoundException extends RuntimeException {

    public SignalFileNotFoundException(String filename) {
        super("找不到檔案: " + filename);
    }
}
