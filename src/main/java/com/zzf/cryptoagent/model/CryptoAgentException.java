package com.zzf.cryptoagent.model;

public class CryptoAgentException extends RuntimeException {
    private final String errorCode;

    public CryptoAgentException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
