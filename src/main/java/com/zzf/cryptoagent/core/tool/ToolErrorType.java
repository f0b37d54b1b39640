package com.zzf.cryptoagent.core.tool;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ToolErrorType {
    VALIDATION_ERROR("validation_error"),
    EXCHANGE_ERROR("exchange_error"),
    INSUFFICIENT_BALANCE("insufficient_balance"),
    RATE_LIMIT_EXCEEDED("rate_limit_exceeded"),
    TOOL_ERROR("tool_error");

    private final String wireName;

    ToolErrorType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
