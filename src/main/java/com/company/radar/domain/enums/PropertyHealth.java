package com.company.radar.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PropertyHealth {
    CRITICAL("critical"),
    WARNING("warning"),
    HEALTHY("healthy"),
    INSUFFICIENT_DATA("insufficient_data");

    private final String code;

    PropertyHealth(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
