package com.company.radar.domain.enums;

public enum AlertType {
    IMPRESSION_DROP("impression_drop");

    private final String code;

    AlertType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static AlertType fromCode(String code) {
        for (AlertType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown alert type: " + code);
    }
}
