package com.company.radar.domain.enums;

public enum ChangeClass {
    NEW,
    LOST,
    GAIN,
    DROP
}
