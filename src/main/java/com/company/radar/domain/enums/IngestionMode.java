package com.company.radar.domain.enums;

public enum IngestionMode {
    BACKFILL,
    INCREMENTAL
}
