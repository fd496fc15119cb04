package com.company.radar.domain.enums;

/**
 * The three upstream metric sources and the table each one is stored in.
 */
public enum MetricSource {
    SITE("property_daily_metrics", null, "date"),
    PAGE("page_daily_metrics", "page_url", "page"),
    DEVICE("device_daily_metrics", "device", "device");

    private final String table;
    private final String keyColumn;
    private final String upstreamDimension;

    MetricSource(String table, String keyColumn, String upstreamDimension) {
        this.table = table;
        this.keyColumn = keyColumn;
        this.upstreamDimension = upstreamDimension;
    }

    public String getTable() {
        return table;
    }

    /**
     * Column holding the dimension key, null for the site aggregate.
     */
    public String getKeyColumn() {
        return keyColumn;
    }

    public String getUpstreamDimension() {
        return upstreamDimension;
    }

    public boolean isKeyed() {
        return keyColumn != null;
    }
}
