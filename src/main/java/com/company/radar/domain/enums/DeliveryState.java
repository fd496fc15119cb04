package com.company.radar.domain.enums;

public enum DeliveryState {
    UNSENT("Awaiting a send attempt"),
    SENT("Accepted by the email provider"),
    SUPPRESSED("Skipped, recipient inside cooldown");

    private final String description;

    DeliveryState(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Sent and suppressed deliveries count toward closing the alert.
     */
    public boolean isResolved() {
        return this == SENT || this == SUPPRESSED;
    }

    public String toDbValue() {
        return name().toLowerCase();
    }

    public static DeliveryState fromDbValue(String value) {
        if (value == null) {
            return UNSENT;
        }
        return DeliveryState.valueOf(value.toUpperCase());
    }
}
