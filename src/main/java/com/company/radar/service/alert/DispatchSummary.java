package com.company.radar.service.alert;

import lombok.Getter;
import lombok.ToString;

/**
 * Counters of one dispatcher cycle.
 */
@Getter
@ToString
public class DispatchSummary {
    private int alertsProcessed;
    private int alertsClosed;
    private int sent;
    private int suppressed;
    private int failed;
    private int alertErrors;

    void alertProcessed() {
        alertsProcessed++;
    }

    void alertClosed() {
        alertsClosed++;
    }

    void sent() {
        sent++;
    }

    void suppressed() {
        suppressed++;
    }

    void failed() {
        failed++;
    }

    void alertError() {
        alertErrors++;
    }

    int sendAttempts() {
        return sent + failed;
    }
}
