package com.health.anomaly.model;

public enum AcknowledgementResult {
    /** The anomaly moved from NEW to ACKNOWLEDGED in this call. */
    ACKNOWLEDGED,
    /** The anomaly was already acknowledged; nothing changed. */
    ALREADY_ACKNOWLEDGED,
    NOT_FOUND;

    public boolean isSuccess() {
        return this != NOT_FOUND;
    }
}
