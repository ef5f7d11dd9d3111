package com.health.anomaly.model;

public enum Severity {
    INFO,
    WARNING,
    ALERT
}
