package com.imageanalysis.shared.model;

public enum OrchestrationStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
