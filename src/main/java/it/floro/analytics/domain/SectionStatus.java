package it.floro.analytics.domain;

public enum SectionStatus {
    COMPLETED,
    FAILED,
    NOT_REQUESTED
}
