package it.floro.analytics.domain;

public enum FailureKind {
    IMPUTATION,
    MODEL_FIT,
    TIMEOUT,
    INTERNAL
}
