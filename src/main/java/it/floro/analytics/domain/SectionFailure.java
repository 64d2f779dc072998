package it.floro.analytics.domain;

public record SectionFailure(
        FailureKind kind,
        String message
) {
}
