package it.floro.analytics.domain;

public record PipelineWarning(
        WarningCode code,
        String message
) {

    public static PipelineWarning of(WarningCode code, String format, Object... args) {
        return new PipelineWarning(code, String.format(format, args));
    }
}
