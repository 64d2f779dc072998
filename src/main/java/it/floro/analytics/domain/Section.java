package it.floro.analytics.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * Sezione del risultato di un'analisi. Sempre presente: completata con i dati,
 * fallita con il motivo, oppure non richiesta dal tipo di analisi.
 *
 * @param <T> Tipo dei dati della sezione
 */
public record Section<T>(
        SectionStatus status,
        T data,
        SectionFailure failure
) {

    public Section {
        Objects.requireNonNull(status, "status");
    }

    public static <T> Section<T> completed(T data) {
        return new Section<>(SectionStatus.COMPLETED, Objects.requireNonNull(data, "data"), null);
    }

    public static <T> Section<T> failed(FailureKind kind, String message) {
        return new Section<>(SectionStatus.FAILED, null, new SectionFailure(kind, message));
    }

    public static <T> Section<T> notRequested() {
        return new Section<>(SectionStatus.NOT_REQUESTED, null, null);
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == SectionStatus.COMPLETED;
    }
}
