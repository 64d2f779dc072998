package it.floro.analytics.domain;

/**
 * Codici degli avvisi allegati al risultato di un'analisi.
 */
public enum WarningCode {
    UNKNOWN_PARAMETER,          // Chiave di parametro non riconosciuta (ignorata)
    CONSTANT_SERIES,            // Serie costante in normalizzazione
    OUTLIERS_DETECTED,          // Outlier marcati o rimossi dalla pulizia
    VALUES_IMPUTED,             // Valori mancanti o outlier sostituiti
    DROPPED_CONSTANT_FEATURE,   // Feature a varianza nulla scartata
    DROPPED_CORRELATED_FEATURE, // Feature scartata per multicollinearità
    MODEL_FIT_FAILED,           // Addestramento di un fold o del modello finale fallito
    SECTION_FAILED              // Sezione richiesta non calcolabile
}
