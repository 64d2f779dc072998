package it.floro.analytics.domain;

public enum TrendStatus {
    OK,                 // Pendenza e intervallo di confidenza stimati
    NO_INTERVAL,        // Due soli punti: pendenza senza intervallo
    INSUFFICIENT_DATA   // Meno di due punti: pendenza 0
}
