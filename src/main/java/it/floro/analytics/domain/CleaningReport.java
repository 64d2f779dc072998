package it.floro.analytics.domain;

import java.util.List;

/**
 * Resoconto delle operazioni applicate dalla pulizia, riportato nei parametri
 * del risultato per rendere l'analisi riproducibile.
 *
 * Le posizioni si riferiscono al dataset validato (ordinato), non alla serie pulita.
 */
public record CleaningReport(
        OutlierPolicy outlierPolicy,
        ImputationPolicy imputationPolicy,
        Double lowerBound,                  // Limite inferiore outlier (null se metodo NONE)
        Double upperBound,                  // Limite superiore outlier (null se metodo NONE)
        int missingCount,                   // Valori mancanti o non finiti in ingresso
        List<Integer> outlierPositions,     // Posizioni marcate come outlier
        List<Integer> imputedPositions,     // Posizioni il cui valore è stato stimato
        int droppedCount                    // Punti rimossi (azione DROP)
) {

    public CleaningReport {
        outlierPositions = List.copyOf(outlierPositions);
        imputedPositions = List.copyOf(imputedPositions);
    }
}
