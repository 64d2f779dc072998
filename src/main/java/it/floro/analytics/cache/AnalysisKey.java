package it.floro.analytics.cache;

import it.floro.analytics.domain.AnalysisRequest;

import java.util.Map;
import java.util.TreeMap;

/**
 * Chiave di cache: stesso dataset, stesso tipo e stessi parametri producono lo stesso risultato.
 *
 * I parametri sono copiati in una mappa ordinata, quindi l'ordine delle chiavi
 * nella richiesta non conta.
 */
public record AnalysisKey(
        String datasetId,
        String type,
        Map<String, Object> parameters
) {

    public AnalysisKey {
        type = type == null ? "" : type.trim().toLowerCase();
        parameters = parameters == null ? Map.of() : new TreeMap<>(parameters);
    }

    public static AnalysisKey of(String datasetId, AnalysisRequest request) {
        return new AnalysisKey(datasetId, request.type(), request.parameters());
    }
}
