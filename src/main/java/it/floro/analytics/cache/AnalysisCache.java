package it.floro.analytics.cache;

import it.floro.analytics.domain.AnalysisResult;

import java.util.function.Supplier;

/**
 * Cache dei risultati, iniettata dal chiamante: la pipeline non ne possiede mai una.
 */
public interface AnalysisCache {

    /**
     * Restituisce il risultato in cache o lo calcola. Per ogni chiave al massimo un
     * calcolo è in corso; i chiamanti concorrenti attendono lo stesso esito.
     * Un calcolo fallito non viene memorizzato.
     */
    AnalysisResult getOrCompute(AnalysisKey key, Supplier<AnalysisResult> computation);

    void invalidate(AnalysisKey key);

    int size();
}
