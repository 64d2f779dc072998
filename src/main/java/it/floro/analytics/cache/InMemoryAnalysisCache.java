package it.floro.analytics.cache;

import it.floro.analytics.config.AnalyticsProperties;
import it.floro.analytics.domain.AnalysisResult;
import it.floro.analytics.exception.AnalyticsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Cache in memoria con calcolo singolo per chiave.
 *
 * Il primo chiamante registra un future e calcola nel proprio thread; gli altri
 * attendono lo stesso future. In caso di errore la voce viene rimossa e l'eccezione
 * propagata a tutti i chiamanti in attesa.
 *
 * Al massimo {@code analytics.cache.max-entries} risultati completati restano in memoria:
 * oltre il limite viene rimosso il più vecchio. Le voci ancora in calcolo non vengono
 * mai rimosse.
 */
@Component
public class InMemoryAnalysisCache implements AnalysisCache {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryAnalysisCache.class);

    private final ConcurrentMap<AnalysisKey, CompletableFuture<AnalysisResult>> entries = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<Completed> completed = new ConcurrentLinkedQueue<>();
    private final int maxEntries;

    public InMemoryAnalysisCache(AnalyticsProperties properties) {
        this.maxEntries = properties.getCache().getMaxEntries();
        if (maxEntries < 1) {
            throw new IllegalArgumentException("analytics.cache.max-entries deve essere >= 1: " + maxEntries);
        }
    }

    @Override
    public AnalysisResult getOrCompute(AnalysisKey key, Supplier<AnalysisResult> computation) {
        CompletableFuture<AnalysisResult> mine = new CompletableFuture<>();
        CompletableFuture<AnalysisResult> existing = entries.putIfAbsent(key, mine);
        if (existing != null) {
            logger.debug("Risultato in cache (o in calcolo) per {}", key);
            return join(existing);
        }
        try {
            AnalysisResult result = computation.get();
            mine.complete(result);
            completed.add(new Completed(key, mine));
            evictOverflow();
            return result;
        } catch (RuntimeException | Error e) {
            entries.remove(key, mine);
            mine.completeExceptionally(e);
            throw e;
        }
    }

    @Override
    public void invalidate(AnalysisKey key) {
        CompletableFuture<AnalysisResult> removed = entries.remove(key);
        if (removed != null) {
            completed.removeIf(c -> c.future() == removed);
        }
    }

    @Override
    public int size() {
        return (int) entries.values().stream().filter(f -> f.isDone() && !f.isCompletedExceptionally()).count();
    }

    private void evictOverflow() {
        while (completed.size() > maxEntries) {
            Completed oldest = completed.poll();
            if (oldest == null) {
                return;
            }
            // Rimuove solo se la voce non è già stata sostituita da un nuovo calcolo
            if (entries.remove(oldest.key(), oldest.future())) {
                logger.debug("Rimosso dalla cache il risultato più vecchio: {}", oldest.key());
            }
        }
    }

    private static AnalysisResult join(CompletableFuture<AnalysisResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalyticsException("Attesa del risultato interrotta", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new AnalyticsException("Calcolo del risultato fallito", e.getCause());
        }
    }

    private record Completed(AnalysisKey key, CompletableFuture<AnalysisResult> future) {
    }
}
