package it.floro.analytics.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Configurazione dei collaboratori condivisi della pipeline.
 *
 * Espone:
 * - l'executor su cui girano i fold della cross-validation
 * - il clock usato per marcare la creazione dei risultati
 */
@Configuration
@EnableConfigurationProperties(AnalyticsProperties.class)
public class AnalyticsConfig {

    private static final Logger logger = LoggerFactory.getLogger(AnalyticsConfig.class);

    @Bean(destroyMethod = "shutdown")
    public ExecutorService foldExecutor(AnalyticsProperties properties) {
        int threads = Math.max(1, properties.getEvaluation().getParallelism());
        logger.info("Executor dei fold inizializzato con {} thread", threads);
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "fold-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
