package it.floro.analytics.service;

import it.floro.analytics.domain.DataPoint;
import it.floro.analytics.domain.Dataset;
import it.floro.analytics.domain.ValidatedDataset;
import it.floro.analytics.domain.ValidationRequirements;
import it.floro.analytics.exception.DuplicateTimestampException;
import it.floro.analytics.exception.InsufficientDataException;
import it.floro.analytics.exception.InvalidDataPointException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Primo passo della pipeline: verifica che il dataset sia analizzabile.
 *
 * Responsabilità:
 * - Rifiuto di punti nulli, timestamp nulli e metadati non scalari
 * - Verifica del numero minimo di punti
 * - Ordinamento per timestamp in una nuova lista (il dataset non viene modificato)
 * - Rifiuto dei timestamp duplicati (mai uniti)
 */
@Service
public class DatasetValidator {

    private static final Logger logger = LoggerFactory.getLogger(DatasetValidator.class);

    /**
     * Valida il dataset rispetto ai requisiti.
     *
     * @param dataset Dataset grezzo
     * @param requirements Requisiti minimi
     * @return Vista ordinata e verificata del dataset
     * @throws InsufficientDataException se i punti sono meno di {@code minPoints}
     * @throws DuplicateTimestampException se due punti condividono il timestamp
     * @throws InvalidDataPointException se un punto è malformato
     */
    public ValidatedDataset validate(Dataset dataset, ValidationRequirements requirements) {
        List<DataPoint> points = dataset.points();

        for (int i = 0; i < points.size(); i++) {
            checkPoint(points.get(i), i);
        }

        if (points.size() < requirements.minPoints()) {
            throw new InsufficientDataException(points.size(), requirements.minPoints());
        }

        List<DataPoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparing(DataPoint::timestamp));

        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).timestamp().equals(sorted.get(i - 1).timestamp())) {
                throw new DuplicateTimestampException(sorted.get(i).timestamp());
            }
        }

        ValidatedDataset validated = new ValidatedDataset(dataset, sorted, requirements);
        logger.debug("Dataset '{}' validato: {} punti, {} mancanti",
                dataset.id(), validated.size(), validated.missingCount());
        return validated;
    }

    private static void checkPoint(DataPoint p, int index) {
        if (p == null) {
            throw new InvalidDataPointException("Punto nullo in posizione " + index);
        }
        if (p.timestamp() == null) {
            throw new InvalidDataPointException("Timestamp mancante in posizione " + index);
        }
        for (Map.Entry<String, Object> e : p.metadata().entrySet()) {
            if (!isScalar(e.getValue())) {
                throw new InvalidDataPointException(String.format(
                        "Metadato '%s' non scalare in posizione %d", e.getKey(), index));
            }
        }
    }

    private static boolean isScalar(Object v) {
        return v instanceof String || v instanceof Number || v instanceof Boolean;
    }
}
