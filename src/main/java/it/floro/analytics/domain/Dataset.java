package it.floro.analytics.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Dataset grezzo fornito dal collector o dallo storage.
 *
 * La pipeline lo legge soltanto: ordinamento e controllo dei duplicati sono
 * compito del validatore, che restituisce una vista ordinata senza toccare
 * la lista originale.
 */
public record Dataset(
        String id,                          // Identità del dataset (chiave di cache lato chiamante)
        String source,                      // Sorgente dei dati (es. "noaa", "simulator")
        String description,                 // Descrizione libera
        List<DataPoint> points              // Misurazioni, attese in ordine temporale
) {

    public Dataset {
        Objects.requireNonNull(id, "id");
        points = (points == null)
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(points));
    }

    public static Dataset of(String id, String source, List<DataPoint> points) {
        return new Dataset(id, source, "", points);
    }

    public int size() {
        return points.size();
    }
}
