package it.floro.analytics.simulator;

import it.floro.analytics.domain.DataPoint;
import it.floro.analytics.domain.Dataset;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Simulatore di serie climatiche giornaliere con variabilità stagionale e stocastica.
 *
 * Responsabilità:
 * - Generazione di un Dataset su un intervallo di giorni definito
 * - Ciclo annuale sinusoidale attorno a un valore base
 * - Trend lineare di lungo periodo (es. riscaldamento per decennio)
 * - Anomalie autocorrelate con processo AR(1)
 * - Valori mancanti casuali e picchi isolati, per esercitare la pulizia
 *
 * Architettura:
 * - Seed fisso (per reproducibilità) + Random internalizzato
 * - Ogni punto porta nei metadati stazione e unità di misura
 * - Stesso seed e stessa configurazione producono sempre lo stesso dataset
 */
public class ClimateSeriesSimulator {

    /**
     * Generatore di numeri casuali con seed fisso per reproducibilità.
     */
    private final Random rnd;
    /**
     * Data di inizio della simulazione (mezzanotte UTC).
     */
    private final LocalDate start;
    /**
     * Numero di giorni da simulare.
     */
    private final int days;

    // ========================================================================
    // PARAMETRI DEL SEGNALE
    // ========================================================================

    private double base = 14.0;             // Valore medio annuo (es. °C)
    private double seasonalAmplitude = 9.0; // Ampiezza del ciclo annuale
    private int peakShift = 100;            // Traslazione di fase del ciclo (giorni)
    private double trendPerYear = 0.0;      // Variazione lineare per anno
    private double noiseStd = 1.2;          // Deviazione del rumore AR(1)
    private double autocorrelation = 0.6;   // Coefficiente AR(1) in [0, 1)

    // ========================================================================
    // DISTURBI
    // ========================================================================

    private double missingRate = 0.0;       // Probabilità di valore mancante per giorno
    private double spikeRate = 0.0;         // Probabilità di picco per giorno
    private double spikeMagnitude = 15.0;   // Ampiezza assoluta del picco

    private String station = "ST01";
    private String unit = "°C";

    /**
     * @param seed Seed per il generatore Random (stesso seed = stessi dati)
     * @param start Data di inizio della simulazione
     * @param days Numero di giorni da simulare
     */
    public ClimateSeriesSimulator(long seed, LocalDate start, int days) {
        this.rnd = new Random(seed);
        this.start = start;
        this.days = days;
    }

    public ClimateSeriesSimulator withSeasonality(double base, double amplitude, int peakShift) {
        this.base = base;
        this.seasonalAmplitude = amplitude;
        this.peakShift = peakShift;
        return this;
    }

    public ClimateSeriesSimulator withTrendPerYear(double trendPerYear) {
        this.trendPerYear = trendPerYear;
        return this;
    }

    public ClimateSeriesSimulator withNoise(double std, double autocorrelation) {
        this.noiseStd = std;
        this.autocorrelation = clamp(autocorrelation, 0.0, 0.99);
        return this;
    }

    public ClimateSeriesSimulator withMissingRate(double missingRate) {
        this.missingRate = clamp(missingRate, 0.0, 1.0);
        return this;
    }

    public ClimateSeriesSimulator withSpikes(double rate, double magnitude) {
        this.spikeRate = clamp(rate, 0.0, 1.0);
        this.spikeMagnitude = magnitude;
        return this;
    }

    public ClimateSeriesSimulator withStation(String station, String unit) {
        this.station = station;
        this.unit = unit;
        return this;
    }

    // ========================================================================
    // METODI UTILITY PRIVATI - MATH BASICS
    // ========================================================================

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    /**
     * Valore sinusoidale con periodo annuale.
     *
     * Formula: base + amp * sin(2π * (day - dayShift) / 365)
     */
    private static double sinYear(int dayShift, int day, double amp, double base) {
        return base + amp * Math.sin(2 * Math.PI * (day - dayShift) / 365.0);
    }

    /**
     * Numero casuale ~ N(mean, std²) con il metodo di Box-Muller.
     */
    private double gauss(double mean, double std) {
        double u1 = Math.max(1e-9, rnd.nextDouble());  // Evita log(0)
        double u2 = Math.max(1e-9, rnd.nextDouble());
        double z0 = Math.sqrt(-2.0 * Math.log(u1)) * Math.cos(2 * Math.PI * u2);
        return mean + std * z0;
    }

    // ========================================================================
    // GENERAZIONE
    // ========================================================================

    /**
     * Genera il dataset giornaliero.
     *
     * Per ogni giorno d:
     * 1. Stagionalità: sinYear sul giorno dell'anno
     * 2. Trend: trendPerYear * d / 365
     * 3. Anomalia AR(1): a_d = phi * a_{d-1} + N(0, noiseStd² (1 - phi²))
     * 4. Con probabilità spikeRate si somma ±spikeMagnitude
     * 5. Con probabilità missingRate il valore è mancante
     *
     * @param id Identificativo del dataset
     * @return Dataset con un punto per giorno, in ordine temporale
     */
    public Dataset generate(String id) {
        List<DataPoint> points = new ArrayList<>(days);
        double anomaly = 0.0;
        double innovationStd = noiseStd * Math.sqrt(1.0 - autocorrelation * autocorrelation);

        for (int d = 0; d < days; d++) {
            LocalDate date = start.plusDays(d);
            Instant ts = date.atStartOfDay(ZoneOffset.UTC).toInstant();

            anomaly = autocorrelation * anomaly + gauss(0.0, innovationStd);
            double value = sinYear(peakShift, date.getDayOfYear() - 1, seasonalAmplitude, base)
                    + trendPerYear * d / 365.0
                    + anomaly;

            if (rnd.nextDouble() < spikeRate) {
                value += rnd.nextBoolean() ? spikeMagnitude : -spikeMagnitude;
            }

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("station", station);
            metadata.put("unit", unit);

            boolean missing = rnd.nextDouble() < missingRate;
            points.add(new DataPoint(ts, missing ? null : value, metadata));
        }

        return new Dataset(id, "simulator",
                String.format("Serie giornaliera simulata (%d giorni da %s)", days, start), points);
    }
}
