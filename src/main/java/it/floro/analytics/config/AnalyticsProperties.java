package it.floro.analytics.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Valori di default della pipeline, letti da {@code application.yml} sotto il prefisso
 * {@code analytics}. I parametri della singola richiesta hanno la precedenza.
 *
 * Sezioni:
 * - validation: requisiti minimi del dataset
 * - cleaning: outlier e imputazione
 * - normalization: metodo di normalizzazione
 * - features: finestre mobili, lag, soglia di correlazione
 * - evaluation: fold, modelli, budget di tempo, parallelismo
 * - anomaly / trend: parametri dei rilevatori
 * - cache: numero massimo di risultati mantenuti in memoria
 */
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    private final Validation validation = new Validation();
    private final Cleaning cleaning = new Cleaning();
    private final Normalization normalization = new Normalization();
    private final Features features = new Features();
    private final Evaluation evaluation = new Evaluation();
    private final Anomaly anomaly = new Anomaly();
    private final Trend trend = new Trend();
    private final Cache cache = new Cache();

    public Validation getValidation() {
        return validation;
    }

    public Cleaning getCleaning() {
        return cleaning;
    }

    public Normalization getNormalization() {
        return normalization;
    }

    public Features getFeatures() {
        return features;
    }

    public Evaluation getEvaluation() {
        return evaluation;
    }

    public Anomaly getAnomaly() {
        return anomaly;
    }

    public Trend getTrend() {
        return trend;
    }

    public Cache getCache() {
        return cache;
    }

    // ========================================================================
    // SEZIONI
    // ========================================================================

    public static class Validation {
        private int minPoints = 3;

        public int getMinPoints() {
            return minPoints;
        }

        public void setMinPoints(int minPoints) {
            this.minPoints = minPoints;
        }
    }

    public static class Cleaning {
        private String outlierMethod = "iqr";
        private String outlierAction = "impute";
        private double iqrK = 1.5;
        private double zscoreThreshold = 3.0;
        private String imputationPolicy = "linear-interpolate";

        public String getOutlierMethod() {
            return outlierMethod;
        }

        public void setOutlierMethod(String outlierMethod) {
            this.outlierMethod = outlierMethod;
        }

        public String getOutlierAction() {
            return outlierAction;
        }

        public void setOutlierAction(String outlierAction) {
            this.outlierAction = outlierAction;
        }

        public double getIqrK() {
            return iqrK;
        }

        public void setIqrK(double iqrK) {
            this.iqrK = iqrK;
        }

        public double getZscoreThreshold() {
            return zscoreThreshold;
        }

        public void setZscoreThreshold(double zscoreThreshold) {
            this.zscoreThreshold = zscoreThreshold;
        }

        public String getImputationPolicy() {
            return imputationPolicy;
        }

        public void setImputationPolicy(String imputationPolicy) {
            this.imputationPolicy = imputationPolicy;
        }
    }

    public static class Normalization {
        private String method = "z-score";

        public String getMethod() {
            return method;
        }

        public void setMethod(String method) {
            this.method = method;
        }
    }

    public static class Features {
        private List<Integer> windowSizes = new ArrayList<>(List.of(7));
        private List<Integer> lags = new ArrayList<>(List.of(1, 2, 3));
        private double correlationThreshold = 0.95;
        private String lagEdgePolicy = "drop";
        private boolean squaredFeatures = false;
        private boolean interactionFeatures = false;

        public List<Integer> getWindowSizes() {
            return windowSizes;
        }

        public void setWindowSizes(List<Integer> windowSizes) {
            this.windowSizes = windowSizes;
        }

        public List<Integer> getLags() {
            return lags;
        }

        public void setLags(List<Integer> lags) {
            this.lags = lags;
        }

        public double getCorrelationThreshold() {
            return correlationThreshold;
        }

        public void setCorrelationThreshold(double correlationThreshold) {
            this.correlationThreshold = correlationThreshold;
        }

        public String getLagEdgePolicy() {
            return lagEdgePolicy;
        }

        public void setLagEdgePolicy(String lagEdgePolicy) {
            this.lagEdgePolicy = lagEdgePolicy;
        }

        public boolean isSquaredFeatures() {
            return squaredFeatures;
        }

        public void setSquaredFeatures(boolean squaredFeatures) {
            this.squaredFeatures = squaredFeatures;
        }

        public boolean isInteractionFeatures() {
            return interactionFeatures;
        }

        public void setInteractionFeatures(boolean interactionFeatures) {
            this.interactionFeatures = interactionFeatures;
        }
    }

    public static class Evaluation {
        private int folds = 5;
        private String splitMode = "blocked";
        private int horizon = 1;
        private List<String> models = new ArrayList<>(List.of("random-forest", "gradient-boosting", "svr"));
        private Duration timeout = Duration.ofSeconds(60);
        private int parallelism = Runtime.getRuntime().availableProcessors();

        public int getFolds() {
            return folds;
        }

        public void setFolds(int folds) {
            this.folds = folds;
        }

        public String getSplitMode() {
            return splitMode;
        }

        public void setSplitMode(String splitMode) {
            this.splitMode = splitMode;
        }

        public int getHorizon() {
            return horizon;
        }

        public void setHorizon(int horizon) {
            this.horizon = horizon;
        }

        public List<String> getModels() {
            return models;
        }

        public void setModels(List<String> models) {
            this.models = models;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }
    }

    public static class Anomaly {
        private String method = "rolling-mad";
        private double sensitivity = 3.0;
        private int window = 15;
        private double contamination = 0.1;

        public String getMethod() {
            return method;
        }

        public void setMethod(String method) {
            this.method = method;
        }

        public double getSensitivity() {
            return sensitivity;
        }

        public void setSensitivity(double sensitivity) {
            this.sensitivity = sensitivity;
        }

        public int getWindow() {
            return window;
        }

        public void setWindow(int window) {
            this.window = window;
        }

        public double getContamination() {
            return contamination;
        }

        public void setContamination(double contamination) {
            this.contamination = contamination;
        }
    }

    public static class Trend {
        private int window = 30;
        private String slopeUnit = "step";
        private double confidenceLevel = 0.95;

        public int getWindow() {
            return window;
        }

        public void setWindow(int window) {
            this.window = window;
        }

        public String getSlopeUnit() {
            return slopeUnit;
        }

        public void setSlopeUnit(String slopeUnit) {
            this.slopeUnit = slopeUnit;
        }

        public double getConfidenceLevel() {
            return confidenceLevel;
        }

        public void setConfidenceLevel(double confidenceLevel) {
            this.confidenceLevel = confidenceLevel;
        }
    }

    public static class Cache {
        private int maxEntries = 256;

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }
    }
}
