package it.floro.analytics.domain;

/**
 * Requisiti minimi che un dataset deve soddisfare per essere analizzabile.
 */
public record ValidationRequirements(int minPoints) {

    public static final int DEFAULT_MIN_POINTS = 3;

    public ValidationRequirements {
        if (minPoints < 1) {
            throw new IllegalArgumentException("minPoints deve essere >= 1");
        }
    }

    public static ValidationRequirements defaults() {
        return new ValidationRequirements(DEFAULT_MIN_POINTS);
    }
}
