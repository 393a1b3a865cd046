package io.citysense.metrics.aqi;

import java.util.Locale;

/**
 * Mapping from an AQI value to a status category.
 *
 * <p>{@link #SIX_BIN} is the standard table. {@link #FIVE_BIN} reproduces the table used by the
 * AQI forecast endpoint of the legacy analytics service, which has no hazardous bin and reports
 * everything above 200 as very unhealthy.
 */
public enum SeverityScale {
    SIX_BIN(new int[]{50, 100, 150, 200, 300}, new AqiCategory[]{
            AqiCategory.GOOD, AqiCategory.MODERATE, AqiCategory.UNHEALTHY_SENSITIVE,
            AqiCategory.UNHEALTHY, AqiCategory.VERY_UNHEALTHY, AqiCategory.HAZARDOUS}),
    FIVE_BIN(new int[]{50, 100, 150, 200}, new AqiCategory[]{
            AqiCategory.GOOD, AqiCategory.MODERATE, AqiCategory.UNHEALTHY_SENSITIVE,
            AqiCategory.UNHEALTHY, AqiCategory.VERY_UNHEALTHY});

    // categories[i] covers aqi <= upperBounds[i]; the last category covers the rest
    private final int[] upperBounds;
    private final AqiCategory[] categories;

    SeverityScale(int[] upperBounds, AqiCategory[] categories) {
        this.upperBounds = upperBounds;
        this.categories = categories;
    }

    public AqiCategory classify(int aqi) {
        for (int i = 0; i < upperBounds.length; i++) {
            if (aqi <= upperBounds[i]) {
                return categories[i];
            }
        }
        return categories[categories.length - 1];
    }

    /**
     * Parse a configuration value such as {@code six_bin} or {@code FIVE_BIN}.
     */
    public static SeverityScale fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown AQI severity scale: " + name, e);
        }
    }
}
