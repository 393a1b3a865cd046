package io.citysense.metrics.aqi;

/**
 * One bracket of a piecewise-linear AQI breakpoint table.
 *
 * <p>A concentration belongs to the first bracket whose {@code upperBound} is not below it.
 * Interpolation runs between the reference concentrations and the index range. For closed
 * brackets the reference concentrations are the bracket bounds; the open-ended top bracket
 * carries its own fixed reference pair.
 */
final class Breakpoint {

    private final double upperBound;
    private final double referenceLow;
    private final double referenceHigh;
    private final double indexLow;
    private final double indexHigh;

    private Breakpoint(double upperBound, double referenceLow, double referenceHigh,
                       double indexLow, double indexHigh) {
        this.upperBound = upperBound;
        this.referenceLow = referenceLow;
        this.referenceHigh = referenceHigh;
        this.indexLow = indexLow;
        this.indexHigh = indexHigh;
    }

    static Breakpoint closed(double low, double high, double indexLow, double indexHigh) {
        return new Breakpoint(high, low, high, indexLow, indexHigh);
    }

    static Breakpoint open(double referenceLow, double referenceHigh, double indexLow, double indexHigh) {
        return new Breakpoint(Double.POSITIVE_INFINITY, referenceLow, referenceHigh, indexLow, indexHigh);
    }

    boolean contains(double concentration) {
        return concentration <= upperBound;
    }

    double subIndex(double concentration) {
        // Fraction first: at a bracket's upper bound this is exactly 1.0, keeping boundary indices integral.
        double fraction = (concentration - referenceLow) / (referenceHigh - referenceLow);
        return indexLow + (indexHigh - indexLow) * fraction;
    }

    static double subIndex(Breakpoint[] table, double concentration) {
        for (Breakpoint bracket : table) {
            if (bracket.contains(concentration)) {
                return bracket.subIndex(concentration);
            }
        }
        throw new IllegalStateException("Breakpoint table has no bracket for " + concentration);
    }
}
