package io.citysense.metrics.aqi;

import io.citysense.metrics.InvalidInputException;

/**
 * Air Quality Index from pollutant concentrations.
 *
 * <p>Only PM2.5 and PM10 contribute to the index. CO, NO2 and O3 are carried on readings but
 * have no breakpoint table and never change the result.
 */
public final class AqiCalculator {

    private static final Breakpoint[] PM25_TABLE = {
            Breakpoint.closed(0, 12, 0, 50),
            Breakpoint.closed(12, 35.4, 50, 100),
            Breakpoint.closed(35.4, 55.4, 100, 150),
            Breakpoint.closed(55.4, 150.4, 150, 200),
            Breakpoint.open(150.5, 250, 200, 300)
    };

    private static final Breakpoint[] PM10_TABLE = {
            Breakpoint.closed(0, 54, 0, 50),
            Breakpoint.closed(54, 154, 50, 100),
            Breakpoint.closed(154, 254, 100, 150),
            Breakpoint.open(255, 354, 150, 200)
    };

    private AqiCalculator() {}

    /**
     * Calculate the AQI as the floored maximum sub-index over the indexed pollutants present.
     *
     * @return AQI value, 0 when neither PM2.5 nor PM10 was measured
     */
    public static int calculate(PollutantReading reading) {
        double max = Double.NEGATIVE_INFINITY;
        boolean any = false;

        for (Pollutant pollutant : new Pollutant[]{Pollutant.PM25, Pollutant.PM10}) {
            Double concentration = reading.get(pollutant);
            if (concentration != null) {
                max = Math.max(max, subIndex(pollutant, concentration));
                any = true;
            }
        }

        return any ? (int) Math.floor(max) : 0;
    }

    public static int calculate(Double pm25, Double pm10) {
        return calculate(PollutantReading.of(pm25, pm10));
    }

    /**
     * Sub-index of a single pollutant, before flooring.
     *
     * @throws IllegalArgumentException if the pollutant has no breakpoint table
     * @throws InvalidInputException if the concentration is negative or NaN
     */
    public static double subIndex(Pollutant pollutant, double concentration) {
        if (Double.isNaN(concentration) || concentration < 0) {
            throw new InvalidInputException("Invalid " + pollutant.getFieldName()
                    + " concentration: " + concentration);
        }
        switch (pollutant) {
            case PM25:
                return Breakpoint.subIndex(PM25_TABLE, concentration);
            case PM10:
                return Breakpoint.subIndex(PM10_TABLE, concentration);
            default:
                throw new IllegalArgumentException("No AQI breakpoint table for " + pollutant);
        }
    }

    public static boolean isIndexed(Pollutant pollutant) {
        return pollutant == Pollutant.PM25 || pollutant == Pollutant.PM10;
    }

    /**
     * Status on the standard six-bin scale.
     */
    public static AqiCategory status(int aqi) {
        return SeverityScale.SIX_BIN.classify(aqi);
    }
}
