package io.citysense.metrics.prediction;

/**
 * Average passenger count of a vehicle for one (hour of day, day of week) slot.
 * Day of week follows the PostgreSQL DOW convention: Sunday = 0 ... Saturday = 6.
 */
public final class DemandObservation {

    private final int hour;
    private final int dayOfWeek;
    private final double averagePassengers;

    public DemandObservation(int hour, int dayOfWeek, double averagePassengers) {
        this.hour = hour;
        this.dayOfWeek = dayOfWeek;
        this.averagePassengers = averagePassengers;
    }

    public int getHour() { return hour; }
    public int getDayOfWeek() { return dayOfWeek; }
    public double getAveragePassengers() { return averagePassengers; }
}
