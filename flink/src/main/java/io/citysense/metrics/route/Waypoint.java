package io.citysense.metrics.route;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Geographic coordinate with caller-attached metadata.
 * The optimizer reorders waypoints but never touches their metadata.
 *
 * @param <T> metadata type, opaque to routing
 */
public final class Waypoint<T> {

    @JsonProperty("latitude")
    private final double latitude;

    @JsonProperty("longitude")
    private final double longitude;

    @JsonProperty("metadata")
    private final T metadata;

    public Waypoint(double latitude, double longitude, T metadata) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.metadata = metadata;
    }

    public static Waypoint<Void> of(double latitude, double longitude) {
        return new Waypoint<>(latitude, longitude, null);
    }

    public double getLatitude() { return latitude; }
    public double getLongitude() { return longitude; }
    public T getMetadata() { return metadata; }

    @Override
    public String toString() {
        return String.format("Waypoint{lat=%.5f, lon=%.5f, metadata=%s}", latitude, longitude, metadata);
    }
}
