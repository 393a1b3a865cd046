package io.citysense.metrics.route;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * Ordered tour produced by {@link RouteOptimizer}.
 */
public final class OptimizedRoute<T> {

    private final List<Waypoint<T>> waypoints;
    private final double totalDistanceKm;

    OptimizedRoute(List<Waypoint<T>> waypoints, double totalDistanceKm) {
        this.waypoints = Collections.unmodifiableList(waypoints);
        this.totalDistanceKm = totalDistanceKm;
    }

    @JsonProperty("optimized_route")
    public List<Waypoint<T>> getWaypoints() {
        return waypoints;
    }

    /**
     * Unrounded sum of the great-circle legs.
     */
    @JsonIgnore
    public double getTotalDistanceKm() {
        return totalDistanceKm;
    }

    @JsonProperty("total_distance_km")
    public double getRoundedDistanceKm() {
        return Math.round(totalDistanceKm * 100.0) / 100.0;
    }

    @JsonProperty("waypoint_count")
    public int getWaypointCount() {
        return waypoints.size();
    }

    @Override
    public String toString() {
        return String.format("OptimizedRoute{waypoints=%d, distanceKm=%.2f}", waypoints.size(), totalDistanceKm);
    }
}
