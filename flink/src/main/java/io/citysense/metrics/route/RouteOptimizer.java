package io.citysense.metrics.route;

import io.citysense.utils.GeoUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy nearest-neighbour tour construction.
 *
 * <p>The first input waypoint is the fixed start; each step appends the closest unvisited
 * waypoint. This is an O(n²) heuristic, not an optimal travelling-salesman solver.
 */
public final class RouteOptimizer {

    private RouteOptimizer() {}

    public static <T> OptimizedRoute<T> optimize(List<Waypoint<T>> waypoints) {
        if (waypoints.size() < 2) {
            return new OptimizedRoute<>(new ArrayList<>(waypoints), 0.0);
        }

        List<Waypoint<T>> unvisited = new ArrayList<>(waypoints);
        List<Waypoint<T>> route = new ArrayList<>(waypoints.size());
        route.add(unvisited.remove(0));

        while (!unvisited.isEmpty()) {
            Waypoint<T> last = route.get(route.size() - 1);

            // Strict comparison: on ties the earliest input waypoint wins
            int nearestIndex = 0;
            double nearestDistance = distance(last, unvisited.get(0));
            for (int i = 1; i < unvisited.size(); i++) {
                double d = distance(last, unvisited.get(i));
                if (d < nearestDistance) {
                    nearestDistance = d;
                    nearestIndex = i;
                }
            }

            route.add(unvisited.remove(nearestIndex));
        }

        return new OptimizedRoute<>(route, totalDistanceKm(route));
    }

    /**
     * Sum of the legs between consecutive waypoints, in the given order.
     */
    public static double totalDistanceKm(List<? extends Waypoint<?>> route) {
        double total = 0.0;
        for (int i = 0; i < route.size() - 1; i++) {
            total += distance(route.get(i), route.get(i + 1));
        }
        return total;
    }

    private static double distance(Waypoint<?> a, Waypoint<?> b) {
        return GeoUtils.haversineDistanceKm(
                a.getLatitude(), a.getLongitude(),
                b.getLatitude(), b.getLongitude());
    }
}
