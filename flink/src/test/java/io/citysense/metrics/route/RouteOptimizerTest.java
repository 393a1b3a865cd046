package io.citysense.metrics.route;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.citysense.utils.GeoUtils;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RouteOptimizerTest {

    @Test
    void testEmptyRoute() {
        OptimizedRoute<String> route = RouteOptimizer.optimize(Collections.<Waypoint<String>>emptyList());

        assertThat(route.getWaypoints()).isEmpty();
        assertThat(route.getTotalDistanceKm()).isZero();
    }

    @Test
    void testSingleWaypointUnchanged() {
        Waypoint<String> only = stop(60.17, 24.94, "depot");

        OptimizedRoute<String> route = RouteOptimizer.optimize(Collections.singletonList(only));

        assertThat(route.getWaypoints()).containsExactly(only);
        assertThat(route.getTotalDistanceKm()).isZero();
    }

    @Test
    void testTwoWaypointsDistance() {
        Waypoint<String> a = stop(60.1699, 24.9384, "central");
        Waypoint<String> b = stop(60.3172, 24.9633, "airport");

        OptimizedRoute<String> route = RouteOptimizer.optimize(Arrays.asList(a, b));

        assertThat(route.getWaypoints()).containsExactly(a, b);
        assertThat(route.getTotalDistanceKm())
                .isEqualTo(GeoUtils.haversineDistanceKm(60.1699, 24.9384, 60.3172, 24.9633));
    }

    @Test
    void testNearestNeighbourOrder() {
        Waypoint<String> start = stop(0, 0, "A");
        Waypoint<String> far = stop(0, 3, "B");
        Waypoint<String> near = stop(0, 1, "C");
        Waypoint<String> middle = stop(0, 2, "D");

        OptimizedRoute<String> route = RouteOptimizer.optimize(Arrays.asList(start, far, near, middle));

        assertThat(route.getWaypoints()).containsExactly(start, near, middle, far);
        assertThat(route.getTotalDistanceKm())
                .isCloseTo(GeoUtils.haversineDistanceKm(0, 0, 0, 3), within(1e-9));
        assertThat(route.getWaypointCount()).isEqualTo(4);
    }

    @Test
    void testFirstWaypointStaysFirstAndAllAreVisited() {
        List<Waypoint<String>> input = Arrays.asList(
                stop(52.52, 13.40, "berlin"),
                stop(48.86, 2.35, "paris"),
                stop(51.51, -0.13, "london"),
                stop(52.37, 4.90, "amsterdam"),
                stop(50.85, 4.35, "brussels"));

        OptimizedRoute<String> route = RouteOptimizer.optimize(input);

        assertThat(route.getWaypoints().get(0)).isSameAs(input.get(0));
        assertThat(route.getWaypoints()).containsExactlyInAnyOrderElementsOf(input);
        assertThat(route.getTotalDistanceKm()).isPositive();
        assertThat(route.getTotalDistanceKm())
                .isCloseTo(RouteOptimizer.totalDistanceKm(route.getWaypoints()), within(1e-9));
    }

    @Test
    void testTieGoesToEarliestInput() {
        Waypoint<String> start = stop(0, 0, "start");
        Waypoint<String> first = stop(0, 1, "first");
        Waypoint<String> second = stop(0, 1, "second");

        OptimizedRoute<String> route = RouteOptimizer.optimize(Arrays.asList(start, first, second));

        assertThat(route.getWaypoints()).containsExactly(start, first, second);
    }

    @Test
    void testMetadataSurvivesReordering() {
        int[] payload = {7, 8, 9};
        Waypoint<int[]> start = new Waypoint<>(0, 0, new int[0]);
        Waypoint<int[]> stop = new Waypoint<>(0, 1, payload);

        OptimizedRoute<int[]> route = RouteOptimizer.optimize(Arrays.asList(start, stop));

        assertThat(route.getWaypoints().get(1).getMetadata()).isSameAs(payload).containsExactly(7, 8, 9);
    }

    @Test
    void testJsonFieldNames() throws Exception {
        OptimizedRoute<String> route = RouteOptimizer.optimize(Arrays.asList(
                stop(0, 0, "A"), stop(0, 1, "B")));

        JsonNode json = new ObjectMapper().valueToTree(route);

        assertThat(json.get("optimized_route")).hasSize(2);
        assertThat(json.get("waypoint_count").asInt()).isEqualTo(2);
        assertThat(json.get("total_distance_km").asDouble()).isEqualTo(111.19);
        assertThat(json.has("totalDistanceKm")).isFalse();
    }

    private static Waypoint<String> stop(double lat, double lon, String name) {
        return new Waypoint<>(lat, lon, name);
    }
}
