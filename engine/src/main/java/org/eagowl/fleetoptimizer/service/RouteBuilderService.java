package org.eagowl.fleetoptimizer.service;

import org.eagowl.fleetoptimizer.config.OptimizerConfiguration;
import org.eagowl.fleetoptimizer.model.Coordinate;
import org.eagowl.fleetoptimizer.model.DeliveryStop;
import org.eagowl.fleetoptimizer.model.RouteAssignment;
import org.eagowl.fleetoptimizer.util.GeoUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Sequences the stops of a single vehicle with a greedy nearest-neighbor walk biased by priority.
 *
 * <p>At every step the remaining stop with the lowest adjusted score is visited next, where the
 * adjusted score is the raw distance from the current position scaled by
 * {@code 1 - (priority - 1) * priorityDiscountStep}. The discount only decides the order: the
 * reported total is always the sum of the raw leg distances.
 */
@Service
public class RouteBuilderService implements IRouteBuilderService {

    private static final Logger logger = LoggerFactory.getLogger(RouteBuilderService.class);
    private static final double MINUTES_PER_HOUR = 60;

    private final OptimizerConfiguration optimizerConfig;

    @Autowired
    public RouteBuilderService(OptimizerConfiguration optimizerConfig) {
        this.optimizerConfig = optimizerConfig;
    }

    @Override
    public RouteAssignment buildRoute(String vehicleId, List<DeliveryStop> stops, Coordinate start) {
        var route = new RouteAssignment();
        route.setVehicleId(vehicleId);

        if (stops.isEmpty()) {
            return route;
        }

        var visited = new boolean[stops.size()];
        double currentLat = start.getLatitude();
        double currentLon = start.getLongitude();
        double totalDistance = 0;
        long totalServiceMinutes = 0;

        for (int step = 0; step < stops.size(); step++) {
            int nextIndex = -1;
            double bestScore = Double.POSITIVE_INFINITY;
            double nextDistance = 0;

            for (int i = 0; i < stops.size(); i++) {
                if (visited[i]) {
                    continue;
                }
                var stop = stops.get(i);
                double distance = GeoUtils.haversineDistance(
                    currentLat, currentLon, stop.getLatitude(), stop.getLongitude());
                double score = distance * priorityFactor(stop.getPriority());

                /* Strict comparison keeps the first stop seen on ties */
                if (score < bestScore) {
                    bestScore = score;
                    nextDistance = distance;
                    nextIndex = i;
                }
            }

            if (nextIndex < 0) {
                throw new IllegalStateException(String.format(
                    "No reachable stop left for vehicle %s after %d of %d stops",
                    vehicleId, step, stops.size()));
            }

            var next = stops.get(nextIndex);
            visited[nextIndex] = true;
            route.getRoute().add(next);
            totalDistance += nextDistance;
            totalServiceMinutes += next.getEstimatedDuration();
            currentLat = next.getLatitude();
            currentLon = next.getLongitude();
        }

        route.setTotalDistance(totalDistance);
        route.setEstimatedTime(totalDistance / optimizerConfig.getAverageSpeedKmh() * MINUTES_PER_HOUR
            + totalServiceMinutes);
        route.setStopsCount(route.getRoute().size());

        logger.debug("Vehicle {}: sequenced {} stops, {} km, {} min",
            vehicleId, route.getStopsCount(), route.getTotalDistance(), route.getEstimatedTime());

        return route;
    }

    private double priorityFactor(int priority) {
        return 1.0 - (priority - DeliveryStop.HIGHEST_PRIORITY) * optimizerConfig.getPriorityDiscountStep();
    }
}
