package org.eagowl.fleetoptimizer.service;

import org.eagowl.fleetoptimizer.config.OptimizerConfiguration;
import org.eagowl.fleetoptimizer.model.AssignmentResult;
import org.eagowl.fleetoptimizer.model.DeliveryStop;
import org.eagowl.fleetoptimizer.model.Vehicle;
import org.eagowl.fleetoptimizer.util.GeoUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Greedy partition of deliveries across a fleet.
 *
 * <p>Vehicles are processed once each, best fueled first. Every vehicle takes the first
 * {@code maxStopsPerVehicle} still unassigned deliveries, in submission order, that lie within
 * {@code maxAssignmentRadiusKm} of its current position; those are then sequenced by the route
 * builder. Whatever no vehicle took is reported as unassigned. The caller's lists are only read.
 */
@Service
public class AssignmentService implements IAssignmentService {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentService.class);

    private final IRouteBuilderService routeBuilderService;
    private final OptimizerConfiguration optimizerConfig;

    @Autowired
    public AssignmentService(IRouteBuilderService routeBuilderService, OptimizerConfiguration optimizerConfig) {
        this.routeBuilderService = routeBuilderService;
        this.optimizerConfig = optimizerConfig;
    }

    @Override
    public AssignmentResult assign(List<DeliveryStop> deliveries, List<Vehicle> vehicles) {
        var result = new AssignmentResult();

        /* Indexed by position in deliveries, so equal stops are still tracked separately */
        var assigned = new boolean[deliveries.size()];
        int remaining = deliveries.size();

        var orderedVehicles = vehicles.stream()
            .sorted(Comparator.comparingDouble(Vehicle::fuelRatio).reversed())
            .toList();

        for (Vehicle vehicle : orderedVehicles) {
            if (remaining == 0) {
                break;
            }

            var candidateIndices = findCandidates(vehicle, deliveries, assigned);
            if (candidateIndices.isEmpty()) {
                logger.debug("Vehicle {}: no unassigned delivery within {} km",
                    vehicle.getId(), optimizerConfig.getMaxAssignmentRadiusKm());
                continue;
            }

            var candidates = candidateIndices.stream().map(deliveries::get).toList();
            var route = routeBuilderService.buildRoute(vehicle.getId(), candidates, vehicle.getPosition());
            result.getAssignments().put(vehicle.getId(), route);

            for (int index : candidateIndices) {
                assigned[index] = true;
            }
            remaining -= candidateIndices.size();
        }

        for (int i = 0; i < deliveries.size(); i++) {
            if (!assigned[i]) {
                result.getUnassignedDeliveries().add(deliveries.get(i));
            }
        }

        result.setTotalVehiclesUsed(result.getAssignments().size());
        result.setTotalDeliveriesAssigned(deliveries.size() - remaining);
        result.setOptimizationTimestamp(Instant.now());

        logger.info("Assigned {} of {} deliveries using {} of {} vehicles",
            result.getTotalDeliveriesAssigned(), deliveries.size(),
            result.getTotalVehiclesUsed(), vehicles.size());

        return result;
    }

    private List<Integer> findCandidates(Vehicle vehicle, List<DeliveryStop> deliveries, boolean[] assigned) {
        var candidateIndices = new ArrayList<Integer>();
        var position = vehicle.getPosition();

        for (int i = 0; i < deliveries.size() && candidateIndices.size() < optimizerConfig.getMaxStopsPerVehicle(); i++) {
            if (assigned[i]) {
                continue;
            }
            double distance = GeoUtils.haversineDistance(position, deliveries.get(i).getCoordinates());
            if (distance < optimizerConfig.getMaxAssignmentRadiusKm()) {
                candidateIndices.add(i);
            }
        }

        return candidateIndices;
    }
}
