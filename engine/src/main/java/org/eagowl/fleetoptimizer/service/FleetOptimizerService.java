package org.eagowl.fleetoptimizer.service;

import org.eagowl.fleetoptimizer.config.OptimizerConfiguration;
import org.eagowl.fleetoptimizer.exception.optimization.InvalidRequestException;
import org.eagowl.fleetoptimizer.exception.optimization.RouteComputationException;
import org.eagowl.fleetoptimizer.ledger.OptimizationLedger;
import org.eagowl.fleetoptimizer.model.AssignmentResult;
import org.eagowl.fleetoptimizer.model.FuelFeasibility;
import org.eagowl.fleetoptimizer.model.HealthResponse;
import org.eagowl.fleetoptimizer.model.HistoryResponse;
import org.eagowl.fleetoptimizer.model.OptimizationRequest;
import org.eagowl.fleetoptimizer.model.OptimizationResponse;
import org.eagowl.fleetoptimizer.model.OptimizationRun;
import org.eagowl.fleetoptimizer.model.Recommendation;
import org.eagowl.fleetoptimizer.model.RecommendationsResponse;
import org.eagowl.fleetoptimizer.model.Vehicle;
import org.eagowl.fleetoptimizer.state.FleetStateRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.UUID;

/**
 * Runs one optimization end to end: assignment, ledger entry, fleet state update and
 * recommendations. A run reaches the ledger only once assignment has fully completed.
 */
@Service
public class FleetOptimizerService implements IFleetOptimizerService {

    private static final Logger logger = LoggerFactory.getLogger(FleetOptimizerService.class);

    private final IAssignmentService assignmentService;
    private final IFuelService fuelService;
    private final IRecommendationService recommendationService;
    private final OptimizationLedger ledger;
    private final FleetStateRegistry fleetStateRegistry;
    private final OptimizerConfiguration optimizerConfig;

    @Autowired
    public FleetOptimizerService(
        IAssignmentService assignmentService,
        IFuelService fuelService,
        IRecommendationService recommendationService,
        OptimizationLedger ledger,
        FleetStateRegistry fleetStateRegistry,
        OptimizerConfiguration optimizerConfig)
    {
        this.assignmentService = assignmentService;
        this.fuelService = fuelService;
        this.recommendationService = recommendationService;
        this.ledger = ledger;
        this.fleetStateRegistry = fleetStateRegistry;
        this.optimizerConfig = optimizerConfig;
    }

    @Override
    public OptimizationResponse optimize(OptimizationRequest request) {
        var deliveries = List.copyOf(request.getDeliveries());
        var vehicles = List.copyOf(request.getVehicles());
        checkUniqueVehicleIds(vehicles);

        logger.info("Starting optimization: deliveries={}, vehicles={}", deliveries.size(), vehicles.size());

        AssignmentResult result;
        try {
            result = assignmentService.assign(deliveries, vehicles);
        } catch (RuntimeException ex) {
            logger.error("Route assignment failed for {} deliveries and {} vehicles",
                deliveries.size(), vehicles.size(), ex);
            throw new RouteComputationException("Route optimization failed", ex);
        }

        var run = new OptimizationRun(
            UUID.randomUUID().toString(),
            Instant.now(),
            deliveries.size(),
            vehicles.size(),
            result.getTotalDeliveriesAssigned(),
            (double) result.getTotalDeliveriesAssigned() / Math.max(1, deliveries.size())
        );
        ledger.record(run);
        fleetStateRegistry.register(vehicles, result.getTotalVehiclesUsed());

        logger.info("Optimization {} done: assigned {}, unassigned {}, efficiency {}",
            run.getId(), run.getAssignmentsMade(), result.getUnassignedDeliveries().size(), run.getEfficiencyScore());

        return new OptimizationResponse(run.getId(), result, currentRecommendations());
    }

    @Override
    public FuelFeasibility fuelEfficiency(Vehicle vehicle, double routeDistanceKm) {
        return fuelService.evaluate(vehicle, routeDistanceKm);
    }

    @Override
    public RecommendationsResponse recommendations() {
        var recommendations = currentRecommendations();
        return new RecommendationsResponse(recommendations, recommendations.size(), Instant.now());
    }

    @Override
    public HistoryResponse history(int limit) {
        var history = ledger.recent(limit);
        return new HistoryResponse(history, ledger.count(), history.size());
    }

    @Override
    public HealthResponse health() {
        return new HealthResponse(
            "healthy",
            Instant.now(),
            optimizerConfig.getServiceName(),
            optimizerConfig.getServiceVersion(),
            fleetStateRegistry.size(),
            fleetStateRegistry.activeRoutes()
        );
    }

    private List<Recommendation> currentRecommendations() {
        return recommendationService.recommend(
            fleetStateRegistry.snapshot(),
            ledger.recent(optimizerConfig.getEfficiencyWindow())
        );
    }

    private static void checkUniqueVehicleIds(List<Vehicle> vehicles) {
        var seen = new HashSet<String>();
        for (Vehicle vehicle : vehicles) {
            if (vehicle.getId() == null)
                throw new InvalidRequestException("Vehicle id must not be null");
            if (!seen.add(vehicle.getId()))
                throw new InvalidRequestException(
                    String.format("Vehicle id %s appears more than once", vehicle.getId()));
        }
    }
}
