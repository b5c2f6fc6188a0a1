package org.eagowl.fleetoptimizer.service;

import org.eagowl.fleetoptimizer.model.FuelFeasibility;
import org.eagowl.fleetoptimizer.model.HealthResponse;
import org.eagowl.fleetoptimizer.model.HistoryResponse;
import org.eagowl.fleetoptimizer.model.OptimizationRequest;
import org.eagowl.fleetoptimizer.model.OptimizationResponse;
import org.eagowl.fleetoptimizer.model.RecommendationsResponse;
import org.eagowl.fleetoptimizer.model.Vehicle;

public interface IFleetOptimizerService {
    OptimizationResponse optimize(OptimizationRequest request);
    FuelFeasibility fuelEfficiency(Vehicle vehicle, double routeDistanceKm);
    RecommendationsResponse recommendations();
    HistoryResponse history(int limit);
    HealthResponse health();
}
