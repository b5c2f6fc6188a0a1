package org.eagowl.fleetoptimizer.service;

import org.eagowl.fleetoptimizer.model.OptimizationRun;
import org.eagowl.fleetoptimizer.model.Recommendation;
import org.eagowl.fleetoptimizer.model.Vehicle;

import java.util.List;

public interface IRecommendationService {
    List<Recommendation> recommend(List<Vehicle> vehicles, List<OptimizationRun> recentRuns);
}
