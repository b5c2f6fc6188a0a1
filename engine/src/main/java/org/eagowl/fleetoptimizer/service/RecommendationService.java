package org.eagowl.fleetoptimizer.service;

import org.eagowl.fleetoptimizer.config.OptimizerConfiguration;
import org.eagowl.fleetoptimizer.model.OptimizationRun;
import org.eagowl.fleetoptimizer.model.Recommendation;
import org.eagowl.fleetoptimizer.model.RecommendationPriority;
import org.eagowl.fleetoptimizer.model.RecommendationType;
import org.eagowl.fleetoptimizer.model.Vehicle;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fuel recommendations per vehicle, in the order given, followed by at most one fleet-wide
 * efficiency recommendation computed from the most recent optimization runs.
 */
@Service
public class RecommendationService implements IRecommendationService {

    private final OptimizerConfiguration optimizerConfig;

    @Autowired
    public RecommendationService(OptimizerConfiguration optimizerConfig) {
        this.optimizerConfig = optimizerConfig;
    }

    @Override
    public List<Recommendation> recommend(List<Vehicle> vehicles, List<OptimizationRun> recentRuns) {
        var recommendations = new ArrayList<Recommendation>();

        for (Vehicle vehicle : vehicles) {
            double fuelPercentage = vehicle.fuelPercentage();

            if (fuelPercentage < optimizerConfig.getFuelAlertPercentage()) {
                recommendations.add(vehicleRecommendation(
                    vehicle,
                    RecommendationType.FUEL_ALERT,
                    RecommendationPriority.HIGH,
                    String.format(Locale.ROOT, "Vehicle %s (%s) needs refueling urgently, fuel at %.1f%%",
                        vehicle.getId(), vehicle.getDriverName(), fuelPercentage),
                    "Route vehicle to nearest fuel station"));
            } else if (fuelPercentage < optimizerConfig.getFuelWarningPercentage()) {
                recommendations.add(vehicleRecommendation(
                    vehicle,
                    RecommendationType.FUEL_WARNING,
                    RecommendationPriority.MEDIUM,
                    String.format(Locale.ROOT, "Vehicle %s (%s) fuel level is low at %.1f%%",
                        vehicle.getId(), vehicle.getDriverName(), fuelPercentage),
                    "Plan refuel within next 4 hours"));
            }
        }

        int window = optimizerConfig.getEfficiencyWindow();
        if (window > 0 && recentRuns.size() >= window) {
            double averageEfficiency = recentRuns.subList(recentRuns.size() - window, recentRuns.size())
                .stream()
                .mapToDouble(OptimizationRun::getEfficiencyScore)
                .average()
                .orElse(0);

            if (averageEfficiency < optimizerConfig.getEfficiencyThreshold()) {
                var recommendation = new Recommendation();
                recommendation.setType(RecommendationType.EFFICIENCY_IMPROVEMENT);
                recommendation.setPriority(RecommendationPriority.MEDIUM);
                recommendation.setMessage(String.format(Locale.ROOT,
                    "Fleet efficiency is below optimal (%.1f%%)", averageEfficiency * 100));
                recommendation.setRecommendation("Consider reassigning delivery zones or adjusting time windows");
                recommendations.add(recommendation);
            }
        }

        return recommendations;
    }

    private static Recommendation vehicleRecommendation(
        Vehicle vehicle,
        RecommendationType type,
        RecommendationPriority priority,
        String message,
        String advice)
    {
        var recommendation = new Recommendation();
        recommendation.setType(type);
        recommendation.setVehicleId(vehicle.getId());
        recommendation.setDriverName(vehicle.getDriverName());
        recommendation.setFuelPercentage(vehicle.fuelPercentage());
        recommendation.setPriority(priority);
        recommendation.setMessage(message);
        recommendation.setRecommendation(advice);
        return recommendation;
    }
}
