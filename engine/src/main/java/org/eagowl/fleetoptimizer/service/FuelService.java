package org.eagowl.fleetoptimizer.service;

import org.eagowl.fleetoptimizer.config.OptimizerConfiguration;
import org.eagowl.fleetoptimizer.model.FuelFeasibility;
import org.eagowl.fleetoptimizer.model.Vehicle;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class FuelService implements IFuelService {

    private final OptimizerConfiguration optimizerConfig;

    @Autowired
    public FuelService(OptimizerConfiguration optimizerConfig) {
        this.optimizerConfig = optimizerConfig;
    }

    @Override
    public FuelFeasibility evaluate(Vehicle vehicle, double routeDistanceKm) {
        double consumption = routeDistanceKm * optimizerConfig.getFuelConsumptionPerKm();
        double deficit = Math.max(0, consumption - vehicle.getFuelLevel());

        var feasibility = new FuelFeasibility();
        feasibility.setVehicleId(vehicle.getId());
        feasibility.setRouteDistance(routeDistanceKm);
        feasibility.setEstimatedFuelConsumption(consumption);
        feasibility.setCurrentFuelLevel(vehicle.getFuelLevel());
        feasibility.setMaxFuel(vehicle.getMaxFuel());
        feasibility.setFuelDeficit(deficit);
        feasibility.setFuelPercentage(vehicle.fuelPercentage());
        feasibility.setNeedsRefuel(deficit > optimizerConfig.getRefuelDeficitThresholdLiters());
        return feasibility;
    }
}
