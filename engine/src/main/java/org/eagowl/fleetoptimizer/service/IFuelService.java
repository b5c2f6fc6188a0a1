package org.eagowl.fleetoptimizer.service;

import org.eagowl.fleetoptimizer.model.FuelFeasibility;
import org.eagowl.fleetoptimizer.model.Vehicle;

public interface IFuelService {
    FuelFeasibility evaluate(Vehicle vehicle, double routeDistanceKm);
}
