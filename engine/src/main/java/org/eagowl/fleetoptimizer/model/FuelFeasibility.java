package org.eagowl.fleetoptimizer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class FuelFeasibility {

    @JsonProperty("vehicle_id")
    private String vehicleId;

    @JsonProperty("route_distance")
    private double routeDistance;

    @JsonProperty("estimated_fuel_consumption")
    private double estimatedFuelConsumption;

    @JsonProperty("current_fuel_level")
    private double currentFuelLevel;

    @JsonProperty("max_fuel")
    private double maxFuel;

    @JsonProperty("fuel_deficit")
    private double fuelDeficit;

    @JsonProperty("fuel_percentage")
    private double fuelPercentage;

    @JsonProperty("needs_refuel")
    private boolean needsRefuel;
}
