package org.eagowl.fleetoptimizer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Flat vehicle description plus the distance of the route to check.
 */
@Data
@NoArgsConstructor
public class FuelEfficiencyRequest {

    @JsonProperty("vehicle_id")
    private String vehicleId = "unknown";

    @JsonProperty("driver_name")
    private String driverName = "Unknown";

    @JsonProperty("capacity")
    private double capacity = 1000;

    @JsonProperty("current_lat")
    private double currentLat;

    @JsonProperty("current_lon")
    private double currentLon;

    @PositiveOrZero
    @JsonProperty("fuel_level")
    private double fuelLevel = 50;

    @Positive
    @JsonProperty("max_fuel")
    private double maxFuel = 60;

    /* Kilometers */
    @PositiveOrZero
    @JsonProperty("route_distance")
    private double routeDistance;

    public Vehicle toVehicle() {
        return new Vehicle(vehicleId, driverName, capacity, currentLat, currentLon, fuelLevel, maxFuel);
    }
}
