package org.eagowl.fleetoptimizer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Vehicle {

    @JsonProperty("id")
    private String id = UUID.randomUUID().toString();

    @JsonProperty("driver_name")
    private String driverName = "Unknown";

    /* Accepted for completeness, assignment never checks it */
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

    @JsonIgnore
    public Coordinate getPosition() {
        return new Coordinate(currentLat, currentLon);
    }

    /** Fraction of the tank currently filled, in [0, 1] for consistent input. */
    public double fuelRatio() {
        return fuelLevel / maxFuel;
    }

    public double fuelPercentage() {
        return fuelRatio() * 100;
    }

    public Vehicle copy() {
        return new Vehicle(id, driverName, capacity, currentLat, currentLon, fuelLevel, maxFuel);
    }
}
