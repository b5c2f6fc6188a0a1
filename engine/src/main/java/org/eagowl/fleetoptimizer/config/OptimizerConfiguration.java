package org.eagowl.fleetoptimizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "optimizer")
public class OptimizerConfiguration {
    private String serviceName = "fleet-optimizer";
    private String serviceVersion = "1.0.0";

    /* Assignment */
    private int maxStopsPerVehicle = 5;
    private double maxAssignmentRadiusKm = 50;

    /* Sequencing */
    private double averageSpeedKmh = 40;
    private double priorityDiscountStep = 0.1;

    /* Fuel, in liters */
    private double fuelConsumptionPerKm = 0.08;
    private double refuelDeficitThresholdLiters = 5;

    /* Recommendations */
    private double fuelAlertPercentage = 20;
    private double fuelWarningPercentage = 40;
    private int efficiencyWindow = 5;
    private double efficiencyThreshold = 0.7;

    private int ledgerCapacity = 100;
    private int fleetCapacity = 500;
    private int workerThreads = 10;
}
