package org.eagowl.fleetoptimizer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;

/**
 * Summary of one completed optimization. Recorded once in the ledger and never changed.
 */
@Value
public class OptimizationRun {

    @JsonProperty("id")
    String id;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("total_deliveries")
    int totalDeliveries;

    @JsonProperty("total_vehicles")
    int totalVehicles;

    @JsonProperty("assignments_made")
    int assignmentsMade;

    /* assignments made / max(1, total deliveries) */
    @JsonProperty("efficiency_score")
    double efficiencyScore;
}
