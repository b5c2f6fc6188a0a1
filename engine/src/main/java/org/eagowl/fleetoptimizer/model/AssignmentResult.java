package org.eagowl.fleetoptimizer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
public class AssignmentResult {

    /* Keyed by vehicle id, in the order vehicles were processed */
    @JsonProperty("assignments")
    private Map<String, RouteAssignment> assignments = new LinkedHashMap<>();

    @JsonProperty("unassigned_deliveries")
    private List<DeliveryStop> unassignedDeliveries = new ArrayList<>();

    @JsonProperty("total_vehicles_used")
    private int totalVehiclesUsed;

    @JsonProperty("total_deliveries_assigned")
    private int totalDeliveriesAssigned;

    @JsonProperty("optimization_timestamp")
    private Instant optimizationTimestamp;
}
