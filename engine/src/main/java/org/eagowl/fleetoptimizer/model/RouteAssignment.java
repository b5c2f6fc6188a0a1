package org.eagowl.fleetoptimizer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class RouteAssignment {
    public static final String NEAREST_NEIGHBOR_WITH_PRIORITY = "nearest_neighbor_with_priority";

    @JsonProperty("vehicle_id")
    private String vehicleId = "";

    /* Stops in visiting order */
    @JsonProperty("route")
    private List<DeliveryStop> route = new ArrayList<>();

    /* Kilometers */
    @JsonProperty("total_distance")
    private double totalDistance;

    /* Minutes, travel plus service */
    @JsonProperty("estimated_time")
    private double estimatedTime;

    @JsonProperty("stops_count")
    private int stopsCount;

    @JsonProperty("optimization_method")
    private String optimizationMethod = NEAREST_NEIGHBOR_WITH_PRIORITY;
}
