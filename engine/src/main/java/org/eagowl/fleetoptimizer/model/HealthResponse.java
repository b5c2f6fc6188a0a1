package org.eagowl.fleetoptimizer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {

    @JsonProperty("status")
    private String status;

    @JsonProperty("timestamp")
    private Instant timestamp;

    @JsonProperty("service")
    private String service;

    @JsonProperty("version")
    private String version;

    @JsonProperty("vehicles_registered")
    private int vehiclesRegistered;

    @JsonProperty("active_routes")
    private int activeRoutes;
}
