package org.eagowl.fleetoptimizer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationRequest {

    @NotNull
    @JsonProperty("deliveries")
    private List<@NotNull @Valid DeliveryStop> deliveries = new ArrayList<>();

    @NotNull
    @JsonProperty("vehicles")
    private List<@NotNull @Valid Vehicle> vehicles = new ArrayList<>();
}
