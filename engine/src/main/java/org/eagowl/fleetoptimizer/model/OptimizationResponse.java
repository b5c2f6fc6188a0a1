package org.eagowl.fleetoptimizer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationResponse {

    @JsonProperty("optimization_id")
    private String optimizationId;

    @JsonProperty("result")
    private AssignmentResult result;

    @JsonProperty("recommendations")
    private List<Recommendation> recommendations = new ArrayList<>();
}
