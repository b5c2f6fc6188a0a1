package org.eagowl.fleetoptimizer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationsResponse {

    @JsonProperty("recommendations")
    private List<Recommendation> recommendations = new ArrayList<>();

    @JsonProperty("total_count")
    private int totalCount;

    @JsonProperty("timestamp")
    private Instant timestamp;
}
