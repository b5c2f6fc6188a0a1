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
public class HistoryResponse {

    /* Oldest first */
    @JsonProperty("history")
    private List<OptimizationRun> history = new ArrayList<>();

    /* Runs recorded since startup, including those no longer retained */
    @JsonProperty("total_count")
    private long totalCount;

    @JsonProperty("showing")
    private int showing;
}
