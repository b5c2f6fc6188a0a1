package org.eagowl.fleetoptimizer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.eagowl.fleetoptimizer.converter.LowercaseEnumSerializer;

@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Recommendation {

    @JsonProperty("type")
    @JsonSerialize(using = LowercaseEnumSerializer.class)
    private RecommendationType type;

    /* Fleet-wide recommendations leave the vehicle fields null */
    @JsonProperty("vehicle_id")
    private String vehicleId;

    @JsonProperty("driver_name")
    private String driverName;

    @JsonProperty("fuel_percentage")
    private Double fuelPercentage;

    @JsonProperty("priority")
    @JsonSerialize(using = LowercaseEnumSerializer.class)
    private RecommendationPriority priority;

    @JsonProperty("message")
    private String message;

    @JsonProperty("recommendation")
    private String recommendation;
}
