package org.eagowl.fleetoptimizer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * A stop to be visited by one vehicle. Priority 1 is the most urgent, 5 the least.
 * The time window is informational and never enforced when routing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryStop {
    public static final int HIGHEST_PRIORITY = 1;
    public static final int LOWEST_PRIORITY = 5;

    @JsonProperty("id")
    private String id = UUID.randomUUID().toString();

    @JsonProperty("name")
    private String name = "Delivery Point";

    @NotNull
    @JsonProperty("latitude")
    private Double latitude;

    @NotNull
    @JsonProperty("longitude")
    private Double longitude;

    @Min(HIGHEST_PRIORITY)
    @Max(LOWEST_PRIORITY)
    @JsonProperty("priority")
    private int priority = 3;

    @JsonProperty("time_window_start")
    private String timeWindowStart = "09:00";

    @JsonProperty("time_window_end")
    private String timeWindowEnd = "17:00";

    /* Minutes spent on site */
    @PositiveOrZero
    @JsonProperty("estimated_duration")
    private int estimatedDuration = 15;

    @JsonIgnore
    public Coordinate getCoordinates() {
        return new Coordinate(latitude, longitude);
    }
}
