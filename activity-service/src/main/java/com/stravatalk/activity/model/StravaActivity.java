package com.stravatalk.activity.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Raw DTO matching the Strava activity JSON (detailed and summary shapes).
 * Kept separate from the domain model to isolate API coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class StravaActivity {

    private Long id;

    private String name;

    private Double distance;

    @JsonProperty("moving_time")
    private Integer movingTime;

    @JsonProperty("elapsed_time")
    private Integer elapsedTime;

    @JsonProperty("total_elevation_gain")
    private Double totalElevationGain;

    private String type;

    @JsonProperty("sport_type")
    private String sportType;

    /** ISO-8601 UTC, e.g. 2024-03-02T07:15:00Z */
    @JsonProperty("start_date")
    private String startDate;

    private Athlete athlete;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Athlete {
        private Long id;
    }
}
